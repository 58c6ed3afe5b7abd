// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.pyfunc.Exposed.Deleter;
import uk.co.farowl.pyfunc.Exposed.DocString;
import uk.co.farowl.pyfunc.Exposed.Getter;
import uk.co.farowl.pyfunc.Exposed.Setter;
import uk.co.farowl.pyfunc.PyGetSetDescr.GetSetDef;

/**
 * Methods for tabulating the attributes of classes that define Python
 * types.
 */
class Exposer {

    /** Logger for the exposure of attributes. */
    static final Logger logger = LoggerFactory.getLogger(Exposer.class);

    private Exposer() {} // No instances

    /** The three roles a method may play in an attribute. */
    private enum Role {
        GET("getter"), SET("setter"), DELETE("deleter");

        final String description;

        Role(String description) { this.description = description; }
    }

    /**
     * Create a table of {@link PyGetSetDescr}s annotated on the given
     * implementation class, on behalf of the type given. This type
     * object will become the {@link Descriptor#objclass} reference of
     * the descriptors created, but is not otherwise accessed, since it
     * is (necessarily) incomplete at this time.
     *
     * @param lookup authorisation to access methods
     * @param implClass to introspect for getters, setters and deleters
     * @param type to which these descriptors apply
     * @return attributes defined (in the order first encountered)
     * @throws InterpreterError on duplicates or unsupported types
     */
    static Map<String, PyGetSetDescr> getsetDescrs(Lookup lookup,
            Class<?> implClass, PyType type) throws InterpreterError {

        // Iterate over methods looking for the relevant annotations
        Map<String, GetSetDef> defs = new LinkedHashMap<>();

        for (Method m : implClass.getDeclaredMethods()) {
            // Look for all three now, so as to detect conflicts.
            Getter getter = m.getAnnotation(Getter.class);
            Setter setter = m.getAnnotation(Setter.class);
            Deleter deleter = m.getAnnotation(Deleter.class);

            int count = (getter != null ? 1 : 0)
                    + (setter != null ? 1 : 0)
                    + (deleter != null ? 1 : 0);
            if (count > 1) {
                throw new InterpreterError(GETSET_MULTIPLE, m.getName(),
                        implClass.getSimpleName());
            }

            String repeated = null;
            if (getter != null) {
                repeated = add(defs, Role.GET, getter.value(), m);
            } else if (setter != null) {
                repeated = add(defs, Role.SET, setter.value(), m);
            } else if (deleter != null) {
                repeated = add(defs, Role.DELETE, deleter.value(), m);
            }

            // If set non-null at any point, indicates a repeat.
            if (repeated != null) {
                throw new InterpreterError(GETSET_REPEAT, repeated,
                        m.getName(), implClass.getSimpleName());
            }
        }

        // For each entry found in the class, construct a descriptor
        Map<String, PyGetSetDescr> descrs = new LinkedHashMap<>();
        for (GetSetDef def : defs.values()) {
            PyGetSetDescr descr = def.create(type, lookup);
            descrs.put(def.name, descr);
            logger.atDebug().setMessage("{}.{}: {}")
                    .addArgument(type::getName).addArgument(def.name)
                    .addArgument(def).log();
        }

        return descrs;
    }

    /**
     * Record a method in the table of {@link GetSetDef}s in the given
     * role. The return from this method is {@code null} for success or
     * a {@code String} identifying a duplicate definition.
     *
     * @param defs table of {@link GetSetDef}s
     * @param role the method plays in the attribute
     * @param name from the annotation (may be blank)
     * @param m method annotated
     * @return {@code null} for success or string naming duplicate
     */
    // Using an error return simplifies getsetDescrs() internally.
    private static String add(Map<String, GetSetDef> defs, Role role,
            String name, Method m) {
        if (name == null || name.length() == 0) { name = m.getName(); }
        GetSetDef def = defs.computeIfAbsent(name, GetSetDef::new);

        Method previous;
        switch (role) {
            case GET:
                previous = def.setGet(m);
                break;
            case SET:
                previous = def.setSet(m);
                break;
            default:
                previous = def.setDelete(m);
        }

        if (previous != null) {
            // There was one already :(
            return role.description + " for " + def.name;
        }

        // May also have DocString annotation to add.
        DocString d = m.getAnnotation(DocString.class);
        if (d != null && def.setDoc(d.value()) != null) {
            return "doc string for " + def.name;
        }
        return null;
    }

    private static final String GETSET_REPEAT =
            "Definition of %s repeated at method %.50s in type %.50s";
    private static final String GETSET_MULTIPLE =
            "Multiple get-set-delete annotations"
                    + " on method %.50s in type %.50s";
}
