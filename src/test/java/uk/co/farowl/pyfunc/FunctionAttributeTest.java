// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Test the attributes of {@code function} objects, as exposed by the
 * get-set descriptors in the dictionary of the type. Access is through
 * {@link Abstract#getAttr(Object, String)} and its companions, so that
 * it proceeds as from Python.
 */
@DisplayName("The attributes of a function")
class FunctionAttributeTest extends UnitTestSupport {

    static final PyCode ADD = new PyCode("add",
            new Object[] {"adds two numbers"}, null);

    PyFunction f;
    PyDict globals;

    @BeforeEach
    void setup() {
        globals = Py.dict();
        globals.put("__name__", "mathmod");
        f = new Interpreter(new RecordingEvaluator()).defineFunction(ADD,
                globals, "");
    }

    @Test
    @DisplayName("are get-set descriptors in the type")
    void inTypeDictionary() {
        for (String name : List.of("__code__", "__globals__",
                "__defaults__", "__kwdefaults__", "__closure__",
                "__doc__", "__name__", "__qualname__", "__module__",
                "__dict__", "__annotations__")) {
            Object d = PyFunction.TYPE.getDict().get(name);
            assertNotNull(d, name);
            assertPythonType(PyGetSetDescr.TYPE, d);
        }
    }

    @Nested
    @DisplayName("__code__")
    class Code {

        @Test
        void get() throws Throwable {
            assertSame(ADD, Abstract.getAttr(f, "__code__"));
        }

        @Test
        @DisplayName("may be set to code with the same free variables")
        void set() throws Throwable {
            PyCode c = new PyCode("sub", new Object[0], null);
            Abstract.setAttr(f, "__code__", c);
            assertSame(c, f.getCode());
            // The name is not taken from the new code
            assertEquals("add", f.getName());
        }

        @Test
        @DisplayName("may not be set to a non-code")
        void setNotCode() throws Throwable {
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__code__", "x"),
                    "__code__ must be set to a code object, not a 'str' object");
            assertSame(ADD, f.getCode());
        }

        @Test
        @DisplayName("checks free variables against the closure")
        void setWithClosure() throws Throwable {
            PyCode inner = new PyCode("inner", new Object[0],
                    new String[] {"x", "y"});
            PyFunction g = f.getInterpreter().defineFunction(inner,
                    globals, null, null, null,
                    List.of(new PyCell(), new PyCell()));
            PyCode other = new PyCode("other", new Object[0],
                    new String[] {"a", "b"});
            Abstract.setAttr(g, "__code__", other);
            assertSame(other, g.getCode());
            assertRaises(ValueError.class,
                    () -> Abstract.setAttr(g, "__code__", ADD),
                    "inner() requires a code object with 2 free vars, not 0");
        }

        @Test
        @DisplayName("cannot be deleted")
        void delete() throws Throwable {
            assertRaises(TypeError.class,
                    () -> Abstract.delAttr(f, "__code__"),
                    "cannot delete attribute __code__ from 'function' objects");
            assertSame(ADD, f.getCode());
        }
    }

    @Nested
    @DisplayName("__defaults__")
    class Defaults {

        @Test
        @DisplayName("is None when absent")
        void getAbsent() throws Throwable {
            assertSame(Py.None, Abstract.getAttr(f, "__defaults__"));
        }

        @Test
        @DisplayName("may be set to a tuple")
        void set() throws Throwable {
            PyTuple d = Py.tuple(1, 2);
            Abstract.setAttr(f, "__defaults__", d);
            assertSame(d, Abstract.getAttr(f, "__defaults__"));
            assertSame(d, f.getDefaults());
        }

        @Test
        @DisplayName("may not be set to a non-tuple")
        void setWrongType() throws Throwable {
            PyTuple d = Py.tuple(1);
            f.setDefaults(d);
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__defaults__", 42),
                    "__defaults__ must be set to a tuple, not a 'int' object");
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__defaults__", Py.None),
                    "__defaults__ must be set to a tuple, not a 'NoneType' object");
            assertSame(d, f.getDefaults());
        }

        @Test
        @DisplayName("may be deleted, even when absent")
        void delete() throws Throwable {
            f.setDefaults(Py.tuple(1));
            Abstract.delAttr(f, "__defaults__");
            assertNull(f.getDefaults());
            Abstract.delAttr(f, "__defaults__");
            assertSame(Py.None, Abstract.getAttr(f, "__defaults__"));
        }
    }

    @Nested
    @DisplayName("__kwdefaults__")
    class Kwdefaults {

        @Test
        @DisplayName("may be set to a dict and deleted")
        void setAndDelete() throws Throwable {
            assertSame(Py.None, Abstract.getAttr(f, "__kwdefaults__"));
            PyDict d = Py.dict();
            d.put("b", 2);
            Abstract.setAttr(f, "__kwdefaults__", d);
            assertSame(d, Abstract.getAttr(f, "__kwdefaults__"));
            Abstract.delAttr(f, "__kwdefaults__");
            assertNull(f.getKwdefaults());
        }

        @Test
        @DisplayName("may not be set to a non-dict")
        void setWrongType() throws Throwable {
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__kwdefaults__",
                            Py.tuple()),
                    "__kwdefaults__ must be set to a dict, not a 'tuple' object");
            assertNull(f.getKwdefaults());
        }

        @Test
        @DisplayName("keeps its value when set to a non-dict")
        void setWrongTypeKeepsValue() throws Throwable {
            PyDict d = Py.dict();
            d.put("b", 2);
            f.setKwdefaults(d);
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__kwdefaults__", 42),
                    "__kwdefaults__ must be set to a dict, not a 'int' object");
            assertSame(d, f.getKwdefaults());
            assertSame(d, Abstract.getAttr(f, "__kwdefaults__"));
        }

        @Test
        @DisplayName("may be deleted, even when absent")
        void deleteTwice() throws Throwable {
            f.setKwdefaults(Py.dict());
            Abstract.delAttr(f, "__kwdefaults__");
            Abstract.delAttr(f, "__kwdefaults__");
            assertNull(f.getKwdefaults());
            assertSame(Py.None, Abstract.getAttr(f, "__kwdefaults__"));
        }
    }

    @Nested
    @DisplayName("__annotations__")
    class Annotations {

        @Test
        @DisplayName("may be set to a dict and deleted")
        void setAndDelete() throws Throwable {
            assertSame(Py.None, Abstract.getAttr(f, "__annotations__"));
            PyDict d = Py.dict();
            d.put("return", "int");
            Abstract.setAttr(f, "__annotations__", d);
            assertSame(d, f.getAnnotations());
            Abstract.delAttr(f, "__annotations__");
            assertSame(Py.None, Abstract.getAttr(f, "__annotations__"));
        }

        @Test
        @DisplayName("may not be set to a non-dict")
        void setWrongType() throws Throwable {
            PyDict d = Py.dict();
            d.put("return", "int");
            f.setAnnotations(d);
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__annotations__", "int"),
                    "__annotations__ must be set to a dict, not a 'str' object");
            assertSame(d, f.getAnnotations());
            assertSame(d, Abstract.getAttr(f, "__annotations__"));
        }

        @Test
        @DisplayName("may be deleted, even when absent")
        void deleteTwice() throws Throwable {
            f.setAnnotations(Py.dict());
            Abstract.delAttr(f, "__annotations__");
            Abstract.delAttr(f, "__annotations__");
            assertNull(f.getAnnotations());
            assertSame(Py.None, Abstract.getAttr(f, "__annotations__"));
        }
    }

    @Nested
    @DisplayName("__dict__")
    class Dict {

        @Test
        @DisplayName("may be set to a dict and deleted")
        void setAndDelete() throws Throwable {
            assertSame(Py.None, Abstract.getAttr(f, "__dict__"));
            PyDict d = Py.dict();
            d.put("x", 1);
            Abstract.setAttr(f, "__dict__", d);
            assertSame(d, Abstract.getAttr(f, "__dict__"));
            assertEquals(1, Abstract.getAttr(f, "x"));
            Abstract.delAttr(f, "__dict__");
            assertNull(f.getDict(false));
        }

        @Test
        @DisplayName("may not be set to a non-dict")
        void setWrongType() throws Throwable {
            PyDict d = Py.dict();
            d.put("x", 1);
            Abstract.setAttr(f, "__dict__", d);
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__dict__", 1.5),
                    "__dict__ must be set to a dictionary, not a 'float' object");
            assertSame(d, f.getDict(false));
            assertSame(d, Abstract.getAttr(f, "__dict__"));
            assertEquals(1, Abstract.getAttr(f, "x"));
        }

        @Test
        @DisplayName("may be deleted, even when absent")
        void deleteTwice() throws Throwable {
            Abstract.setAttr(f, "__dict__", Py.dict());
            Abstract.delAttr(f, "__dict__");
            Abstract.delAttr(f, "__dict__");
            assertNull(f.getDict(false));
            assertSame(Py.None, Abstract.getAttr(f, "__dict__"));
        }

        @Test
        @DisplayName("receives other attributes set on the function")
        void arbitraryAttribute() throws Throwable {
            Abstract.setAttr(f, "cached", true);
            assertEquals(true, Abstract.getAttr(f, "cached"));
            Object d = Abstract.getAttr(f, "__dict__");
            assertPythonType(PyDict.TYPE, d);
            assertEquals(true, ((PyDict)d).get("cached"));
            Abstract.delAttr(f, "cached");
            assertNull(Abstract.lookupAttr(f, "cached"));
        }

        @Test
        @DisplayName("is not consulted for a missing attribute")
        void missingAttribute() throws Throwable {
            assertRaises(AttributeError.class,
                    () -> Abstract.getAttr(f, "cached"),
                    "'function' object has no attribute 'cached'");
            assertRaises(AttributeError.class,
                    () -> Abstract.delAttr(f, "cached"),
                    "'function' object has no attribute 'cached'");
        }
    }

    @Nested
    @DisplayName("__name__ and __qualname__")
    class Names {

        @Test
        @DisplayName("may be set to a str")
        void set() throws Throwable {
            Abstract.setAttr(f, "__name__", "plus");
            Abstract.setAttr(f, "__qualname__", "Calc.plus");
            assertEquals("plus", Abstract.getAttr(f, "__name__"));
            assertEquals("Calc.plus", Abstract.getAttr(f, "__qualname__"));
            assertStartsWith("<function Calc.plus at", f.toString());
        }

        @Test
        @DisplayName("may not be set to a non-str")
        void setWrongType() throws Throwable {
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__name__", 42),
                    "__name__ must be set to a string, not a 'int' object");
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__qualname__", Py.None),
                    "__qualname__ must be set to a string, not a 'NoneType' object");
            assertEquals("add", f.getName());
            assertEquals("add", f.getQualname());
        }

        @Test
        @DisplayName("cannot be deleted")
        void delete() throws Throwable {
            assertRaises(TypeError.class,
                    () -> Abstract.delAttr(f, "__name__"),
                    "cannot delete attribute __name__ from 'function' objects");
            assertRaises(TypeError.class,
                    () -> Abstract.setAttr(f, "__qualname__", null),
                    "cannot delete attribute __qualname__ from 'function' objects");
        }
    }

    @Nested
    @DisplayName("__doc__ and __module__")
    class DocAndModule {

        @Test
        @DisplayName("may be set to anything")
        void set() throws Throwable {
            assertEquals("adds two numbers", Abstract.getAttr(f, "__doc__"));
            assertEquals("mathmod", Abstract.getAttr(f, "__module__"));
            Abstract.setAttr(f, "__doc__", 42);
            Abstract.setAttr(f, "__module__", Py.tuple());
            assertEquals(42, Abstract.getAttr(f, "__doc__"));
            assertEquals(PyTuple.EMPTY, Abstract.getAttr(f, "__module__"));
        }

        @Test
        @DisplayName("become None when deleted")
        void delete() throws Throwable {
            Abstract.delAttr(f, "__doc__");
            Abstract.delAttr(f, "__module__");
            assertSame(Py.None, Abstract.getAttr(f, "__doc__"));
            assertSame(Py.None, Abstract.getAttr(f, "__module__"));
        }
    }

    @Nested
    @DisplayName("__globals__ and __closure__")
    class ReadOnly {

        @Test
        void get() throws Throwable {
            assertSame(globals, Abstract.getAttr(f, "__globals__"));
            assertSame(Py.None, Abstract.getAttr(f, "__closure__"));
        }

        @Test
        @DisplayName("give a tuple of cells for a closure")
        void getClosure() throws Throwable {
            PyCell x = new PyCell("x");
            PyCode inner = new PyCode("inner", new Object[0],
                    new String[] {"x"});
            PyFunction g = f.getInterpreter().defineFunction(inner,
                    globals, null, null, null, List.of(x));
            assertEquals(Py.tuple(x), Abstract.getAttr(g, "__closure__"));
        }

        @Test
        @DisplayName("are not writable")
        void setReadOnly() throws Throwable {
            assertRaises(AttributeError.class,
                    () -> Abstract.setAttr(f, "__globals__", Py.dict()),
                    "attribute '__globals__' of 'function' objects is not writable");
            assertRaises(AttributeError.class,
                    () -> Abstract.setAttr(f, "__closure__", Py.tuple()),
                    "attribute '__closure__' of 'function' objects is not writable");
            assertRaises(AttributeError.class,
                    () -> Abstract.delAttr(f, "__globals__"),
                    "attribute '__globals__' of 'function' objects is not writable");
            assertSame(globals, f.getGlobals());
        }
    }
}
