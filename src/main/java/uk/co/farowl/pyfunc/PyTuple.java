// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;
import java.util.RandomAccess;
import java.util.StringJoiner;

/**
 * The Python {@code tuple} object. The Java API is that of an
 * unmodifiable {@code List}.
 */
public final class PyTuple extends AbstractList<Object>
        implements RandomAccess, PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("tuple", MethodHandles.lookup())
                    .flagNot(PyType.Flag.BASETYPE));

    /** The elements of the {@code tuple}. */
    final Object[] value;

    /** Convenient constant for a {@code tuple} with zero elements. */
    public static final PyTuple EMPTY = new PyTuple(new Object[0]);

    /**
     * Construct a {@code PyTuple} that embeds the array given. The
     * client promises not to modify the content.
     *
     * @param value the elements (embedded, not copied)
     */
    private PyTuple(Object[] value) { this.value = value; }

    /**
     * Construct a {@code PyTuple} from an array of {@code Object}s. The
     * argument is copied for use, so it is safe to modify an array
     * passed in.
     *
     * @param a source of element values
     * @return a tuple with the given contents or {@link #EMPTY}
     */
    public static PyTuple from(Object[] a) {
        return a.length == 0 ? EMPTY
                : new PyTuple(Arrays.copyOf(a, a.length, Object[].class));
    }

    /**
     * Construct a {@code PyTuple} from the elements of a collection, or
     * if the collection is empty, return {@link #EMPTY}.
     *
     * @param c value of new tuple
     * @return a tuple with the given contents or {@link #EMPTY}
     */
    public static PyTuple from(Collection<?> c) {
        return c.isEmpty() ? EMPTY : new PyTuple(c.toArray());
    }

    /**
     * Unsafely wrap an array in a "tuple view".
     * <p>
     * The array becomes embedded as the value of the tuple. <b>The
     * client therefore promises not to modify the content.</b> For this
     * reason, this method should only ever have package visibility.
     *
     * @param value of the new tuple or {@code null}
     * @return a tuple with the given contents or {@link #EMPTY}
     */
    static PyTuple wrap(Object[] value) {
        if (value == null || value.length == 0)
            return EMPTY;
        else
            return new PyTuple(value);
    }

    /**
     * Return a new {@code tuple} that is {@code first} followed by the
     * elements of this one.
     *
     * @param first element to prepend
     * @return the extended {@code tuple}
     */
    PyTuple prepend(Object first) {
        Object[] a = new Object[value.length + 1];
        a[0] = first;
        System.arraycopy(value, 0, a, 1, value.length);
        return new PyTuple(a);
    }

    /** @return a copy of the elements as an array. */
    @Override
    public Object[] toArray() {
        return Arrays.copyOf(value, value.length, Object[].class);
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public Object get(int i) { return value[i]; }

    @Override
    public int size() { return value.length; }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "(",
                value.length == 1 ? ",)" : ")");
        for (Object v : value) { sj.add(Py.repr(v)); }
        return sj.toString();
    }
}
