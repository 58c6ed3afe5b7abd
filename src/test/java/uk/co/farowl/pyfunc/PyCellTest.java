// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Test the {@code cell} object and its {@code cell_contents}. */
class PyCellTest extends UnitTestSupport {

    @Test
    @DisplayName("An empty cell raises ValueError on reading")
    void emptyCell() throws Throwable {
        PyCell c = new PyCell();
        assertNull(c.get());
        assertRaises(ValueError.class,
                () -> Abstract.getAttr(c, "cell_contents"),
                "Cell is empty");
        assertStartsWith("<cell at 0x", c.toString());
        assertTrue(c.toString().endsWith(": empty>"));
    }

    @Test
    @DisplayName("A cell may be set, read and deleted")
    void setGetDelete() throws Throwable {
        PyCell c = new PyCell();
        Abstract.setAttr(c, "cell_contents", 42);
        assertEquals(42, Abstract.getAttr(c, "cell_contents"));
        assertTrue(c.toString().endsWith(": [42]>"));
        Abstract.delAttr(c, "cell_contents");
        assertNull(c.get());
    }

    @Test
    @DisplayName("A cell is shared by reference")
    void shared() {
        PyCell c = new PyCell("a");
        PyTuple t = Py.tuple(c, c);
        c.set("b");
        assertEquals("b", ((PyCell)t.get(0)).get());
        c.del();
        assertNull(((PyCell)t.get(1)).get());
    }
}
