package com.questrail.conformance.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void boxReplacesPrimitivesOnly() {
        assertEquals(Integer.class, Values.box(int.class));
        assertEquals(Void.class, Values.box(void.class));
        assertEquals(String.class, Values.box(String.class));
    }

    @Test
    void sameTypeIgnoresBoxing() {
        assertTrue(Values.sameType(int.class, Integer.class));
        assertTrue(Values.sameType(String.class, String.class));
        assertFalse(Values.sameType(int.class, long.class));
        assertFalse(Values.sameType(Object.class, String.class));
    }

    @Test
    void fitsHonoursNullAndPrimitives() {
        assertTrue(Values.fits(int.class, 5));
        assertFalse(Values.fits(int.class, 5L));
        assertFalse(Values.fits(int.class, null));
        assertTrue(Values.fits(CharSequence.class, "x"));
        assertTrue(Values.fits(String.class, null));
    }

    @Test
    void defaultValues() {
        assertEquals(0, Values.defaultValue(int.class));
        assertEquals(0.0d, Values.defaultValue(Double.class));
        assertEquals("", Values.defaultValue(String.class));
        assertNull(Values.defaultValue(List.class));
    }

    @Test
    void describeRendersDiagnostics() {
        assertEquals("null", Values.describe(null));
        assertEquals("\"a\"", Values.describe("a"));
        assertEquals("'c'", Values.describe('c'));
        assertEquals("[1, [2, 3]]", Values.describe(new Object[]{1, new int[]{2, 3}}));
        assertEquals("[true, false]", Values.describe(new boolean[]{true, false}));
        assertEquals("(1, \"x\", null)", Values.describeArguments(Arrays.asList(1, "x", null)));
    }
}
