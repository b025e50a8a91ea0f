package org.buildlens.analyzer.interpreter.scope;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestNestingPath {

    @Test
    public void test() {
        NestingPath p = NestingPath.ROOT.push(0).push(2);
        assertEquals("0.2", p.toString());
        assertEquals("-", NestingPath.ROOT.toString());
        assertEquals(2, p.depth());
        assertEquals("0.3", p.incrementLast().toString());
        assertEquals("0", p.pop().toString());
        assertEquals(NestingPath.of(0, 2), p);
    }

    @Test
    public void testPrefix() {
        assertTrue(NestingPath.ROOT.isPrefixOf(NestingPath.of(1, 2)));
        assertTrue(NestingPath.of(1).isPrefixOf(NestingPath.of(1, 2)));
        assertTrue(NestingPath.of(1, 2).isPrefixOf(NestingPath.of(1, 2)));
        assertFalse(NestingPath.of(0).isPrefixOf(NestingPath.of(1, 2)));
        assertFalse(NestingPath.of(1, 2, 0).isPrefixOf(NestingPath.of(1, 2)));
        assertThrows(UnsupportedOperationException.class, NestingPath.ROOT::pop);
    }
}
