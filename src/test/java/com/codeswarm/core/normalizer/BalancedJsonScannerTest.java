package com.codeswarm.core.normalizer;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BalancedJsonScannerTest {

    @Test
    void testObjectSurroundedByProse() {
        String text = "Here is my analysis: {\"issues\": []} Hope this helps {not json";

        assertEquals(Optional.of("{\"issues\": []}"), BalancedJsonScanner.firstObject(text));
    }

    @Test
    void testBracesInsideStringsAreIgnored() {
        String text = "{\"d\": \"dict {a: 1 is never closed\"} trailing }";

        assertEquals("{\"d\": \"dict {a: 1 is never closed\"}", BalancedJsonScanner.firstObject(text).orElseThrow());
    }

    @Test
    void testEscapedQuotesDoNotEndTheString() {
        String text = "{\"d\": \"say \\\"}\\\" now\"}";

        assertEquals(text, BalancedJsonScanner.firstObject(text).orElseThrow());
    }

    @Test
    void testNestedObjects() {
        String text = "x {\"a\": {\"b\": {\"c\": 1}}} y";

        assertEquals("{\"a\": {\"b\": {\"c\": 1}}}", BalancedJsonScanner.firstObject(text).orElseThrow());
    }

    @Test
    void testUnbalancedObjectIsEmpty() {
        assertTrue(BalancedJsonScanner.firstObject("{\"issues\": [").isEmpty());
    }

    @Test
    void testScanFromOffset() {
        String text = "{\"a\":1} {\"b\":2}";

        assertEquals("{\"b\":2}", BalancedJsonScanner.firstObject(text, 1).orElseThrow());
    }

    @Test
    void testNullAndBraceFreeInput() {
        assertTrue(BalancedJsonScanner.firstObject(null).isEmpty());
        assertTrue(BalancedJsonScanner.firstObject("no json here").isEmpty());
    }
}
