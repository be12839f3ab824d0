package com.baskettecase.mongostudio.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FuzzyMatcher
 */
class FuzzyMatcherTest {

    private static final List<String> COLLECTIONS = List.of("orders", "order_items", "customers", "products");

    @Test
    void testClosestMatchForTypo() {
        assertEquals("orders", FuzzyMatcher.findClosestMatch("ordrs", COLLECTIONS));
        assertEquals("customers", FuzzyMatcher.findClosestMatch("Customer", COLLECTIONS));
    }

    @Test
    void testNoMatchBelowThreshold() {
        assertNull(FuzzyMatcher.findClosestMatch("zzzzzzzz", COLLECTIONS));
        assertTrue(FuzzyMatcher.findClosestMatches("zzzzzzzz", COLLECTIONS).isEmpty());
    }

    @Test
    void testMatchesAreOrderedBestFirst() {
        List<String> matches = FuzzyMatcher.findClosestMatches("order", COLLECTIONS);

        assertEquals("orders", matches.get(0));
        assertTrue(matches.size() <= 3);
    }

    @Test
    void testEmptyInputs() {
        assertNull(FuzzyMatcher.findClosestMatch("", COLLECTIONS));
        assertTrue(FuzzyMatcher.findClosestMatches("orders", List.of()).isEmpty());
        assertTrue(FuzzyMatcher.findClosestMatches(null, COLLECTIONS).isEmpty());
    }

    @Test
    void testSimilarity() {
        assertEquals(1.0, FuzzyMatcher.similarity("abc", "abc"));
        assertEquals(0.0, FuzzyMatcher.similarity("abc", "xyz"));
        assertEquals(1.0, FuzzyMatcher.similarity("", ""));
    }
}
