package com.calor.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TagCatalogTest {

    @Test
    @DisplayName("Spelled-out forms map directly to their markers")
    void testExpandedForms() {
        assertEquals("F", TagCatalog.findSimilarMarker("FUNCTION"));
        assertEquals("F", TagCatalog.findSimilarMarker("func"));
        assertEquals("/M", TagCatalog.findSimilarMarker("/MODULE"));
        assertEquals("B", TagCatalog.findSimilarMarker("LET"));
    }

    @Test
    @DisplayName("Typos resolve to the nearest marker")
    void testTypo() {
        assertEquals("IFACE", TagCatalog.findSimilarMarker("IFAC"));
        assertEquals("ENUM", TagCatalog.findSimilarMarker("ENUMM"));
    }

    @Test
    @DisplayName("Ties prefer the shorter marker")
    void testShorterWins() {
        assertEquals(1, Levenshtein.distance("X", "M"));
        assertEquals(1, Levenshtein.distance("X", "MX"));
        assertEquals(1, TagCatalog.findSimilarMarker("X").length());
    }

    @Test
    @DisplayName("Descriptions ignore the close slash")
    void testDescribe() {
        assertEquals("Class", TagCatalog.describe("/CL"));
        assertNull(TagCatalog.describe("NOPE"));
    }

    @Test
    @DisplayName("Levenshtein distance is case-insensitive")
    void testDistance() {
        assertEquals(0, Levenshtein.distance("abc", "ABC"));
        assertEquals(3, Levenshtein.distance("", "abc"));
        assertEquals(1, Levenshtein.distance("kitten", "sitten"));
    }
}
