package com.econlens.core.catalog;

import com.econlens.core.model.DimensionOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CatalogDimensions outline navigation.
 */
class CatalogDimensionsTest {

    private static final CatalogDimensions DIMS = new CatalogDimensions(Map.of("item", List.of(
        new DimensionOption("SA0", "All items", 0, true, 1),
        new DimensionOption("SAF", "Food and beverages", 1, false, 2),
        new DimensionOption("SAF1", "Food", 2, true, 3),
        new DimensionOption("SAF11", "Food at home", 3, true, 4),
        new DimensionOption("SEFV", "Food away from home", 2, true, 6),
        new DimensionOption("SAH", "Housing", 1, true, 7),
        new DimensionOption("SAF1", "Food", 2, true, 5)
    )));

    @Test
    @DisplayName("Selectable options skip headers and duplicates, in sort order")
    void selectable() {
        List<String> codes = DIMS.selectable("item").stream().map(DimensionOption::code).toList();

        assertEquals(List.of("SA0", "SAF1", "SAF11", "SEFV", "SAH"), codes);
    }

    @Test
    @DisplayName("Children are the options one level deeper until the next sibling")
    void children() {
        assertEquals(List.of("SAF", "SAH"),
            DIMS.childrenOf("item", "SA0").stream().map(DimensionOption::code).toList());
        assertEquals(List.of("SAF1", "SEFV"),
            DIMS.childrenOf("item", "SAF").stream().map(DimensionOption::code).toList());
        assertTrue(DIMS.childrenOf("item", "SAH").isEmpty());
        assertTrue(DIMS.childrenOf("item", "NOPE").isEmpty());
    }

    @Test
    @DisplayName("Roots are the shallowest options")
    void roots() {
        assertEquals(List.of("SA0"), DIMS.roots("item").stream().map(DimensionOption::code).toList());
        assertTrue(DIMS.roots("area").isEmpty());
    }

    @Test
    @DisplayName("Unknown dimensions are empty")
    void unknownDimension() {
        assertTrue(DIMS.options("area").isEmpty());
        assertTrue(CatalogDimensions.EMPTY.isEmpty());
    }
}
