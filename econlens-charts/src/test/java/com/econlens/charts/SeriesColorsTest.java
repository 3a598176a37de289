package com.econlens.charts;

import com.econlens.core.selection.SelectionSet;
import com.econlens.core.selection.SeriesPalette;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SeriesColors and ComparisonRenderers.
 */
class SeriesColorsTest {

    @Test
    @DisplayName("Parses hex colours")
    void parse() {
        assertEquals(new Color(0x3b, 0x82, 0xf6), SeriesColors.parse("#3b82f6"));
        assertThrows(IllegalArgumentException.class, () -> SeriesColors.parse("3b82f6"));
    }

    @Test
    @DisplayName("Selection colours follow the palette by position")
    void forSelection() {
        SelectionSet selection = SelectionSet.of(5, List.of("X", "Y"));

        List<Color> colors = SeriesColors.forSelection(SeriesPalette.COMPACT, selection);

        assertEquals(2, colors.size());
        assertEquals(SeriesColors.parse(SeriesPalette.COMPACT.colorAt(1)), colors.get(1));
    }

    @Test
    @DisplayName("Renderers paint series by position")
    void renderer() {
        List<Color> colors = List.of(Color.RED, Color.BLUE);

        XYLineAndShapeRenderer renderer = ComparisonRenderers.lineRenderer(colors);

        assertEquals(Color.BLUE, renderer.getSeriesPaint(1));
        assertEquals(80, SeriesColors.withAlpha(Color.RED, 80).getAlpha());
        assertEquals(ComparisonRenderers.YEAR_CHANGE_COLOR, ComparisonRenderers.changeRenderer().getSeriesPaint(1));
    }
}
