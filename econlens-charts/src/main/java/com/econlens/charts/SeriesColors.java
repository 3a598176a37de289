package com.econlens.charts;

import com.econlens.core.selection.SelectionSet;
import com.econlens.core.selection.SeriesPalette;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts palette hex colours to AWT colours.
 */
public final class SeriesColors {

    private SeriesColors() {}

    /**
     * Parse "#rrggbb".
     */
    public static Color parse(String hex) {
        if (hex == null || !hex.matches("#[0-9a-fA-F]{6}")) {
            throw new IllegalArgumentException("Not a #rrggbb colour: " + hex);
        }
        return new Color(Integer.parseInt(hex.substring(1), 16));
    }

    /**
     * Same colour with the given alpha (0-255), for fills behind lines.
     */
    public static Color withAlpha(Color color, int alpha) {
        return new Color(color.getRed(), color.getGreen(), color.getBlue(), alpha);
    }

    /**
     * Colours of the selected series, in selection order.
     */
    public static List<Color> forSelection(SeriesPalette palette, SelectionSet selection) {
        List<Color> colors = new ArrayList<>(selection.size());
        for (int i = 0; i < selection.size(); i++) {
            colors.add(parse(palette.colorAt(i)));
        }
        return colors;
    }
}
