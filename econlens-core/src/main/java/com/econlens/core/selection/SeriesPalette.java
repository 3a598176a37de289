package com.econlens.core.selection;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered list of chart colours (hex "#rrggbb"). A series gets its colour from
 * its current position in the selection, so removing an earlier member shifts
 * the colours of the ones after it.
 */
public record SeriesPalette(List<String> colors) {

    private static final Pattern HEX = Pattern.compile("#[0-9a-fA-F]{6}");

    /** Fifteen-colour palette used by the comparison charts. */
    public static final SeriesPalette DEFAULT = new SeriesPalette(List.of(
        "#3b82f6", "#22c55e", "#ef4444", "#f97316", "#8b5cf6",
        "#06b6d4", "#ec4899", "#78716c", "#14b8a6", "#f59e0b",
        "#6366f1", "#84cc16", "#a855f7", "#0ea5e9", "#d946ef"
    ));

    /** Eight-colour palette of the national accounts pages. */
    public static final SeriesPalette COMPACT = new SeriesPalette(List.of(
        "#3b82f6", "#10b981", "#ef4444", "#f59e0b", "#8b5cf6", "#06b6d4", "#ec4899", "#84cc16"
    ));

    public SeriesPalette {
        if (colors == null || colors.isEmpty()) {
            throw new IllegalArgumentException("Palette needs at least one colour");
        }
        for (String c : colors) {
            if (c == null || !HEX.matcher(c).matches()) {
                throw new IllegalArgumentException("Not a #rrggbb colour: " + c);
            }
        }
        colors = List.copyOf(colors);
    }

    public int size() {
        return colors.size();
    }

    public String colorAt(int position) {
        return colors.get(Math.floorMod(position, colors.size()));
    }

    /**
     * Colour for {@code id} by its position in {@code selection}; null if not selected.
     */
    public String colorOf(SelectionSet selection, String id) {
        int idx = selection.indexOf(id);
        return idx < 0 ? null : colorAt(idx);
    }
}
