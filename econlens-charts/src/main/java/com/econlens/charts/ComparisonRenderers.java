package com.econlens.charts;

import org.jfree.chart.renderer.category.BarRenderer;
import org.jfree.chart.renderer.category.StandardBarPainter;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;

import java.awt.BasicStroke;
import java.awt.Color;
import java.util.List;

/**
 * Renderers for comparison charts, coloured by selection position.
 */
public final class ComparisonRenderers {

    public static final BasicStroke LINE_STROKE = new BasicStroke(
        1.5f, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND);

    public static final Color PERIOD_CHANGE_COLOR = new Color(59, 130, 246);
    public static final Color YEAR_CHANGE_COLOR = new Color(139, 92, 246);

    private ComparisonRenderers() {}

    /**
     * One line per series; series i is drawn in {@code colors.get(i)}.
     */
    public static XYLineAndShapeRenderer lineRenderer(List<Color> colors) {
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        for (int i = 0; i < colors.size(); i++) {
            renderer.setSeriesPaint(i, colors.get(i));
            renderer.setSeriesStroke(i, LINE_STROKE);
        }
        return renderer;
    }

    /**
     * Flat bars for the period/year change dataset.
     */
    public static BarRenderer changeRenderer() {
        BarRenderer renderer = new BarRenderer();
        renderer.setShadowVisible(false);
        renderer.setBarPainter(new StandardBarPainter());
        renderer.setSeriesPaint(0, PERIOD_CHANGE_COLOR);
        renderer.setSeriesPaint(1, YEAR_CHANGE_COLOR);
        return renderer;
    }
}
