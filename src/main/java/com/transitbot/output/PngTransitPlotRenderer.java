package com.transitbot.output;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Stroke;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Two-panel PNG figure: observed flux with the fitted model on top, residuals below.
 */
public class PngTransitPlotRenderer implements TransitPlotRenderer {
    private static final double WIDTH_INCHES = 10.0;
    private static final double HEIGHT_INCHES = 8.0;
    private static final int TICKS = 5;

    private static final Color BACKGROUND = Color.WHITE;
    private static final Color GRID = new Color(220, 226, 236);
    private static final Color AXIS_TEXT = new Color(86, 95, 111);
    private static final Color MODEL = new Color(214, 39, 40);
    private static final Color ZERO_LINE = Color.GRAY;

    private final int dpi;

    public PngTransitPlotRenderer(int dpi) {
        this.dpi = Math.max(20, dpi);
    }

    @Override
    public void render(TransitPlot plot, Path output) throws IOException {
        double scale = dpi / 100.0;
        int width = (int) Math.round(WIDTH_INCHES * dpi);
        int height = (int) Math.round(HEIGHT_INCHES * dpi);
        int left = px(95, scale);
        int right = px(30, scale);
        int top = px(50, scale);
        int gap = px(55, scale);
        int bottom = px(60, scale);
        int pw = width - left - right;
        int usable = height - top - gap - bottom;
        int mainH = usable * 3 / 4;
        int resH = usable - mainH;
        int resTop = top + mainH + gap;

        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, width, height);

            double[] time = plot.getTime();
            double[] flux = plot.getFlux();
            boolean hasData = time != null && time.length > 0;

            Font titleFont = new Font("SansSerif", Font.BOLD, px(16, scale));
            Font labelFont = new Font("SansSerif", Font.PLAIN, px(13, scale));
            Font tickFont = new Font("SansSerif", Font.PLAIN, px(11, scale));

            if (!hasData) {
                drawFrame(g, left, top, pw, mainH);
                drawFrame(g, left, resTop, pw, resH);
                drawTitle(g, titleFont, "Transit " + plot.getTransitIndex() + " - No data", left, top, pw, scale);
                ImageIO.write(img, "png", prepare(output).toFile());
                return;
            }

            double[] xRange = padded(range(time, null));
            double[] yRange = padded(range(flux, plot.hasModel() ? plot.getModel() : null));

            drawGrid(g, tickFont, left, top, pw, mainH, xRange, yRange, false, scale);
            drawFrame(g, left, top, pw, mainH);
            drawPoints(g, time, flux, Color.BLACK, px(4, scale), left, top, pw, mainH, xRange, yRange);

            String title;
            double[] residuals = null;
            if (plot.hasModel()) {
                drawLine(g, time, plot.getModel(), MODEL, 2f * (float) scale, left, top, pw, mainH, xRange, yRange);
                residuals = new double[flux.length];
                for (int i = 0; i < flux.length; i++) {
                    residuals[i] = flux[i] - plot.getModel()[i];
                }
                title = plot.getTtvMinutes() == null
                        ? "Transit"
                        : String.format(Locale.US, "TTV: %.3f min", plot.getTtvMinutes());
            } else {
                title = "Fit failed";
            }
            drawTitle(g, titleFont, "Transit " + plot.getTransitIndex() + " - " + title, left, top, pw, scale);
            drawLegend(g, labelFont, plot.hasModel(), left + pw - px(170, scale), top + px(12, scale), scale);

            double maxAbs = residuals == null ? 0.0 : maxAbs(residuals);
            double[] resRange = maxAbs > 0.0 ? new double[]{-maxAbs * 1.2, maxAbs * 1.2} : new double[]{-1.0, 1.0};
            drawGrid(g, tickFont, left, resTop, pw, resH, xRange, resRange, true, scale);
            drawFrame(g, left, resTop, pw, resH);
            drawZeroLine(g, left, resTop, pw, resH, resRange, scale);
            if (residuals != null) {
                drawPoints(g, time, residuals, Color.BLACK, px(3, scale), left, resTop, pw, resH, xRange, resRange);
            }

            String resTitle;
            if (residuals == null) {
                resTitle = "Residuals (no fitted model)";
            } else if (plot.getRmsResiduals() != null) {
                resTitle = String.format(Locale.US, "RMS Residuals: %.4f", plot.getRmsResiduals());
            } else {
                resTitle = "";
            }
            drawTitle(g, labelFont, resTitle, left, resTop, pw, scale);

            g.setColor(Color.BLACK);
            g.setFont(labelFont);
            g.drawString("Time [BJDS]", left + pw / 2 - px(40, scale), height - px(15, scale));
            drawVertical(g, "Normalized Flux", px(18, scale), top + mainH / 2 + px(50, scale));
        } finally {
            g.dispose();
        }
        ImageIO.write(img, "png", prepare(output).toFile());
    }

    private static Path prepare(Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        return output;
    }

    private static void drawFrame(Graphics2D g, int x, int y, int w, int h) {
        g.setColor(Color.BLACK);
        g.drawRect(x, y, w, h);
    }

    private static void drawTitle(Graphics2D g, Font font, String text, int left, int top, int pw, double scale) {
        g.setColor(Color.BLACK);
        g.setFont(font);
        int textW = g.getFontMetrics().stringWidth(text);
        g.drawString(text, left + (pw - textW) / 2, top - px(10, scale));
    }

    private static void drawGrid(Graphics2D g, Font font, int left, int top, int pw, int ph,
                                 double[] xRange, double[] yRange, boolean xLabels, double scale) {
        g.setFont(font);
        for (int i = 0; i <= TICKS; i++) {
            int y = top + (int) Math.round((double) i / TICKS * ph);
            g.setColor(GRID);
            g.drawLine(left, y, left + pw, y);
            double v = yRange[1] - (yRange[1] - yRange[0]) * i / TICKS;
            g.setColor(AXIS_TEXT);
            g.drawString(String.format(Locale.US, "%.4f", v), px(22, scale), y + px(4, scale));
        }
        for (int i = 0; i <= TICKS; i++) {
            int x = left + (int) Math.round((double) i / TICKS * pw);
            g.setColor(GRID);
            g.drawLine(x, top, x, top + ph);
            if (xLabels) {
                double v = xRange[0] + (xRange[1] - xRange[0]) * i / TICKS;
                g.setColor(AXIS_TEXT);
                g.drawString(String.format(Locale.US, "%.3f", v), x - px(35, scale), top + ph + px(18, scale));
            }
        }
    }

    private static void drawZeroLine(Graphics2D g, int left, int top, int pw, int ph, double[] yRange, double scale) {
        Stroke old = g.getStroke();
        g.setColor(ZERO_LINE);
        g.setStroke(new BasicStroke((float) (0.8 * scale), BasicStroke.CAP_BUTT, BasicStroke.JOIN_ROUND,
                0f, new float[]{6f * (float) scale, 4f * (float) scale}, 0f));
        int y = toY(0.0, yRange, top, ph);
        g.drawLine(left, y, left + pw, y);
        g.setStroke(old);
    }

    private static void drawPoints(Graphics2D g, double[] xs, double[] ys, Color color, int size,
                                   int left, int top, int pw, int ph, double[] xRange, double[] yRange) {
        g.setColor(color);
        for (int i = 0; i < xs.length; i++) {
            if (!Double.isFinite(xs[i]) || !Double.isFinite(ys[i])) {
                continue;
            }
            double x = toXd(xs[i], xRange, left, pw);
            double y = toYd(ys[i], yRange, top, ph);
            g.fill(new Ellipse2D.Double(x - size / 2.0, y - size / 2.0, size, size));
        }
    }

    private static void drawLine(Graphics2D g, double[] xs, double[] ys, Color color, float width,
                                 int left, int top, int pw, int ph, double[] xRange, double[] yRange) {
        Integer[] order = sortedOrder(xs);
        Path2D path = new Path2D.Double();
        boolean started = false;
        for (int idx : order) {
            if (!Double.isFinite(xs[idx]) || !Double.isFinite(ys[idx])) {
                continue;
            }
            double x = toXd(xs[idx], xRange, left, pw);
            double y = toYd(ys[idx], yRange, top, ph);
            if (!started) {
                path.moveTo(x, y);
                started = true;
            } else {
                path.lineTo(x, y);
            }
        }
        Stroke old = g.getStroke();
        g.setColor(color);
        g.setStroke(new BasicStroke(width, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        g.draw(path);
        g.setStroke(old);
    }

    private static void drawLegend(Graphics2D g, Font font, boolean withModel, int x, int y, double scale) {
        int w = px(160, scale);
        int h = withModel ? px(52, scale) : px(30, scale);
        g.setColor(new Color(252, 252, 252));
        g.fillRoundRect(x, y, w, h, 8, 8);
        g.setColor(new Color(180, 187, 197));
        g.drawRoundRect(x, y, w, h, 8, 8);

        g.setFont(font);
        int dot = px(5, scale);
        g.setColor(Color.BLACK);
        g.fill(new Ellipse2D.Double(x + px(18, scale), y + px(15, scale) - dot / 2.0, dot, dot));
        g.drawString("Transit Data", x + px(40, scale), y + px(19, scale));
        if (withModel) {
            Stroke old = g.getStroke();
            g.setColor(MODEL);
            g.setStroke(new BasicStroke(2f * (float) scale));
            g.drawLine(x + px(8, scale), y + px(37, scale), x + px(32, scale), y + px(37, scale));
            g.setStroke(old);
            g.setColor(Color.BLACK);
            g.drawString("Fitted Model", x + px(40, scale), y + px(41, scale));
        }
    }

    private static void drawVertical(Graphics2D g, String text, int x, int y) {
        Graphics2D rotated = (Graphics2D) g.create();
        try {
            rotated.translate(x, y);
            rotated.rotate(-Math.PI / 2);
            rotated.setColor(Color.BLACK);
            rotated.drawString(text, 0, 0);
        } finally {
            rotated.dispose();
        }
    }

    private static Integer[] sortedOrder(double[] xs) {
        Integer[] order = new Integer[xs.length];
        for (int i = 0; i < xs.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(xs[a], xs[b]));
        return order;
    }

    static double[] range(double[] a, double[] b) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] arr : new double[][]{a, b}) {
            if (arr == null) {
                continue;
            }
            for (double v : arr) {
                if (Double.isFinite(v)) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }
        if (!Double.isFinite(min)) {
            return new double[]{0.0, 1.0};
        }
        return new double[]{min, max};
    }

    private static double[] padded(double[] range) {
        double span = range[1] - range[0];
        double pad = span > 0.0 ? span * 0.05 : Math.max(Math.abs(range[0]) * 1e-3, 1e-6);
        return new double[]{range[0] - pad, range[1] + pad};
    }

    private static double maxAbs(double[] values) {
        double max = 0.0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                max = Math.max(max, Math.abs(v));
            }
        }
        return max;
    }

    private static double toXd(double v, double[] range, int left, int pw) {
        return left + (v - range[0]) / (range[1] - range[0]) * pw;
    }

    private static double toYd(double v, double[] range, int top, int ph) {
        return top + (range[1] - v) / (range[1] - range[0]) * ph;
    }

    private static int toY(double v, double[] range, int top, int ph) {
        return (int) Math.round(toYd(v, range, top, ph));
    }

    private static int px(int base, double scale) {
        return Math.max(1, (int) Math.round(base * scale));
    }
}
