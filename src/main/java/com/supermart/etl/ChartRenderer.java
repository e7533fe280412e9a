package com.supermart.etl;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Draws simple bar, pie and histogram charts to PNG files with Java2D.
 */
public class ChartRenderer {

    private static final int WIDTH = 1000;
    private static final int HEIGHT = 600;
    private static final int MARGIN_LEFT = 90;
    private static final int MARGIN_RIGHT = 40;
    private static final int MARGIN_TOP = 60;
    private static final int MARGIN_BOTTOM = 120;

    private static final Color[] PALETTE = {
        new Color(0x4C72B0), new Color(0xDD8452), new Color(0x55A868), new Color(0xC44E52),
        new Color(0x8172B3), new Color(0x937860), new Color(0xDA8BC3), new Color(0x8C8C8C),
        new Color(0xCCB974), new Color(0x64B5CD)
    };

    public void renderBarChart(String title, String yLabel, Map<String, ? extends Number> values, Path output)
            throws IOException {
        BufferedImage image = newCanvas();
        Graphics2D g = image.createGraphics();
        try {
            prepare(g);
            drawTitle(g, title);
            drawBars(g, new ArrayList<>(values.keySet()), toDoubles(values.values()), yLabel);
        } finally {
            g.dispose();
        }
        write(image, output);
    }

    public void renderPieChart(String title, Map<String, ? extends Number> shares, Path output) throws IOException {
        BufferedImage image = newCanvas();
        Graphics2D g = image.createGraphics();
        try {
            prepare(g);
            drawTitle(g, title);

            double total = 0.0;
            for (Number share : shares.values()) {
                total += Math.max(0.0, share.doubleValue());
            }
            int diameter = HEIGHT - MARGIN_TOP - 80;
            int x = 80;
            int y = MARGIN_TOP + 20;
            double start = 90.0;
            int index = 0;
            int legendY = y + 10;
            g.setFont(g.getFont().deriveFont(Font.PLAIN, 14f));
            for (Map.Entry<String, ? extends Number> share : shares.entrySet()) {
                double value = Math.max(0.0, share.getValue().doubleValue());
                double extent = total > 0 ? 360.0 * value / total : 0.0;
                Color color = PALETTE[index % PALETTE.length];
                g.setColor(color);
                g.fillArc(x, y, diameter, diameter, (int) Math.round(start), -(int) Math.round(extent));
                start -= extent;

                g.fillRect(x + diameter + 60, legendY - 12, 14, 14);
                g.setColor(Color.DARK_GRAY);
                double percent = total > 0 ? 100.0 * value / total : 0.0;
                g.drawString(String.format(Locale.ROOT, "%s (%.1f%%)", share.getKey(), percent),
                    x + diameter + 82, legendY);
                legendY += 24;
                index++;
            }
        } finally {
            g.dispose();
        }
        write(image, output);
    }

    /**
     * @param edges bucket boundaries, one more than {@code counts}
     */
    public void renderHistogram(String title, String yLabel, double[] edges, long[] counts, Path output)
            throws IOException {
        if (edges.length != counts.length + 1) {
            throw new IllegalArgumentException("Expected " + (counts.length + 1) + " bucket edges, got " + edges.length);
        }
        List<String> labels = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            labels.add(String.format(Locale.ROOT, "%.0f", edges[i]));
            values.add((double) counts[i]);
        }
        BufferedImage image = newCanvas();
        Graphics2D g = image.createGraphics();
        try {
            prepare(g);
            drawTitle(g, title);
            drawBars(g, labels, values, yLabel);
        } finally {
            g.dispose();
        }
        write(image, output);
    }

    private void drawBars(Graphics2D g, List<String> labels, List<Double> values, String yLabel) {
        int plotWidth = WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
        int plotHeight = HEIGHT - MARGIN_TOP - MARGIN_BOTTOM;
        int baseline = MARGIN_TOP + plotHeight;

        double max = 0.0;
        for (double value : values) {
            max = Math.max(max, value);
        }

        g.setColor(Color.DARK_GRAY);
        g.setStroke(new BasicStroke(1.5f));
        g.drawLine(MARGIN_LEFT, MARGIN_TOP, MARGIN_LEFT, baseline);
        g.drawLine(MARGIN_LEFT, baseline, WIDTH - MARGIN_RIGHT, baseline);

        g.setFont(g.getFont().deriveFont(Font.PLAIN, 12f));
        FontMetrics metrics = g.getFontMetrics();
        for (int tick = 0; tick <= 4; tick++) {
            double tickValue = max * tick / 4;
            int tickY = baseline - (int) Math.round(plotHeight * tick / 4.0);
            String text = String.format(Locale.ROOT, "%,.0f", tickValue);
            g.drawString(text, MARGIN_LEFT - 8 - metrics.stringWidth(text), tickY + 4);
        }

        AffineTransform original = g.getTransform();
        g.rotate(-Math.PI / 2);
        g.drawString(yLabel, -(MARGIN_TOP + plotHeight / 2 + metrics.stringWidth(yLabel) / 2), 20);
        g.setTransform(original);

        if (values.isEmpty()) {
            return;
        }
        int slot = plotWidth / values.size();
        int barWidth = Math.max(1, slot - slot / 5);
        for (int i = 0; i < values.size(); i++) {
            int barHeight = max > 0 ? (int) Math.round(plotHeight * values.get(i) / max) : 0;
            int barX = MARGIN_LEFT + i * slot + (slot - barWidth) / 2;
            g.setColor(PALETTE[0]);
            g.fillRect(barX, baseline - barHeight, barWidth, barHeight);

            g.setColor(Color.DARK_GRAY);
            String label = labels.get(i);
            g.rotate(-Math.PI / 4, barX + barWidth / 2.0, baseline + 12);
            g.drawString(label, barX + barWidth / 2 - metrics.stringWidth(label), baseline + 16);
            g.setTransform(original);
        }
    }

    private static BufferedImage newCanvas() {
        return new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
    }

    private static void prepare(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, WIDTH, HEIGHT);
    }

    private static void drawTitle(Graphics2D g, String title) {
        g.setColor(Color.BLACK);
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 20));
        int titleWidth = g.getFontMetrics().stringWidth(title);
        g.drawString(title, (WIDTH - titleWidth) / 2, MARGIN_TOP - 25);
    }

    private static List<Double> toDoubles(Iterable<? extends Number> numbers) {
        List<Double> values = new ArrayList<>();
        for (Number number : numbers) {
            values.add(number == null ? 0.0 : number.doubleValue());
        }
        return values;
    }

    private static void write(BufferedImage image, Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        if (!ImageIO.write(image, "png", output.toFile())) {
            throw new IOException("No PNG writer available for " + output);
        }
    }
}
