package Model;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

public class QualityMetrics {

    public static final String OVEREXPOSED = "overexposed";
    public static final String UNDEREXPOSED = "underexposed";
    public static final String HIGH_NOISE = "high_noise";
    public static final String LOW_RESOLUTION = "low_resolution";
    public static final String MOTION_BLUR = "motion_blur";

    private static final double OVEREXPOSED_PERCENT = 5.0;
    private static final double UNDEREXPOSED_PERCENT = 10.0;
    private static final int MEDIAN_RADIUS = 2;

    /** 8-bit luma plane, row-major. */
    public record Gray(int width, int height, int[] pixels) {
        int at(int x, int y) {
            return pixels[y * width + x];
        }
    }

    public Gray toGray(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        int[] out = new int[w * h];
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            img.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int rgb = row[x];
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                out[y * w + x] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return new Gray(w, h, out);
    }

    public MetricResult sharpness(Gray gray) {
        int w = gray.width();
        int h = gray.height();
        double sum = 0;
        double sumSq = 0;
        for (int y = 0; y < h; y++) {
            int up = reflect(y - 1, h);
            int down = reflect(y + 1, h);
            for (int x = 0; x < w; x++) {
                int left = reflect(x - 1, w);
                int right = reflect(x + 1, w);
                double lap = gray.at(x, up) + gray.at(x, down) + gray.at(left, y) + gray.at(right, y)
                        - 4.0 * gray.at(x, y);
                sum += lap;
                sumSq += lap * lap;
            }
        }
        double n = (double) w * h;
        double mean = sum / n;
        double variance = Math.max(0.0, sumSq / n - mean * mean);

        int score;
        if (variance > 500) score = 5;
        else if (variance > 300) score = 4;
        else if (variance > 150) score = 3;
        else if (variance > 75) score = 2;
        else score = 1;

        return score <= 2 ? MetricResult.of(score, variance, MOTION_BLUR) : MetricResult.of(score, variance);
    }

    public MetricResult exposure(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        long high = 0;
        long low = 0;
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            img.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int rgb = row[x];
                for (int shift = 16; shift >= 0; shift -= 8) {
                    int c = (rgb >> shift) & 0xFF;
                    if (c == 255) high++;
                    else if (c == 0) low++;
                }
            }
        }
        double samples = 3.0 * w * h;
        double highPercent = high / samples * 100.0;
        double lowPercent = low / samples * 100.0;

        List<String> issues = new ArrayList<>(2);
        if (highPercent > OVEREXPOSED_PERCENT) issues.add(OVEREXPOSED);
        if (lowPercent > UNDEREXPOSED_PERCENT) issues.add(UNDEREXPOSED);

        double clipping = highPercent + lowPercent;
        int score;
        if (clipping < 1) score = 5;
        else if (clipping < 3) score = 4;
        else if (clipping < 8) score = 3;
        else if (clipping < 15) score = 2;
        else score = 1;

        return new MetricResult(score, clipping, issues, null);
    }

    public MetricResult noise(Gray gray) {
        int w = gray.width();
        int h = gray.height();
        int[] window = new int[(2 * MEDIAN_RADIUS + 1) * (2 * MEDIAN_RADIUS + 1)];
        double sum = 0;
        double sumSq = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int k = 0;
                for (int dy = -MEDIAN_RADIUS; dy <= MEDIAN_RADIUS; dy++) {
                    int yy = clamp(y + dy, h);
                    for (int dx = -MEDIAN_RADIUS; dx <= MEDIAN_RADIUS; dx++) {
                        window[k++] = gray.at(clamp(x + dx, w), yy);
                    }
                }
                double residual = gray.at(x, y) - median(window);
                sum += residual;
                sumSq += residual * residual;
            }
        }
        double n = (double) w * h;
        double mean = sum / n;
        double std = Math.sqrt(Math.max(0.0, sumSq / n - mean * mean));

        int score;
        if (std < 5) score = 5;
        else if (std < 10) score = 4;
        else if (std < 15) score = 3;
        else if (std < 25) score = 2;
        else score = 1;

        return score <= 2 ? MetricResult.of(score, std, HIGH_NOISE) : MetricResult.of(score, std);
    }

    public MetricResult resolution(long pixels, long minPixels) {
        int score;
        if (pixels >= 24_000_000L) score = 5;
        else if (pixels >= 12_000_000L) score = 4;
        else if (pixels >= 8_000_000L) score = 3;
        else if (pixels >= minPixels) score = 2;
        else score = 1;

        return pixels < minPixels
                ? MetricResult.of(score, pixels, LOW_RESOLUTION)
                : MetricResult.of(score, pixels);
    }

    // insertion sort, window is always 25 samples
    private static int median(int[] window) {
        for (int i = 1; i < window.length; i++) {
            int v = window[i];
            int j = i - 1;
            while (j >= 0 && window[j] > v) {
                window[j + 1] = window[j];
                j--;
            }
            window[j + 1] = v;
        }
        return window[window.length / 2];
    }

    private static int clamp(int i, int n) {
        return i < 0 ? 0 : (i >= n ? n - 1 : i);
    }

    private static int reflect(int i, int n) {
        if (n == 1) return 0;
        if (i < 0) return -i;
        if (i >= n) return 2 * n - 2 - i;
        return i;
    }
}
