package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

public final class QualityAssessor {

    private static final Logger log = LoggerFactory.getLogger(QualityAssessor.class);

    private final QualityMetrics metrics;
    private final CurationConfig config;

    public QualityAssessor(CurationConfig config) {
        this(new QualityMetrics(), config);
    }

    public QualityAssessor(QualityMetrics metrics, CurationConfig config) {
        this.metrics = metrics;
        this.config = config;
    }

    /**
     * Scores one decoded image. A failing sub-metric is replaced by the neutral score and
     * flagged; the assessment itself is always produced.
     *
     * @param resolutionPixels supplied pixel count, or {@code <= 0} to use the decoded dimensions
     */
    public QualityAssessment assess(String imageId, BufferedImage image, long resolutionPixels) {
        QualityMetrics.Gray gray = null;
        String grayFailure = null;
        try {
            gray = metrics.toGray(image);
        } catch (RuntimeException e) {
            grayFailure = "grayscale conversion failed: " + e;
            log.warn("{}: {}", imageId, grayFailure);
        }

        final QualityMetrics.Gray g = gray;
        final String gf = grayFailure;
        long pixels = resolutionPixels > 0 ? resolutionPixels : (long) image.getWidth() * image.getHeight();

        MetricResult sharpness = g == null
                ? MetricResult.neutral(gf)
                : measure(imageId, "sharpness", () -> metrics.sharpness(g));
        MetricResult exposure = measure(imageId, "exposure", () -> metrics.exposure(image));
        MetricResult noise = g == null
                ? MetricResult.neutral(gf)
                : measure(imageId, "noise", () -> metrics.noise(g));
        MetricResult resolution = measure(imageId, "resolution",
                () -> metrics.resolution(pixels, config.minResolutionPixels()));

        return compose(imageId, sharpness, exposure, noise, resolution);
    }

    QualityAssessment compose(String imageId, MetricResult sharpness, MetricResult exposure,
                              MetricResult noise, MetricResult resolution) {
        Set<String> issues = new LinkedHashSet<>();
        boolean anyFailed = false;
        for (MetricResult r : List.of(exposure, resolution, sharpness, noise)) {
            issues.addAll(r.issues());
            anyFailed |= r.isFallback();
        }
        if (anyFailed) issues.add(QualityAssessment.PROCESSING_ERROR);

        int composite = compositeScore(
                sharpness.score(), exposure.score(), noise.score(), resolution.score(), config);

        return new QualityAssessment(
                imageId,
                composite,
                sharpness.score(),
                exposure.score(),
                noise.score(),
                resolution.score(),
                List.copyOf(issues),
                new QualityAssessment.Metrics(sharpness.value(), exposure.value(), noise.value()));
    }

    public static int compositeScore(int sharpness, int exposure, int noise, int resolution, CurationConfig config) {
        double weighted = sharpness * config.sharpnessWeight()
                + exposure * config.exposureWeight()
                + noise * config.noiseWeight()
                + resolution * config.resolutionWeight();
        return clampScore(roundHalfAwayFromZero(weighted));
    }

    static int roundHalfAwayFromZero(double value) {
        // settle binary noise first so 1.4999999999 from 0.35/0.30/... weights rounds like 1.5
        return BigDecimal.valueOf(value)
                .setScale(6, RoundingMode.HALF_UP)
                .setScale(0, RoundingMode.HALF_UP)
                .intValue();
    }

    static int clampScore(int score) {
        return Math.max(1, Math.min(5, score));
    }

    private MetricResult measure(String imageId, String name, Supplier<MetricResult> metric) {
        try {
            return metric.get();
        } catch (RuntimeException e) {
            log.warn("{}: {} metric failed, using neutral score: {}", imageId, name, e.toString());
            return MetricResult.neutral(name + " failed: " + e);
        }
    }
}
