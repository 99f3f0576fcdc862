package Model;

import java.util.ArrayList;
import java.util.List;

public record QualityAssessment(
        String imageId,
        int qualityScore,
        int sharpness,
        int exposure,
        int noise,
        int resolution,
        List<String> issues,
        Metrics metrics
) {

    public static final String PROCESSING_ERROR = "processing_error";

    public record Metrics(double blurVariance, double histogramClippingPercent, double snrEstimate) {
        public static final Metrics EMPTY = new Metrics(0.0, 0.0, 0.0);
    }

    public QualityAssessment {
        issues = List.copyOf(issues);
    }

    /** Record emitted when the image could not be decoded at all. */
    public static QualityAssessment fallback(String imageId) {
        int n = MetricResult.NEUTRAL_SCORE;
        return new QualityAssessment(imageId, n, n, n, n, n, List.of(PROCESSING_ERROR), Metrics.EMPTY);
    }

    public QualityAssessment withIssue(String issue) {
        if (issues.contains(issue)) return this;
        List<String> merged = new ArrayList<>(issues);
        merged.add(issue);
        return new QualityAssessment(imageId, qualityScore, sharpness, exposure, noise, resolution, merged, metrics);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
