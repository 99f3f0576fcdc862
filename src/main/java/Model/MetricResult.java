package Model;

import java.util.List;

public record MetricResult(int score, double value, List<String> issues, String failure) {

    public static final int NEUTRAL_SCORE = 3;

    public MetricResult {
        if (score < 1 || score > 5) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static MetricResult of(int score, double value, String... issues) {
        return new MetricResult(score, value, List.of(issues), null);
    }

    public static MetricResult neutral(String reason) {
        return new MetricResult(NEUTRAL_SCORE, 0.0, List.of(), reason);
    }

    public boolean isFallback() {
        return failure != null;
    }
}
