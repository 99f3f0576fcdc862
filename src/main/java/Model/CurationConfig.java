package Model;

import java.util.Properties;

public record CurationConfig(
        int duplicateThreshold,
        int nearDuplicateThreshold,
        int similarThreshold,
        long minResolutionPixels,
        double sharpnessWeight,
        double exposureWeight,
        double noiseWeight,
        double resolutionWeight,
        double qualityWeight,
        double aestheticWeight,
        int workers,
        int hashMaxDimension
) {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    public static final CurationConfig DEFAULT = new CurationConfig(
            5,
            10,
            15,
            2_000_000L,
            0.35, 0.30, 0.20, 0.15,
            0.4, 0.6,
            Runtime.getRuntime().availableProcessors(),
            512
    );

    public CurationConfig {
        checkThreshold("duplicate_threshold", duplicateThreshold);
        checkThreshold("near_duplicate_threshold", nearDuplicateThreshold);
        checkThreshold("similar_threshold", similarThreshold);
        if (duplicateThreshold > nearDuplicateThreshold || nearDuplicateThreshold > similarThreshold) {
            throw new IllegalArgumentException("Thresholds must satisfy duplicate <= near_duplicate <= similar, got "
                    + duplicateThreshold + ", " + nearDuplicateThreshold + ", " + similarThreshold);
        }
        if (minResolutionPixels <= 0) {
            throw new IllegalArgumentException("min_resolution_pixels must be positive: " + minResolutionPixels);
        }
        checkWeights("quality weights", sharpnessWeight, exposureWeight, noiseWeight, resolutionWeight);
        checkWeights("best-shot weights", qualityWeight, aestheticWeight);
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        if (hashMaxDimension < 32) {
            throw new IllegalArgumentException("hash_max_dimension must be at least 32: " + hashMaxDimension);
        }
    }

    public CurationConfig withNearDuplicateThreshold(int threshold) {
        return new CurationConfig(duplicateThreshold, threshold, similarThreshold, minResolutionPixels,
                sharpnessWeight, exposureWeight, noiseWeight, resolutionWeight,
                qualityWeight, aestheticWeight, workers, hashMaxDimension);
    }

    public CurationConfig withWorkers(int count) {
        return new CurationConfig(duplicateThreshold, nearDuplicateThreshold, similarThreshold, minResolutionPixels,
                sharpnessWeight, exposureWeight, noiseWeight, resolutionWeight,
                qualityWeight, aestheticWeight, count, hashMaxDimension);
    }

    /**
     * Reads overrides from snake_case keys; anything missing keeps the {@link #DEFAULT} value.
     */
    public static CurationConfig fromProperties(Properties props) {
        CurationConfig d = DEFAULT;
        try {
            return new CurationConfig(
                    intProp(props, "duplicate_threshold", d.duplicateThreshold),
                    intProp(props, "near_duplicate_threshold", d.nearDuplicateThreshold),
                    intProp(props, "similar_threshold", d.similarThreshold),
                    longProp(props, "min_resolution_pixels", d.minResolutionPixels),
                    doubleProp(props, "weight.sharpness", d.sharpnessWeight),
                    doubleProp(props, "weight.exposure", d.exposureWeight),
                    doubleProp(props, "weight.noise", d.noiseWeight),
                    doubleProp(props, "weight.resolution", d.resolutionWeight),
                    doubleProp(props, "weight.quality", d.qualityWeight),
                    doubleProp(props, "weight.aesthetic", d.aestheticWeight),
                    intProp(props, "workers", d.workers),
                    intProp(props, "hash_max_dimension", d.hashMaxDimension)
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed configuration value: " + e.getMessage(), e);
        }
    }

    private static void checkThreshold(String name, int value) {
        if (value < 0 || value > HashExtractor.HASH_BITS) {
            throw new IllegalArgumentException(name + " must be within [0, " + HashExtractor.HASH_BITS + "]: " + value);
        }
    }

    private static void checkWeights(String name, double... weights) {
        double sum = 0;
        for (double w : weights) {
            if (w < 0 || Double.isNaN(w)) {
                throw new IllegalArgumentException(name + " must be non-negative");
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException(name + " must sum to 1.0, got " + sum);
        }
    }

    private static int intProp(Properties p, String key, int fallback) {
        String v = p.getProperty(key);
        return v == null || v.isBlank() ? fallback : Integer.parseInt(v.trim());
    }

    private static long longProp(Properties p, String key, long fallback) {
        String v = p.getProperty(key);
        return v == null || v.isBlank() ? fallback : Long.parseLong(v.trim().replace("_", ""));
    }

    private static double doubleProp(Properties p, String key, double fallback) {
        String v = p.getProperty(key);
        return v == null || v.isBlank() ? fallback : Double.parseDouble(v.trim());
    }
}
