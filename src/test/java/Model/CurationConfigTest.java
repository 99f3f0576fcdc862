package Model;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CurationConfigTest {

    @Test
    void defaults() {
        CurationConfig d = CurationConfig.DEFAULT;

        assertEquals(5, d.duplicateThreshold());
        assertEquals(10, d.nearDuplicateThreshold());
        assertEquals(15, d.similarThreshold());
        assertEquals(2_000_000L, d.minResolutionPixels());
        assertEquals(0.35, d.sharpnessWeight());
        assertEquals(0.30, d.exposureWeight());
        assertEquals(0.20, d.noiseWeight());
        assertEquals(0.15, d.resolutionWeight());
        assertEquals(0.4, d.qualityWeight());
        assertEquals(0.6, d.aestheticWeight());
        assertEquals(512, d.hashMaxDimension());
        assertTrue(d.workers() >= 1);
    }

    @Test
    void thresholdOutsideHashLength_rejected() {
        assertThrows(IllegalArgumentException.class, () -> thresholds(5, 10, 65));
        assertThrows(IllegalArgumentException.class, () -> thresholds(-1, 10, 15));
    }

    @Test
    void unorderedThresholds_rejected() {
        assertThrows(IllegalArgumentException.class, () -> thresholds(11, 10, 15));
        assertThrows(IllegalArgumentException.class, () -> thresholds(5, 16, 15));
    }

    @Test
    void boundaryThresholds_accepted() {
        assertDoesNotThrow(() -> thresholds(0, 0, 0));
        assertDoesNotThrow(() -> thresholds(64, 64, 64));
    }

    @Test
    void weightsMustSumToOne() {
        assertThrows(IllegalArgumentException.class, () -> new CurationConfig(5, 10, 15, 2_000_000L,
                0.5, 0.30, 0.20, 0.15, 0.4, 0.6, 1, 512));
        assertThrows(IllegalArgumentException.class, () -> new CurationConfig(5, 10, 15, 2_000_000L,
                0.35, 0.30, 0.20, 0.15, 0.5, 0.6, 1, 512));
        assertThrows(IllegalArgumentException.class, () -> new CurationConfig(5, 10, 15, 2_000_000L,
                0.35, 0.30, 0.20, 0.15, 1.2, -0.2, 1, 512));
    }

    @Test
    void nonPositiveResolutionOrWorkers_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new CurationConfig(5, 10, 15, 0L,
                0.35, 0.30, 0.20, 0.15, 0.4, 0.6, 1, 512));
        assertThrows(IllegalArgumentException.class, () -> CurationConfig.DEFAULT.withWorkers(0));
    }

    @Test
    void fromProperties_overridesGivenKeysOnly() {
        Properties p = new Properties();
        p.setProperty("near_duplicate_threshold", "12");
        p.setProperty("min_resolution_pixels", "1_000_000");
        p.setProperty("workers", "3");

        CurationConfig c = CurationConfig.fromProperties(p);

        assertEquals(12, c.nearDuplicateThreshold());
        assertEquals(1_000_000L, c.minResolutionPixels());
        assertEquals(3, c.workers());
        assertEquals(5, c.duplicateThreshold());
        assertEquals(0.6, c.aestheticWeight());
    }

    @Test
    void fromProperties_malformedValue() {
        Properties p = new Properties();
        p.setProperty("similar_threshold", "fifteen");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CurationConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("fifteen"));
    }

    private static CurationConfig thresholds(int dup, int near, int similar) {
        return new CurationConfig(dup, near, similar, 2_000_000L, 0.35, 0.30, 0.20, 0.15, 0.4, 0.6, 1, 512);
    }
}
