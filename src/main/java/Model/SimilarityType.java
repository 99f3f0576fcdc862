package Model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Distance tiers, tightest first. */
public enum SimilarityType {
    DUPLICATE("duplicate"),
    NEAR_DUPLICATE("near_duplicate"),
    SIMILAR("similar");

    private final String wireName;

    SimilarityType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static SimilarityType classify(int distance, CurationConfig config) {
        if (distance <= config.duplicateThreshold()) return DUPLICATE;
        if (distance <= config.nearDuplicateThreshold()) return NEAR_DUPLICATE;
        if (distance <= config.similarThreshold()) return SIMILAR;
        return null;
    }

    public SimilarityType tighter(SimilarityType other) {
        return other != null && other.ordinal() < ordinal() ? other : this;
    }
}
