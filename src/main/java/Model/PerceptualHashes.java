package Model;

import java.util.Objects;

public record PerceptualHashes(String aHash, String dHash, String pHash) {

    public static final String SENTINEL = "";

    public static final PerceptualHashes EMPTY = new PerceptualHashes(SENTINEL, SENTINEL, SENTINEL);

    public PerceptualHashes {
        aHash = Objects.requireNonNullElse(aHash, SENTINEL);
        dHash = Objects.requireNonNullElse(dHash, SENTINEL);
        pHash = Objects.requireNonNullElse(pHash, SENTINEL);
    }

    public String get(HashFamily family) {
        return switch (family) {
            case AVERAGE -> aHash;
            case DIFFERENCE -> dHash;
            case PERCEPTIVE -> pHash;
        };
    }

    public boolean comparable() {
        return !aHash.isEmpty() || !dHash.isEmpty() || !pHash.isEmpty();
    }
}
