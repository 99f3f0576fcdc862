package Model;

import java.util.List;
import java.util.Map;

public final class BestShotSelector {

    private static final double SCORE_EPSILON = 1e-9;

    private final CurationConfig config;

    public BestShotSelector(CurationConfig config) {
        this.config = config;
    }

    public double combinedScore(ImageRecord r) {
        return r.qualityScore() * config.qualityWeight() + r.aestheticScore() * config.aestheticWeight();
    }

    public SimilarityGroup select(SimilarityGroup group, Map<String, ImageRecord> records) {
        List<String> ids = group.imageIds();

        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        long bestPixels = Long.MIN_VALUE;

        for (String id : ids) {
            ImageRecord r = records.get(id);
            if (r == null) {
                throw new IllegalArgumentException("No record for group member " + id + " in " + group.groupId());
            }
            double score = combinedScore(r);
            long pixels = r.resolutionPixels();

            // strict comparisons keep the earlier member on a full tie
            boolean better = score > bestScore + SCORE_EPSILON
                    || (Math.abs(score - bestScore) <= SCORE_EPSILON && pixels > bestPixels);
            if (best == null || better) {
                best = id;
                bestScore = score;
                bestPixels = pixels;
            }
        }
        return group.withSelectedBest(best);
    }
}
