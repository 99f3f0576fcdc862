package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy clustering in image id order. Membership is measured against the seed only, so two
 * members need not be within threshold of each other.
 */
public final class SimilarityGrouper {

    private static final Logger log = LoggerFactory.getLogger(SimilarityGrouper.class);

    private final CurationConfig config;

    public SimilarityGrouper(CurationConfig config) {
        this.config = config;
    }

    public List<SimilarityGroup> group(Collection<ImageRecord> records) {
        List<ImageRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(ImageRecord::imageId));
        List<SimilarityGroup> groups = cluster(ordered, new boolean[ordered.size()]);

        log.debug("Grouped {} records into {} similarity groups", ordered.size(), groups.size());
        return groups;
    }

    /**
     * @param claimed one flag per position in {@code ordered}; set for every record placed in an emitted group
     */
    List<SimilarityGroup> cluster(List<ImageRecord> ordered, boolean[] claimed) {
        if (claimed.length != ordered.size()) {
            throw new IllegalArgumentException("claimed array does not match record count");
        }

        List<SimilarityGroup> groups = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            if (claimed[i]) continue;

            ImageRecord seed = ordered.get(i);
            if (!seed.hashes().comparable()) continue;

            Group g = new Group(seed);
            for (int j = i + 1; j < ordered.size(); j++) {
                if (claimed[j]) continue;

                ImageRecord other = ordered.get(j);
                int d = HashExtractor.minDistance(seed.hashes(), other.hashes());
                SimilarityType type = SimilarityType.classify(d, config);
                if (type == null) continue;

                g.add(other, d, type);
                claimed[j] = true;
            }

            if (g.items.size() <= 1) continue;
            claimed[i] = true;
            groups.add(g.toGroup("group_" + groups.size()));
        }
        return groups;
    }

    private static final class Group {
        final List<String> items = new ArrayList<>();
        SimilarityType type;
        int minDistance = HashExtractor.INCOMPARABLE;

        Group(ImageRecord seed) {
            items.add(seed.imageId());
        }

        void add(ImageRecord r, int distance, SimilarityType t) {
            items.add(r.imageId());
            type = type == null ? t : type.tighter(t);
            minDistance = Math.min(minDistance, distance);
        }

        SimilarityGroup toGroup(String groupId) {
            return new SimilarityGroup(groupId, items, type, minDistance, null);
        }
    }
}
