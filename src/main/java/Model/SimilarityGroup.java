package Model;

import java.util.List;

public record SimilarityGroup(
        String groupId,
        List<String> imageIds,
        SimilarityType similarityType,
        int similarityMetric,
        String selectedBest
) {

    public SimilarityGroup {
        imageIds = List.copyOf(imageIds);
        if (imageIds.size() < 2) {
            throw new IllegalArgumentException("A similarity group needs at least two members: " + groupId);
        }
        if (selectedBest != null && !imageIds.contains(selectedBest)) {
            throw new IllegalArgumentException(selectedBest + " is not a member of " + groupId);
        }
    }

    public SimilarityGroup withSelectedBest(String imageId) {
        return new SimilarityGroup(groupId, imageIds, similarityType, similarityMetric, imageId);
    }

    public int duplicateCount() {
        return imageIds.size() - 1;
    }
}
