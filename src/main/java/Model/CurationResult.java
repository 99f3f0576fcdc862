package Model;

import java.util.List;

public record CurationResult(
        List<QualityAssessment> qualityAssessments,
        List<SimilarityGroup> similarityGroups,
        BatchSummary summary
) {
    public CurationResult {
        qualityAssessments = List.copyOf(qualityAssessments);
        similarityGroups = List.copyOf(similarityGroups);
    }
}
