package Model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class RecordValidator {

    public List<String> validate(List<QualityAssessment> assessments, List<SimilarityGroup> groups) {
        List<String> violations = new ArrayList<>();
        Set<String> known = new HashSet<>();

        for (QualityAssessment qa : assessments) {
            known.add(qa.imageId());
            checkScore(violations, qa.imageId(), "quality_score", qa.qualityScore());
            checkScore(violations, qa.imageId(), "sharpness", qa.sharpness());
            checkScore(violations, qa.imageId(), "exposure", qa.exposure());
            checkScore(violations, qa.imageId(), "noise", qa.noise());
            checkScore(violations, qa.imageId(), "resolution", qa.resolution());
        }

        Set<String> grouped = new HashSet<>();
        for (SimilarityGroup g : groups) {
            if (g.imageIds().size() < 2) {
                violations.add(g.groupId() + ": fewer than two members");
            }
            if (g.selectedBest() == null || !g.imageIds().contains(g.selectedBest())) {
                violations.add(g.groupId() + ": selected_best " + g.selectedBest() + " is not a member");
            }
            for (String id : g.imageIds()) {
                if (!grouped.add(id)) {
                    violations.add(g.groupId() + ": " + id + " already belongs to another group");
                }
                if (!known.contains(id)) {
                    violations.add(g.groupId() + ": unknown image " + id);
                }
            }
        }
        return violations;
    }

    private static void checkScore(List<String> violations, String imageId, String field, int score) {
        if (score < 1 || score > 5) {
            violations.add(imageId + ": " + field + " out of range: " + score);
        }
    }
}
