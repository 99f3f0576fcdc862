package Model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public record BatchSummary(
        BatchStatus status,
        String summary,
        int imagesAssessed,
        int imagesWithIssues,
        Map<String, Integer> issueCounts,
        double averageQualityScore,
        double averageAestheticScore,
        int groupsFound,
        int duplicatesFound,
        int validationErrors
) {

    public BatchSummary {
        issueCounts = Collections.unmodifiableMap(new TreeMap<>(issueCounts));
    }

    public static BatchSummary of(List<QualityAssessment> assessments,
                                  Collection<ImageRecord> records,
                                  List<SimilarityGroup> groups,
                                  int validationErrors) {
        Map<String, Integer> counts = new TreeMap<>();
        int withIssues = 0;
        double qualitySum = 0;
        for (QualityAssessment qa : assessments) {
            qualitySum += qa.qualityScore();
            if (qa.hasIssues()) withIssues++;
            for (String issue : qa.issues()) counts.merge(issue, 1, Integer::sum);
        }

        double aestheticSum = 0;
        for (ImageRecord r : records) aestheticSum += r.aestheticScore();

        int n = assessments.size();
        double avgQuality = n == 0 ? 0.0 : qualitySum / n;
        double avgAesthetic = records.isEmpty() ? 0.0 : aestheticSum / records.size();
        int duplicates = groups.stream().mapToInt(SimilarityGroup::duplicateCount).sum();

        BatchStatus status;
        if (withIssues == 0 && validationErrors == 0) status = BatchStatus.SUCCESS;
        else if (withIssues < n) status = BatchStatus.WARNING;
        else status = BatchStatus.ERROR;

        String text = n == 0
                ? "No images were assessed"
                : String.format(Locale.ROOT,
                "Assessed %d images, average quality: %.2f/5; found %d similarity groups with %d duplicates",
                n, avgQuality, groups.size(), duplicates);

        return new BatchSummary(status, text, n, withIssues, counts, avgQuality, avgAesthetic,
                groups.size(), duplicates, validationErrors);
    }
}
