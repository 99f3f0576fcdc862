package Model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record ImageRecord(
        String imageId,
        PerceptualHashes hashes,
        int sharpness,
        int exposure,
        int noise,
        int resolution,
        int qualityScore,
        int aestheticScore,
        long resolutionPixels,
        Set<String> issues
) {

    public ImageRecord {
        issues = Collections.unmodifiableSet(new LinkedHashSet<>(issues));
    }

    static ImageRecord of(ImageInput input, QualityAssessment qa, HashExtractor.Result hashes, long resolutionPixels) {
        Set<String> issues = new LinkedHashSet<>(qa.issues());
        if (hashes.failed()) issues.add(HashExtractor.HASH_ERROR);
        return new ImageRecord(
                input.imageId(),
                hashes.hashes(),
                qa.sharpness(),
                qa.exposure(),
                qa.noise(),
                qa.resolution(),
                qa.qualityScore(),
                input.aestheticOrDefault(),
                resolutionPixels,
                issues);
    }
}
