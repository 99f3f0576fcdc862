package Model;

import java.util.Objects;

public record ImageInput(String imageId, ImageSource source, Integer aestheticScore, long resolutionPixels) {

    public static final int DEFAULT_AESTHETIC = 3;

    public ImageInput {
        Objects.requireNonNull(imageId, "imageId");
        Objects.requireNonNull(source, "source");
    }

    public static ImageInput of(String imageId, ImageSource source) {
        return new ImageInput(imageId, source, null, 0L);
    }

    public int aestheticOrDefault() {
        if (aestheticScore == null) return DEFAULT_AESTHETIC;
        return Math.max(1, Math.min(5, aestheticScore));
    }
}
