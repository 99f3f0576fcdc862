package Model;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Access handle for one decoded image. Called once by the worker that scores the image;
 * returning {@code null} counts as a decode failure.
 */
@FunctionalInterface
public interface ImageSource {
    BufferedImage load() throws IOException;
}
