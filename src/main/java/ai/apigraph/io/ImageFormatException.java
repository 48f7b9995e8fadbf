package ai.apigraph.io;

import java.io.IOException;

/**
 * A program image file is well-formed JSON but does not describe a valid
 * image.
 */
public class ImageFormatException extends IOException {

    public ImageFormatException(String message) {
        super(message);
    }
}
