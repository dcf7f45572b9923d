package com.izapolsky.imagedownloader;

import java.awt.image.BufferedImage;

/**
 * Result of a single fetch attempt - either a decoded image or a reason why there is none
 */
public class FetchResult {

    private final BufferedImage image;
    private final String failure;
    private final Throwable cause;

    private FetchResult(BufferedImage image, String failure, Throwable cause) {
        this.image = image;
        this.failure = failure;
        this.cause = cause;
    }

    public static FetchResult success(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Successful fetch needs an image");
        }
        return new FetchResult(image, null, null);
    }

    public static FetchResult failure(String reason) {
        return new FetchResult(null, reason, null);
    }

    public static FetchResult failure(String reason, Throwable cause) {
        return new FetchResult(null, reason, cause);
    }

    public boolean isSuccess() {
        return image != null;
    }

    public BufferedImage getImage() {
        return image;
    }

    public String getFailure() {
        return failure;
    }

    public Throwable getCause() {
        return cause;
    }
}
