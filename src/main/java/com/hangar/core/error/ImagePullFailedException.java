package com.hangar.core.error;

public class ImagePullFailedException extends HangarException {
    public ImagePullFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
