package com.couponbot.pipeline.domain.exceptions;

public class PageFetchException extends RuntimeException {

    private PageFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static PageFetchException of(String url, Throwable cause) {
        return new PageFetchException("Failed to fetch " + url + ": " + cause.getMessage(), cause);
    }
}
