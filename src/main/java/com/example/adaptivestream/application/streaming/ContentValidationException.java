package com.example.adaptivestream.application.streaming;

public class ContentValidationException extends RuntimeException {

    private final String contentId;

    public ContentValidationException(String contentId, String message) {
        super(message);
        this.contentId = contentId;
    }

    public ContentValidationException(String contentId, String message, Throwable cause) {
        super(message, cause);
        this.contentId = contentId;
    }

    public String getContentId() {
        return contentId;
    }
}
