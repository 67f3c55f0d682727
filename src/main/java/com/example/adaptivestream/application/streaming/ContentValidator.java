package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.ContentMetadata;

/**
 * Confirms that a content id names playable media before any provider is tried.
 */
public interface ContentValidator {

    /**
     * @throws ContentValidationException when the id is malformed or does not name video content
     */
    ContentMetadata validate(String contentId);
}
