package com.tasflow.integration;

/**
 * Keeps externally hosted encodes in step with publication data.
 */
public interface VideoSync {

    boolean isRecognizedUrl(String url);

    /**
     * Embeddable form of a recognized video link; other links are returned unchanged.
     */
    String toEmbedLink(String url);

    void sync(VideoDescriptor video);
}
