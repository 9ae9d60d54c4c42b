package com.tasflow.integration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class YoutubeVideoSyncTest {

    private final YoutubeVideoSync videoSync = new YoutubeVideoSync();

    @ParameterizedTest
    @ValueSource(strings = {
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://youtube.com/watch?v=dQw4w9WgXcQ&t=42",
        "https://youtu.be/dQw4w9WgXcQ",
        "https://www.youtube.com/shorts/dQw4w9WgXcQ",
        "https://www.youtube.com/embed/dQw4w9WgXcQ"
    })
    void convertsYoutubeLinksToEmbedLinks(String url) {
        assertThat(videoSync.toEmbedLink(url)).isEqualTo("https://www.youtube.com/embed/dQw4w9WgXcQ");
    }

    @Test
    void leavesOtherLinksAlone() {
        assertThat(videoSync.toEmbedLink("https://archive.org/details/encode")).isEqualTo("https://archive.org/details/encode");
        assertThat(videoSync.toEmbedLink(null)).isNull();
    }

    @Test
    void recognizesOnlyYoutube() {
        assertThat(videoSync.isRecognizedUrl("https://youtu.be/abc")).isTrue();
        assertThat(videoSync.isRecognizedUrl("https://vimeo.com/123")).isFalse();
    }
}
