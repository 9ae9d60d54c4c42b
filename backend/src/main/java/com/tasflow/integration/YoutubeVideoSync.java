package com.tasflow.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes YouTube encode links. Talking to the YouTube API belongs to the
 * deployment's own sync bean; this one records what would be synced.
 */
@Component
@Slf4j
public class YoutubeVideoSync implements VideoSync {

    private static final Pattern YOUTUBE_URL = Pattern.compile(
        "^https?://(www\\.|m\\.)?(youtube\\.com/(watch\\?v=|embed/|shorts/)|youtu\\.be/)[\\w-]+.*$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern VIDEO_ID = Pattern.compile(
        "(?:[?&]v=|/embed/|/shorts/|youtu\\.be/)([\\w-]+)", Pattern.CASE_INSENSITIVE);

    @Override
    public boolean isRecognizedUrl(String url) {
        return url != null && YOUTUBE_URL.matcher(url.trim()).matches();
    }

    @Override
    public String toEmbedLink(String url) {
        if (!isRecognizedUrl(url)) {
            return url;
        }
        Matcher matcher = VIDEO_ID.matcher(url.trim());
        return matcher.find() ? "https://www.youtube.com/embed/" + matcher.group(1) : url;
    }

    @Override
    public void sync(VideoDescriptor video) {
        log.info("Syncing video {} for publication {} (obsoleted by {})",
            video.url(), video.publicationId(), video.obsoletedBy());
    }
}
