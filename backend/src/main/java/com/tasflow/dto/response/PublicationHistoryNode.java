package com.tasflow.dto.response;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A publication in a game's history tree.
 */
@Getter
@Builder
public class PublicationHistoryNode {

    private final Long id;
    private final String title;
    private final String goal;
    private final Instant createTimestamp;
    private final String publicationClass;
    private final String classIconPath;
    private final Long obsoletedById;

    @Builder.Default
    private final List<FlagEntry> flags = List.of();

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final List<PublicationHistoryNode> obsoleteList = new ArrayList<>();

    /**
     * Publications this one directly obsoleted.
     */
    public List<PublicationHistoryNode> getObsoletes() {
        return Collections.unmodifiableList(obsoleteList);
    }

    public void attachObsoletes(List<PublicationHistoryNode> children) {
        obsoleteList.clear();
        obsoleteList.addAll(children);
    }

    public record FlagEntry(String iconPath, String linkPath, String name) {}
}
