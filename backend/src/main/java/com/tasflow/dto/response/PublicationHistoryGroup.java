package com.tasflow.dto.response;

import java.util.List;

/**
 * Publications of a game; each current publication carries the chain it obsoleted.
 */
public record PublicationHistoryGroup(
    Long gameId,
    String gameDisplayName,
    List<PublicationHistoryNode> goals
) {}
