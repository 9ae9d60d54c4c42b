package com.tasflow.service;

import com.tasflow.dto.mapper.PublicationHistoryMapper;
import com.tasflow.dto.response.PublicationHistoryGroup;
import com.tasflow.dto.response.PublicationHistoryNode;
import com.tasflow.repository.GameRepository;
import com.tasflow.repository.PublicationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the obsolescence graph: a game's publications grouped under the ones still current.
 */
@Service
@Transactional(readOnly = true)
public class PublicationHistoryService {

    private final GameRepository gameRepository;
    private final PublicationRepository publicationRepository;
    private final PublicationHistoryMapper historyMapper;

    public PublicationHistoryService(
            GameRepository gameRepository,
            PublicationRepository publicationRepository,
            PublicationHistoryMapper historyMapper) {
        this.gameRepository = gameRepository;
        this.publicationRepository = publicationRepository;
        this.historyMapper = historyMapper;
    }

    public Optional<PublicationHistoryGroup> forGame(Long gameId) {
        return gameRepository.findById(gameId)
            .map(game -> new PublicationHistoryGroup(
                game.getId(),
                game.getDisplayName(),
                attachObsoletes(historyMapper.toNodes(publicationRepository.findForHistoryByGameId(gameId)))));
    }

    public Optional<PublicationHistoryGroup> forGameByPublication(Long publicationId) {
        return publicationRepository.findGameIdById(publicationId).flatMap(this::forGame);
    }

    /**
     * Attach every node's directly obsoleted publications and return the current ones.
     * Builds one index keyed by obsoleted-by id, so the work is linear in the number of nodes.
     */
    static List<PublicationHistoryNode> attachObsoletes(List<PublicationHistoryNode> nodes) {
        Map<Long, List<PublicationHistoryNode>> byObsoletedBy = new HashMap<>();
        List<PublicationHistoryNode> current = new ArrayList<>();
        for (PublicationHistoryNode node : nodes) {
            if (node.getObsoletedById() == null) {
                current.add(node);
            } else {
                byObsoletedBy.computeIfAbsent(node.getObsoletedById(), id -> new ArrayList<>()).add(node);
            }
        }

        for (PublicationHistoryNode node : nodes) {
            node.attachObsoletes(byObsoletedBy.getOrDefault(node.getId(), List.of()));
        }
        return current;
    }
}
