package com.tasflow.dto.mapper;

import com.tasflow.dto.response.PublicationHistoryNode;
import com.tasflow.dto.response.PublicationHistoryNode.FlagEntry;
import com.tasflow.model.publication.Flag;
import com.tasflow.model.publication.Publication;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Mapper for converting publications into history nodes.
 */
@Component
public class PublicationHistoryMapper {

    public PublicationHistoryNode toNode(Publication entity) {
        if (entity == null) {
            return null;
        }

        return PublicationHistoryNode.builder()
            .id(entity.getId())
            .title(entity.getTitle())
            .goal(entity.getGameGoal() != null ? entity.getGameGoal().getDisplayName() : null)
            .createTimestamp(entity.getCreatedAt())
            .publicationClass(entity.getPublicationClass() != null ? entity.getPublicationClass().getName() : null)
            .classIconPath(entity.getPublicationClass() != null ? entity.getPublicationClass().getIconPath() : null)
            .obsoletedById(entity.getObsoletedById())
            .flags(toFlagEntries(entity))
            .build();
    }

    public List<PublicationHistoryNode> toNodes(List<Publication> entities) {
        return entities.stream().map(this::toNode).toList();
    }

    private List<FlagEntry> toFlagEntries(Publication entity) {
        return entity.getFlags().stream()
            .sorted(Comparator.comparing(Flag::getName))
            .map(f -> new FlagEntry(f.getIconPath(), f.getLinkPath(), f.getName()))
            .toList();
    }
}
