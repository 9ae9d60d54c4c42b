package com.tasflow.repository;

import com.tasflow.model.publication.Publication;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for publications.
 */
@Repository
public interface PublicationRepository extends JpaRepository<Publication, Long> {

    boolean existsByMovieFileName(String movieFileName);

    /**
     * All publications of a game with what the history view displays.
     */
    @EntityGraph(attributePaths = {"publicationClass", "gameGoal", "flags"})
    @Query("SELECT p FROM Publication p WHERE p.game.id = :gameId ORDER BY p.id")
    List<Publication> findForHistoryByGameId(@Param("gameId") Long gameId);

    /**
     * Find publication with what a video sync needs: urls, system and ordered authors.
     */
    @EntityGraph(attributePaths = {"urls", "system", "game", "authors", "authors.author"})
    @Query("SELECT p FROM Publication p WHERE p.id = :id")
    Optional<Publication> findByIdWithSyncDetails(@Param("id") Long id);

    @Query("SELECT p.game.id FROM Publication p WHERE p.id = :id")
    Optional<Long> findGameIdById(@Param("id") Long id);

    @Query("SELECT p.obsoletedById FROM Publication p WHERE p.id = :id")
    Optional<Long> findObsoletedById(@Param("id") Long id);

    @Query("SELECT t.id FROM Publication p JOIN p.tags t WHERE p.id = :id ORDER BY t.id")
    List<Long> findTagIdsById(@Param("id") Long id);
}
