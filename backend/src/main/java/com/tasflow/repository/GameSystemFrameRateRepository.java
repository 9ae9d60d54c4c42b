package com.tasflow.repository;

import com.tasflow.model.game.GameSystemFrameRate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for system frame rates.
 */
@Repository
public interface GameSystemFrameRateRepository extends JpaRepository<GameSystemFrameRate, Long> {

    /**
     * Frame rate matching an explicit (rate, region) pair reported by the parser, oldest first.
     */
    Optional<GameSystemFrameRate> findFirstBySystemIdAndFrameRateAndRegionCodeOrderByIdAsc(
        Long systemId, double frameRate, String regionCode);

    /**
     * Default frame rate of a system for a region.
     */
    Optional<GameSystemFrameRate> findFirstBySystemIdAndRegionCodeOrderByIdAsc(Long systemId, String regionCode);

    List<GameSystemFrameRate> findBySystemId(Long systemId);
}
