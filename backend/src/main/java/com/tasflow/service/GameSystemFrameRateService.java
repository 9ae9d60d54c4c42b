package com.tasflow.service;

import com.tasflow.model.game.GameSystem;
import com.tasflow.model.game.GameSystemFrameRate;
import com.tasflow.repository.GameSystemFrameRateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Resolves frame rate records for parsed movies.
 *
 * Creation runs in its own transaction so that losing a creation race against another upload
 * leaves the caller's transaction intact; the loser simply reads the row the winner committed.
 */
@Service
@Slf4j
public class GameSystemFrameRateService {

    private final GameSystemFrameRateRepository frameRateRepository;
    private final TransactionTemplate requiresNew;

    public GameSystemFrameRateService(
            GameSystemFrameRateRepository frameRateRepository,
            PlatformTransactionManager transactionManager) {
        this.frameRateRepository = frameRateRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Find the exact (system, frame rate, region) triple, creating it when absent.
     */
    public GameSystemFrameRate findOrCreate(GameSystem system, double frameRate, String regionCode) {
        Optional<GameSystemFrameRate> existing = findExact(system, frameRate, regionCode);
        if (existing.isPresent()) {
            return existing.get();
        }

        Long createdId;
        try {
            createdId = requiresNew.execute(status -> frameRateRepository.saveAndFlush(
                GameSystemFrameRate.builder()
                    .system(system)
                    .frameRate(frameRate)
                    .regionCode(regionCode)
                    .preliminary(true)
                    .build()).getId());
        } catch (DataIntegrityViolationException e) {
            log.info("Frame rate {} ({}) for system {} was created concurrently, reusing it",
                frameRate, regionCode, system.getCode());
            return findExact(system, frameRate, regionCode)
                .orElseThrow(() -> new IllegalStateException(
                    "Frame rate vanished after duplicate insert for system " + system.getCode(), e));
        }

        log.info("Created frame rate {} ({}) for system {}", frameRate, regionCode, system.getCode());
        return frameRateRepository.findById(createdId)
            .orElseThrow(() -> new IllegalStateException("Created frame rate " + createdId + " not found"));
    }

    /**
     * Default frame rate of a system for a region, if one is configured.
     */
    public Optional<GameSystemFrameRate> findDefault(GameSystem system, String regionCode) {
        return frameRateRepository.findFirstBySystemIdAndRegionCodeOrderByIdAsc(system.getId(), regionCode);
    }

    private Optional<GameSystemFrameRate> findExact(GameSystem system, double frameRate, String regionCode) {
        return frameRateRepository.findFirstBySystemIdAndFrameRateAndRegionCodeOrderByIdAsc(
            system.getId(), frameRate, regionCode);
    }
}
