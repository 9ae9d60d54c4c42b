package com.tasflow.repository;

import com.tasflow.model.game.GameSystem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GameSystemRepository extends JpaRepository<GameSystem, Long> {

    Optional<GameSystem> findByCodeIgnoreCase(String code);
}
