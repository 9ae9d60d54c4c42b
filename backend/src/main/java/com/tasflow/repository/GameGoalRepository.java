package com.tasflow.repository;

import com.tasflow.model.game.GameGoal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GameGoalRepository extends JpaRepository<GameGoal, Long> {
}
