package com.tasflow.model.game;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Category a run competes in for a game, e.g. "any%" or "100%".
 */
@Entity
@Table(name = "game_goal", indexes = {
    @Index(name = "idx_game_goal_game", columnList = "game_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class GameGoal extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false)
    private Game game;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;
}
