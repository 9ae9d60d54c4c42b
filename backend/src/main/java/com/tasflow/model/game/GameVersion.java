package com.tasflow.model.game;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * A specific release (ROM, region, revision) of a game.
 */
@Entity
@Table(name = "game_version", indexes = {
    @Index(name = "idx_game_version_game", columnList = "game_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class GameVersion extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false)
    private Game game;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 50)
    private String region;
}
