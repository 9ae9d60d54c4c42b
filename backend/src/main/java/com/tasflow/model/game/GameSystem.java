package com.tasflow.model.game;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Console or platform a movie runs on, identified by its short code (e.g. "NES").
 */
@Entity
@Table(name = "game_system", indexes = {
    @Index(name = "idx_game_system_code", columnList = "code", unique = true)
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class GameSystem extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String code;

    @Column(name = "display_name", length = 100)
    private String displayName;
}
