package com.tasflow.model.game;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Frame rate of a system in a given region.
 * The (system, frame rate, region) triple is unique so concurrent creation collapses to one row.
 */
@Entity
@Table(name = "game_system_frame_rate",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_frame_rate_system_rate_region",
        columnNames = {"system_id", "frame_rate", "region_code"}),
    indexes = @Index(name = "idx_frame_rate_system", columnList = "system_id"))
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class GameSystemFrameRate extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "system_id", nullable = false)
    private GameSystem system;

    @Column(name = "frame_rate", nullable = false)
    private double frameRate;

    @Column(name = "region_code", nullable = false, length = 10)
    private String regionCode;

    @Column(nullable = false)
    private boolean preliminary;
}
