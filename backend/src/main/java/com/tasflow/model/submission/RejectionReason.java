package com.tasflow.model.submission;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "rejection_reason")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectionReason {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;
}
