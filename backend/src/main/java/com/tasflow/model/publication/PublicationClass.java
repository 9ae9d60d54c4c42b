package com.tasflow.model.publication;

import jakarta.persistence.*;
import lombok.*;

/**
 * Publication class (e.g. Standard, Stars, Moons) a submission is intended for.
 */
@Entity
@Table(name = "publication_class")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicationClass {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(name = "icon_path", length = 255)
    private String iconPath;
}
