package com.tasflow.model.publication;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "flag")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Flag {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(name = "icon_path", length = 255)
    private String iconPath;

    @Column(name = "link_path", length = 255)
    private String linkPath;
}
