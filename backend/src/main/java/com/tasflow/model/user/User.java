package com.tasflow.model.user;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.HashSet;
import java.util.Set;

/**
 * Site user. Only the identity and granted role names are kept here;
 * permissions are computed by the authentication layer.
 */
@Entity
@Table(name = "app_user", indexes = {
    @Index(name = "idx_user_name", columnList = "user_name", unique = true)
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class User extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_name", nullable = false, length = 100)
    private String userName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_role", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "role_name", length = 100)
    @Builder.Default
    private Set<String> roles = new HashSet<>();
}
