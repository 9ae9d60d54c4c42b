package com.tasflow.integration;

import com.tasflow.model.user.User;
import com.tasflow.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;

/**
 * Grants the published-author role to authors who do not hold it yet.
 */
@Component
@Slf4j
public class UserRoleGrantor implements RoleGrantor {

    private final UserRepository userRepository;
    private final String publicationRole;

    public UserRoleGrantor(
            UserRepository userRepository,
            @Value("${tasflow.roles.publication-role:Published Author}") String publicationRole) {
        this.userRepository = userRepository;
        this.publicationRole = publicationRole;
    }

    @Override
    @Transactional
    public void assignAutoAssignableRolesByPublication(Collection<Long> authorIds, String publicationTitle) {
        for (User user : userRepository.findAllById(authorIds)) {
            if (user.getRoles().add(publicationRole)) {
                log.info("Granted role '{}' to {} for {}", publicationRole, user.getUserName(), publicationTitle);
            }
        }
    }
}
