package com.tasflow.integration;

import java.util.Collection;

public interface RoleGrantor {

    /**
     * Grant the roles users automatically earn by having a movie published.
     */
    void assignAutoAssignableRolesByPublication(Collection<Long> authorIds, String publicationTitle);
}
