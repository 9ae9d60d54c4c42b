package com.tasflow.service.authorization;

import com.tasflow.model.enums.SubmissionStatus;

import java.util.Set;

/**
 * A single rule offering next statuses. Guards are independent; the gate unions their offers.
 */
@FunctionalInterface
public interface StatusGuard {

    /**
     * @return statuses this rule makes available, empty when it does not apply
     */
    Set<SubmissionStatus> offer(StatusContext context);
}
