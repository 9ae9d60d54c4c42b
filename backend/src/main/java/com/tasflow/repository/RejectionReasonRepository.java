package com.tasflow.repository;

import com.tasflow.model.submission.RejectionReason;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RejectionReasonRepository extends JpaRepository<RejectionReason, Long> {
}
