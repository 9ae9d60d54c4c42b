package com.tasflow.repository;

import com.tasflow.model.publication.PublicationClass;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PublicationClassRepository extends JpaRepository<PublicationClass, Long> {
}
