package com.tasflow.repository;

import com.tasflow.model.wiki.WikiPage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WikiPageRepository extends JpaRepository<WikiPage, Long> {

    Optional<WikiPage> findFirstByPageNameAndCurrentTrue(String pageName);

    List<WikiPage> findByPageNameOrderByRevisionAsc(String pageName);

    @Query("SELECT COALESCE(MAX(w.revision), 0) FROM WikiPage w WHERE w.pageName = :pageName")
    int findLatestRevision(@Param("pageName") String pageName);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE WikiPage w SET w.current = false WHERE w.pageName = :pageName AND w.current = true")
    int clearCurrent(@Param("pageName") String pageName);
}
