package dev.jobmatcher.repository;

import dev.jobmatcher.entity.JobMatch;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for the match ledger.
 */
@Repository
public interface JobMatchRepository extends JpaRepository<JobMatch, String> {

    boolean existsBySubscriberIdAndJobId(String subscriberId, String jobId);

    /**
     * Distinct job ids currently referenced by any match.
     */
    @Query("SELECT DISTINCT m.jobId FROM JobMatch m")
    Set<String> findDistinctJobIds();

    @Transactional
    @Modifying
    @Query("DELETE FROM JobMatch m WHERE m.jobId IN :jobIds")
    int deleteByJobIdIn(@Param("jobIds") Collection<String> jobIds);

    Page<JobMatch> findBySubscriberIdOrderByCreatedAtDesc(String subscriberId, Pageable pageable);

    long countBySubscriberIdAndReadFalse(String subscriberId);

    Optional<JobMatch> findByIdAndSubscriberId(String id, String subscriberId);
}
