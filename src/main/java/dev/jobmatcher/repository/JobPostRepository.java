package dev.jobmatcher.repository;

import dev.jobmatcher.entity.JobPost;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

/**
 * Read access to the ingested job inventory.
 */
@Repository
public interface JobPostRepository extends JpaRepository<JobPost, String> {

    /**
     * The whole inventory from a single query. Must be consumed inside a transaction and closed.
     */
    @Query("SELECT j FROM JobPost j ORDER BY j.id")
    Stream<JobPost> streamInventory();
}
