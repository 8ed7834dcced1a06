package dev.jobmatcher.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger row for a (subscriber, job) pair. The unique constraint is the dedup authority.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_matches",
        uniqueConstraints = @UniqueConstraint(name = "uk_job_matches_subscriber_job",
                columnNames = {"subscriber_id", "job_id"}),
        indexes = {
                @Index(name = "idx_job_matches_job", columnList = "job_id"),
                @Index(name = "idx_job_matches_created", columnList = "createdAt")
        })
public class JobMatch {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "subscriber_id", nullable = false, length = 64)
    private String subscriberId;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 4000)
    private List<String> matchedKeywords = new ArrayList<>();

    @Column(nullable = false)
    private double relevanceScore;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "is_read", nullable = false)
    private boolean read;
}
