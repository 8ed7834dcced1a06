package dev.jobmatcher.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Row of the job inventory table. Written by the external ingester, read-only here.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_posts", indexes = {
        @Index(name = "idx_job_posts_source", columnList = "source")
})
public class JobPost {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 300)
    private String company;

    @Column(length = 100)
    private String source;

    @Column(length = 2048)
    private String applyLink;

    @Column(length = 300)
    private String location;

    @Lob
    private String description;

    @Lob
    private String requirements;

    private LocalDateTime createdAt;
}
