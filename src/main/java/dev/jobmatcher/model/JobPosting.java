package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A posting from the current job inventory.
 * The inventory is replaced wholesale by the ingester, so an id may reappear in a later cycle.
 */
@Data
@Builder
public class JobPosting {
    private String id;
    private String title;
    private String company;
    private String source;
    private Instant createdAt;

    // Optional, not guaranteed by the ingester
    private String description;
    private String requirements;
    private String location;
    private String applyLink;
}
