package dev.jobmatcher.store;

import dev.jobmatcher.model.JobPosting;
import reactor.core.publisher.Flux;

/**
 * Read access to the current job inventory.
 * The inventory is truncated and reloaded by the ingester, so callers always get a full snapshot.
 */
public interface JobInventoryStore {

    /**
     * Stream every job currently in the inventory.
     * Errors are signalled, never swallowed into an empty stream.
     */
    Flux<JobPosting> listAllJobs();
}
