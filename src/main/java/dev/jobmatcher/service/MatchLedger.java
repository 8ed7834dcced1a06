package dev.jobmatcher.service;

import dev.jobmatcher.entity.JobMatch;
import dev.jobmatcher.model.InsertOutcome;
import dev.jobmatcher.model.MatchView;
import dev.jobmatcher.repository.JobMatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Durable record of (subscriber, job) matches.
 * The unique constraint on the table decides duplicates, not the existence check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchLedger {

    private static final int DELETE_CHUNK_SIZE = 500;

    private final JobMatchRepository jobMatchRepository;
    private final Clock clock;

    /**
     * Check if a match already exists for this subscriber and job.
     */
    public boolean exists(String subscriberId, String jobId) {
        return jobMatchRepository.existsBySubscriberIdAndJobId(subscriberId, jobId);
    }

    /**
     * Insert a match. A concurrent or repeated insert resolves to ALREADY_EXISTS.
     *
     * @param relevance score in [0, 1]
     * @return InsertOutcome, never throws for data access problems
     */
    public InsertOutcome insert(String subscriberId, String jobId, List<String> matchedKeywords, double relevance) {
        JobMatch match = JobMatch.builder()
                .subscriberId(subscriberId)
                .jobId(jobId)
                .matchedKeywords(new ArrayList<>(matchedKeywords))
                .relevanceScore(relevance)
                .createdAt(LocalDateTime.now(clock))
                .read(false)
                .build();

        try {
            JobMatch saved = jobMatchRepository.saveAndFlush(match);
            return InsertOutcome.created(saved.getId());
        } catch (DataIntegrityViolationException e) {
            if (isDuplicate(subscriberId, jobId)) {
                log.debug("Match for subscriber {} and job {} already present", subscriberId, jobId);
                return InsertOutcome.alreadyExists();
            }
            return InsertOutcome.failed(rootMessage(e));
        } catch (DataAccessException e) {
            return InsertOutcome.failed(rootMessage(e));
        }
    }

    private boolean isDuplicate(String subscriberId, String jobId) {
        try {
            return exists(subscriberId, jobId);
        } catch (DataAccessException e) {
            log.warn("Could not confirm duplicate for subscriber {} and job {}: {}",
                    subscriberId, jobId, e.getMessage());
            return false;
        }
    }

    /**
     * Remove matches whose job is no longer in the inventory.
     *
     * @param currentJobIds ids of the freshly loaded inventory
     * @return Number of matches removed
     */
    public int deleteWhereJobNotIn(Set<String> currentJobIds) {
        List<String> orphanJobIds = jobMatchRepository.findDistinctJobIds().stream()
                .filter(jobId -> !currentJobIds.contains(jobId))
                .sorted()
                .toList();

        if (orphanJobIds.isEmpty()) {
            return 0;
        }

        int removed = 0;
        for (int from = 0; from < orphanJobIds.size(); from += DELETE_CHUNK_SIZE) {
            List<String> chunk = orphanJobIds.subList(from, Math.min(from + DELETE_CHUNK_SIZE, orphanJobIds.size()));
            removed += jobMatchRepository.deleteByJobIdIn(chunk);
        }

        log.info("Cleaned up {} orphaned matches across {} vanished jobs", removed, orphanJobIds.size());
        return removed;
    }

    /**
     * Matches for a subscriber, newest first.
     */
    public Page<MatchView> findForSubscriber(String subscriberId, Pageable pageable) {
        return jobMatchRepository.findBySubscriberIdOrderByCreatedAtDesc(subscriberId, pageable)
                .map(MatchLedger::toView);
    }

    public long countUnread(String subscriberId) {
        return jobMatchRepository.countBySubscriberIdAndReadFalse(subscriberId);
    }

    /**
     * Mark a match as read if it belongs to the subscriber.
     *
     * @return false if no such match exists for the subscriber
     */
    @Transactional
    public boolean markRead(String matchId, String subscriberId) {
        return jobMatchRepository.findByIdAndSubscriberId(matchId, subscriberId)
                .map(match -> {
                    if (!match.isRead()) {
                        match.setRead(true);
                        jobMatchRepository.save(match);
                        log.info("Match marked as read: {}", matchId);
                    }
                    return true;
                })
                .orElse(false);
    }

    public long count() {
        return jobMatchRepository.count();
    }

    private static MatchView toView(JobMatch match) {
        return new MatchView(
                match.getId(),
                match.getJobId(),
                List.copyOf(match.getMatchedKeywords()),
                match.getRelevanceScore(),
                (int) Math.round(match.getRelevanceScore() * 100),
                match.isRead(),
                match.getCreatedAt().toInstant(ZoneOffset.UTC));
    }

    private static String rootMessage(Exception e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
