package dev.jobmatcher.repository;

import dev.jobmatcher.entity.KeywordSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KeywordSubscriptionRepository extends JpaRepository<KeywordSubscription, String> {

    /**
     * Active subscriptions whose delivery target is also active.
     */
    @Query("SELECT s FROM KeywordSubscription s JOIN FETCH s.target t "
            + "WHERE s.active = true AND t.active = true ORDER BY s.subscriberId")
    List<KeywordSubscription> findActiveWithActiveTarget();
}
