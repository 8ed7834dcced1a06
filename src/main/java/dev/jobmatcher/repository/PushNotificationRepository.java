package dev.jobmatcher.repository;

import dev.jobmatcher.entity.PushNotification;
import dev.jobmatcher.model.DeliveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface PushNotificationRepository extends JpaRepository<PushNotification, String> {

    List<PushNotification> findByMatchId(String matchId);

    long countByStatus(DeliveryStatus status);

    @Transactional
    @Modifying
    @Query("DELETE FROM PushNotification n WHERE n.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
