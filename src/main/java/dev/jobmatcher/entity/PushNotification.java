package dev.jobmatcher.entity;

import dev.jobmatcher.model.DeliveryStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One push attempt for a match, with the provider's answer.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "push_notifications", indexes = {
        @Index(name = "idx_push_notifications_match", columnList = "matchId"),
        @Index(name = "idx_push_notifications_status", columnList = "status"),
        @Index(name = "idx_push_notifications_created", columnList = "createdAt")
})
public class PushNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(length = 64)
    private String matchId;

    @Column(nullable = false, length = 64)
    private String targetId;

    @Column(nullable = false, length = 32)
    private String notificationType;

    @Lob
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeliveryStatus status;

    @Column(length = 64)
    private String providerCode;

    @Column(length = 1000)
    private String providerMessage;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime sentAt;
}
