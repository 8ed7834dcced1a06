package dev.jobmatcher.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "keyword_subscriptions", indexes = {
        @Index(name = "idx_subscriptions_subscriber", columnList = "subscriberId", unique = true)
})
public class KeywordSubscription {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String subscriberId;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 4000)
    private List<String> keywords = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> sources = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> locationCities = new ArrayList<>();

    private boolean remoteOnly;

    @Column(nullable = false)
    private boolean active;

    @OneToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "target_id", nullable = false)
    private DeviceTarget target;
}
