package dev.jobmatcher.store.impl;

import dev.jobmatcher.entity.DeviceTarget;
import dev.jobmatcher.entity.KeywordSubscription;
import dev.jobmatcher.model.LocationFilter;
import dev.jobmatcher.model.NotificationTarget;
import dev.jobmatcher.model.Subscription;
import dev.jobmatcher.repository.KeywordSubscriptionRepository;
import dev.jobmatcher.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSubscriptionStore implements SubscriptionStore {

    private final KeywordSubscriptionRepository subscriptionRepository;

    @Override
    public Flux<Subscription> listActiveSubscriptions() {
        return Flux.defer(() -> Flux.fromIterable(subscriptionRepository.findActiveWithActiveTarget()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(JpaSubscriptionStore::toSubscription);
    }

    static Subscription toSubscription(KeywordSubscription entity) {
        DeviceTarget device = entity.getTarget();
        Set<String> sources = entity.getSources() == null || entity.getSources().isEmpty()
                ? Set.of()
                : new LinkedHashSet<>(entity.getSources());

        LocationFilter locationFilter = null;
        if ((entity.getLocationCities() != null && !entity.getLocationCities().isEmpty()) || entity.isRemoteOnly()) {
            locationFilter = LocationFilter.builder()
                    .cities(entity.getLocationCities() != null ? new ArrayList<>(entity.getLocationCities()) : List.of())
                    .remoteOnly(entity.isRemoteOnly())
                    .build();
        }

        return Subscription.builder()
                .subscriptionId(entity.getId())
                .subscriberId(entity.getSubscriberId())
                .keywords(Subscription.normalizeKeywords(entity.getKeywords()))
                .sourceFilter(sources)
                .locationFilter(locationFilter)
                .active(entity.isActive())
                .target(NotificationTarget.builder()
                        .targetId(device.getId())
                        .deviceToken(device.getDeviceToken())
                        .active(device.isActive())
                        .build())
                .build();
    }
}
