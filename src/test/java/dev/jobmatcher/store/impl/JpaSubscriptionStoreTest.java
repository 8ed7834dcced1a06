package dev.jobmatcher.store.impl;

import dev.jobmatcher.entity.DeviceTarget;
import dev.jobmatcher.entity.KeywordSubscription;
import dev.jobmatcher.model.Subscription;
import dev.jobmatcher.repository.KeywordSubscriptionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaSubscriptionStoreTest {

    @Mock
    private KeywordSubscriptionRepository subscriptionRepository;

    private KeywordSubscription entity(List<String> keywords, List<String> sources,
                                       List<String> cities, boolean remoteOnly) {
        return KeywordSubscription.builder()
                .id("sub-1")
                .subscriberId("alice")
                .keywords(keywords)
                .sources(sources)
                .locationCities(cities)
                .remoteOnly(remoteOnly)
                .active(true)
                .target(DeviceTarget.builder().id("device-1").deviceToken("token-1").active(true).build())
                .build();
    }

    @Test
    @DisplayName("Should map active subscriptions with normalized keywords")
    void shouldMapSubscriptions() {
        when(subscriptionRepository.findActiveWithActiveTarget())
                .thenReturn(List.of(entity(List.of(" Java ", "java", "", "Kotlin"), List.of("lever"), List.of(), false)));

        StepVerifier.create(new JpaSubscriptionStore(subscriptionRepository).listActiveSubscriptions())
                .assertNext(subscription -> {
                    assertThat(subscription.getKeywords()).containsExactly("Java", "Kotlin");
                    assertThat(subscription.getSourceFilter()).containsExactly("lever");
                    assertThat(subscription.getLocationFilter()).isNull();
                    assertThat(subscription.getTarget().getDeviceToken()).isEqualTo("token-1");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should build a location filter only when one is set")
    void shouldMapLocationFilter() {
        Subscription subscription = JpaSubscriptionStore.toSubscription(
                entity(List.of("java"), List.of(), List.of("Berlin"), true));

        assertThat(subscription.hasSourceFilter()).isFalse();
        assertThat(subscription.acceptsSource("anything")).isTrue();
        assertThat(subscription.getLocationFilter().getCities()).containsExactly("Berlin");
        assertThat(subscription.getLocationFilter().isRemoteOnly()).isTrue();
    }

    @Test
    @DisplayName("Should surface repository failures as errors")
    void shouldPropagateErrors() {
        when(subscriptionRepository.findActiveWithActiveTarget()).thenThrow(new IllegalStateException("db down"));

        StepVerifier.create(new JpaSubscriptionStore(subscriptionRepository).listActiveSubscriptions())
                .expectError(IllegalStateException.class)
                .verify();
    }
}
