package dev.jobmatcher.store;

import dev.jobmatcher.model.Subscription;
import reactor.core.publisher.Flux;

/**
 * Read access to subscriptions. Subscriptions are edited elsewhere.
 */
public interface SubscriptionStore {

    /**
     * Active subscriptions whose notification target is also active.
     */
    Flux<Subscription> listActiveSubscriptions();
}
