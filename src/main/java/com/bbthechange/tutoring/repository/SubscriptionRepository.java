package com.bbthechange.tutoring.repository;

import com.bbthechange.tutoring.model.Subscription;

import java.util.Optional;

/**
 * Read access to subscriptions, the anchors of recurring series.
 */
public interface SubscriptionRepository {

    Optional<Subscription> findById(String subscriptionId);
}
