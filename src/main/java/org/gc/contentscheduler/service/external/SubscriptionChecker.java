package org.gc.contentscheduler.service.external;

@FunctionalInterface
public interface SubscriptionChecker {

    boolean hasActiveSubscription(String ownerId);
}
