package com.flagship.restaurant_ledger.event;

/**
 * Fire-and-forget publication of domain events. Implementations must not
 * throw; a lost event never fails the business operation.
 */
public interface EventPublisher {

    void publish(LedgerEvent event);
}
