package org.apipulse.store;

import java.util.UUID;

/**
 * Counts task runs per user for the billing period.
 */
public interface UsageCounter {

    void increment(UUID userId);
}
