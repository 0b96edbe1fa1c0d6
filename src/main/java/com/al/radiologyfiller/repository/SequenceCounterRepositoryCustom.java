package com.al.radiologyfiller.repository;

public interface SequenceCounterRepositoryCustom {

    /**
     * Atomically increments the counter stored under {@code counterKey}, creating it at zero first when
     * absent, and returns the incremented value. Two callers never observe the same value.
     */
    long incrementAndGet(String counterKey, String dateKey);
}
