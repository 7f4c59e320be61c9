package com.ecowatch.service.digest;

/**
 * Receives each composed digest. Delivery transport is up to the implementation.
 */
@FunctionalInterface
public interface DigestSink {
    void deliver(DigestMessage message);
}
