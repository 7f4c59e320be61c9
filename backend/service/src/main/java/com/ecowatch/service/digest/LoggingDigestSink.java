package com.ecowatch.service.digest;

import java.util.logging.Logger;

public final class LoggingDigestSink implements DigestSink {
    private static final Logger LOGGER = Logger.getLogger(LoggingDigestSink.class.getName());

    @Override
    public void deliver(DigestMessage message) {
        LOGGER.info(() -> message.subject() + System.lineSeparator() + message.text());
    }
}
