package com.purchasingpower.codegraph.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call to an external collaborator.
 *
 * Every call gets a short id so the request, response and error lines of
 * the same call can be correlated in the log.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.info("{} {} → {} [{}]", service.getEmoji(), service.getName(), operation, callId);
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Request: {}", summary);
        }
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs());
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Response: {}", summary);
        }
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
