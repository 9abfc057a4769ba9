package com.questrail.oob.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of OobObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jOobObservabilitySink implements OobObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOobObservabilitySink.class);

    @Override
    public void onStateTransition(OobStateTransitionEvent event) {
        if (event.isReturnToIdle()) {
            log.info("OOB channel: {} -> {}", event.oldState(), event.newState());
        } else {
            log.debug("OOB channel: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onFrameEvent(OobFrameEvent event) {
        log.debug("OOB {}: read {}; expected {}.", event.part(), event.received(), event.expected());
    }

    @Override
    public void onError(OobErrorEvent event) {
        switch (event.cause()) {
            case NO_ELIGIBLE_PEER ->
                log.info("OOB channel not accepting: {}", event.message());
            case CALLBACK_FAILED, CLEANUP_FAILED, WORKER_FAILED ->
                log.error("OOB channel error [{}]: {}", event.cause(), event.message(), event.error());
            default ->
                log.warn("OOB channel failure [{}]: {}", event.cause(), event.message(), event.error());
        }
    }
}
