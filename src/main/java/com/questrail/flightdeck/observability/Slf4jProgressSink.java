package com.questrail.flightdeck.observability;

import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Production implementation of ProgressSink that emits logs via SLF4J.
 */
public final class Slf4jProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jProgressSink.class);

    @Override
    public void onTransition(NodeTransition event) {
        if (event.isFinalization()) {
            log.info("[{}#{}] {} {}: {} -> {}",
                event.runId(), event.sequence(), event.kind(), event.nodeId(), event.from(), event.to());
        } else {
            log.debug("[{}#{}] {} {}: {} -> {}",
                event.runId(), event.sequence(), event.kind(), event.nodeId(), event.from(), event.to());
        }
    }

    @Override
    public void onRunCompleted(RunCompleted event) {
        Map<Status, Integer> steps = event.tree().tally(NodeKind.STEP);
        log.info("[{}] Run completed: {} (steps {})", event.runId(), event.status(), steps);
    }

    @Override
    public void onError(RunErrorEvent event) {
        log.error("[{}] {}", event.runId(), event.message(), event.cause());
    }
}
