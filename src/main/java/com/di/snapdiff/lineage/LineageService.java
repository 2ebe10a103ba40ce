package com.di.snapdiff.lineage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fans each event out to every registered emitter. Lineage is an audit side channel: an emitter
 * failure is logged and does not fail the run.
 */
@Slf4j
@Service
public class LineageService {

    private final List<LineageEmitter> emitters;

    public LineageService(List<LineageEmitter> emitters) {
        this.emitters = List.copyOf(emitters);
    }

    public void emit(LineageEvent event) {
        for (LineageEmitter emitter : emitters) {
            try {
                emitter.emit(event);
            } catch (RuntimeException e) {
                log.warn("[LINEAGE] {} failed for event {}: {}", emitter.getClass().getSimpleName(),
                        event.getEventId(), e.getMessage());
            }
        }
    }
}
