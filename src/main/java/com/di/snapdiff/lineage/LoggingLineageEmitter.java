package com.di.snapdiff.lineage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes each event as one JSON line to the {@code [LINEAGE]} log stream. Always on.
 */
@Slf4j
@Component
public class LoggingLineageEmitter implements LineageEmitter {

    @Override
    public void emit(LineageEvent event) {
        log.info("[LINEAGE] {}", LineageJson.toJson(event));
    }
}
