package com.flairbit.calls.scheduler;

import com.flairbit.calls.service.escalation.EscalationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class EscalationScheduler {

    private final EscalationEngine engine;

    @Scheduled(fixedDelayString = "${calls.escalation.tick-ms:5000}")
    public void tick() {
        try {
            engine.tick();
        } catch (Exception e) {
            log.error("Escalation tick failed: {}", e.getMessage(), e);
        }
    }
}
