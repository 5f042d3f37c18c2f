package com.flagship.restaurant_ledger.recurrence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs recurrence generation for the current period on a cron schedule.
 */
@Component
@ConditionalOnProperty(name = "recurrence.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RecurrenceScheduler {

    private final RecurrenceGenerator generator;

    @Scheduled(cron = "${recurrence.scheduler.cron}")
    public void generateCurrentPeriod() {
        try {
            generator.generate();
        } catch (RuntimeException e) {
            log.error("Scheduled recurrence generation failed", e);
        }
    }
}
