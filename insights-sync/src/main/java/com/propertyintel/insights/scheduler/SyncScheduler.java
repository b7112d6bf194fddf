package com.propertyintel.insights.scheduler;

import com.propertyintel.insights.config.InsightsSyncProperties;
import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.TriggerSource;
import com.propertyintel.insights.service.AccountProvider;
import com.propertyintel.insights.service.SyncPreconditionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;

/**
 * Fires scheduled and on-startup syncs through the {@link TriggerCoordinator}.
 *
 * Default schedule: daily at 05:00 UTC. The zone is fixed so the run time does
 * not drift with daylight saving.
 *
 * Override with insights-sync.scheduling.cron / insights-sync.scheduling.zone.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncScheduler {

    private final AccountProvider accountProvider;
    private final TriggerCoordinator coordinator;
    private final InsightsSyncProperties properties;
    private final Clock clock;

    /**
     * On startup, sync every active account that has never completed a run, or
     * whose last run predates today's scheduled fire time that already passed.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.getScheduling().isRunOnStartup()) {
            log.info("Sync scheduler ready. Next scheduled run: {} ({})",
                    properties.getScheduling().getCron(), properties.getScheduling().getZone());
            return;
        }
        try {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(properties.getScheduling().getZone()));
            for (Account account : accountProvider.list(true)) {
                if (needsStartupRun(account, now)) {
                    log.info("Startup sync for {} (last_sync_at={})", account.getAccountId(), account.getLastSyncAt());
                    fire(account.getAccountId(), TriggerSource.STARTUP);
                }
            }
        } catch (Exception e) {
            log.error("Startup sync failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${insights-sync.scheduling.cron:0 0 5 * * *}", zone = "${insights-sync.scheduling.zone:UTC}")
    public void scheduledSync() {
        log.info("Scheduled sync triggered");
        try {
            for (Account account : accountProvider.list(true)) {
                fire(account.getAccountId(), TriggerSource.SCHEDULED);
            }
        } catch (Exception e) {
            log.error("Scheduled sync failed: {}", e.getMessage(), e);
        }
    }

    boolean needsStartupRun(Account account, ZonedDateTime now) {
        if (account.syncState().isFirstRun()) {
            return true;
        }
        CronExpression cron = CronExpression.parse(properties.getScheduling().getCron());
        ZonedDateTime todaysFire = cron.next(now.toLocalDate().atStartOfDay(now.getZone()).minusSeconds(1));
        return todaysFire != null
                && !todaysFire.isAfter(now)
                && todaysFire.toLocalDate().equals(now.toLocalDate())
                && account.getLastSyncAt().isBefore(todaysFire.toInstant());
    }

    private void fire(String accountId, TriggerSource source) {
        try {
            coordinator.trigger(accountId, source);
        } catch (SyncPreconditionException e) {
            log.warn("Skipping {} sync: {}", source, e.getMessage());
        } catch (TaskRejectedException e) {
            log.warn("Dropping {} trigger for {}: sync executor is saturated", source, accountId);
        }
    }
}
