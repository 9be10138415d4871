package com.example.oncallrotation.scheduler;

import com.example.oncallrotation.config.MetricsConfig;
import com.example.oncallrotation.config.TriggerSchedulerProperties;
import com.example.oncallrotation.cron.CronOccurrence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Converges the external one-shot triggers on a single desired wake-up.
 * <p>
 * Every call re-derives its decision from the listed triggers, so an interrupted or racing call is
 * repaired by the next one:
 * - the earliest trigger in {@code (now, desired]} is kept, otherwise a trigger for {@code desired} is created
 * - triggers after the effective wake-up are deleted
 * - triggers older than the grace window are deleted, younger past ones are left to finish firing
 * <p>
 * Names without a parsable timestamp are neither kept nor deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriggerReconciler {

    private final TriggerScheduler triggerScheduler;
    private final TriggerSchedulerProperties properties;
    private final MetricsConfig metricsConfig;

    /**
     * @throws com.example.oncallrotation.exception.ReconciliationException if the scheduler cannot be listed or changed
     */
    public ReconciliationResult reconcile(CronOccurrence desired, Instant now) {
        var prefix = properties.getNamePrefix();
        var nowEpoch = now.getEpochSecond();
        var desiredTs = desired.getNextTimestampUtc();

        var triggers = new ArrayList<ExternalTrigger>();
        for (var name : triggerScheduler.listTriggers(prefix)) {
            var timestamp = TriggerNames.parseTimestamp(prefix, name);
            if (timestamp.isEmpty()) {
                log.warn("Ignoring trigger {} without a timestamp in its name", name);
                continue;
            }
            triggerScheduler.getTriggerDetail(name)
                    .ifPresent(detail -> triggers.add(detail.toBuilder().nextTimestampUtc(timestamp.getAsLong()).build()));
        }
        triggers.sort(Comparator.comparing(ExternalTrigger::getNextTimestampUtc));

        log.debug("Found {} trigger(s), desired wake-up at {} ({})", triggers.size(), desiredTs, desired.formatLocal());

        var currentNext = triggers.stream()
                .filter(trigger -> trigger.getNextTimestampUtc() > nowEpoch && trigger.getNextTimestampUtc() <= desiredTs)
                .findFirst();

        var result = ReconciliationResult.builder();
        long effectiveNext;

        if (currentNext.isEmpty() || desiredTs < currentNext.get().getNextTimestampUtc()) {
            var name = TriggerNames.nameOf(prefix, desiredTs);
            triggerScheduler.createOneShotTrigger(name, desired.getSingleShotExpression(), desired.getZone(), target(), describe(desired));
            metricsConfig.recordTriggerCreated();
            result.createdTrigger(name);
            effectiveNext = desiredTs;
        } else {
            log.info("Keeping trigger {} ({})", currentNext.get().getName(), currentNext.get().getExpression());
            effectiveNext = currentNext.get().getNextTimestampUtc();
        }

        var staleBefore = nowEpoch - properties.getGraceSeconds();
        for (var trigger : triggers) {
            var ts = trigger.getNextTimestampUtc();
            if (ts > effectiveNext) {
                triggerScheduler.deleteTrigger(trigger.getName());
                metricsConfig.recordTriggerDeleted("redundant");
                result.deletedTrigger(trigger.getName());
            } else if (ts <= staleBefore) {
                triggerScheduler.deleteTrigger(trigger.getName());
                metricsConfig.recordTriggerDeleted("stale");
                result.deletedTrigger(trigger.getName());
            }
        }

        return result.effectiveNextTimestampUtc(effectiveNext).build();
    }

    private TriggerTarget target() {
        return TriggerTarget.builder()
                .arn(properties.getTargetArn())
                .roleArn(properties.getTargetRoleArn())
                .build();
    }

    /**
     * Readable in the scheduler console
     */
    static String describe(CronOccurrence occurrence) {
        return String.format("{datetime: %s, datetime_utc: %d, original_cron: %s}",
                occurrence.formatLocal(), occurrence.getNextTimestampUtc(), occurrence.getCron());
    }
}
