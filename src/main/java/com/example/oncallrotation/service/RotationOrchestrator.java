package com.example.oncallrotation.service;

import com.example.oncallrotation.config.MetricsConfig;
import com.example.oncallrotation.cron.CronOccurrence;
import com.example.oncallrotation.domain.entity.RotationTask;
import com.example.oncallrotation.domain.entity.RotationTaskKey;
import com.example.oncallrotation.domain.entity.SlackInstallation;
import com.example.oncallrotation.domain.repository.RotationTaskRepository;
import com.example.oncallrotation.domain.repository.SlackInstallationRepository;
import com.example.oncallrotation.dto.RunSummary;
import com.example.oncallrotation.exception.CredentialException;
import com.example.oncallrotation.exception.InvalidInputException;
import com.example.oncallrotation.scheduler.TriggerReconciler;
import com.example.oncallrotation.service.sync.RosterSyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One rotation run, started by the external wake-up trigger or manually.
 * <p>
 * Flow:
 * 1. Load all tasks and installations
 * 2. Sync every due task concurrently, advancing it on success
 * 3. Schedule the next wake-up for the earliest future occurrence across all tasks
 * <p>
 * A failed task keeps its occurrence and is retried on the next run. Failures of one task never
 * affect the others.
 */
@Slf4j
@Service
public class RotationOrchestrator {

    private final RotationTaskRepository taskRepository;
    private final SlackInstallationRepository installationRepository;
    private final RosterSyncService rosterSyncService;
    private final TriggerReconciler triggerReconciler;
    private final MetricsConfig metricsConfig;
    private final ExecutorService executorService;
    private final Clock clock;

    public RotationOrchestrator(
            RotationTaskRepository taskRepository,
            SlackInstallationRepository installationRepository,
            RosterSyncService rosterSyncService,
            TriggerReconciler triggerReconciler,
            MetricsConfig metricsConfig,
            @Qualifier("rotationSyncExecutor") ExecutorService executorService,
            Clock clock) {
        this.taskRepository = taskRepository;
        this.installationRepository = installationRepository;
        this.rosterSyncService = rosterSyncService;
        this.triggerReconciler = triggerReconciler;
        this.metricsConfig = metricsConfig;
        this.executorService = executorService;
        this.clock = clock;
    }

    /**
     * @throws com.example.oncallrotation.exception.ReconciliationException if the next wake-up cannot be scheduled
     */
    public RunSummary run() {
        var sample = metricsConfig.startRunTimer();
        var success = false;
        try {
            var summary = doRun();
            success = true;
            return summary;
        } finally {
            metricsConfig.recordRun(sample, success);
        }
    }

    private RunSummary doRun() {
        var now = clock.instant();

        var installations = installationRepository.findAll().stream()
                .collect(Collectors.toMap(SlackInstallation::getTeamId, Function.identity(), (first, second) -> first));
        var tasks = taskRepository.findAll();
        var dueTasks = tasks.stream().filter(task -> task.isDue(now)).toList();

        log.info("Rotation run at {}: {} task(s), {} due", now, tasks.size(), dueTasks.size());

        var futures = dueTasks.stream()
                .map(task -> CompletableFuture.supplyAsync(() -> processTask(task, installations, now), executorService))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        var outcomes = futures.stream().map(CompletableFuture::join).toList();
        var failed = (int) outcomes.stream().filter(SyncOutcome::isFailure).count();
        var changed = (int) outcomes.stream().filter(outcome -> outcome == SyncOutcome.CHANGED).count();

        var summary = RunSummary.builder()
                .startedAt(now)
                .totalTasks(tasks.size())
                .dueTasks(dueTasks.size())
                .succeeded(dueTasks.size() - failed)
                .failed(failed)
                .changed(changed);

        var removed = new HashSet<RotationTaskKey>();
        for (var i = 0; i < dueTasks.size(); i++) {
            if (outcomes.get(i) == SyncOutcome.REMOVED) {
                removed.add(dueTasks.get(i).getKey());
            }
        }

        var earliest = earliestOccurrence(tasks, removed, now);
        if (earliest.isEmpty()) {
            log.info("No task has a future occurrence, nothing to schedule");
            return summary.build();
        }

        var result = triggerReconciler.reconcile(earliest.get(), now);
        log.info("Rotation run finished: {} succeeded, {} failed, next wake-up at {}",
                dueTasks.size() - failed, failed, result.getEffectiveNextTimestampUtc());

        return summary
                .nextWakeUpUtc(result.getEffectiveNextTimestampUtc())
                .createdTrigger(result.getCreatedTrigger())
                .deletedTriggers(result.getDeletedTriggers())
                .build();
    }

    private SyncOutcome processTask(RotationTask task, Map<String, SlackInstallation> installations, Instant now) {
        try {
            log.info("Updating user group for task {}, cron '{}' in {}", task.describe(), task.getCronExpression(), task.getTimezone());

            var installation = installations.get(task.getTeamId());
            if (installation == null) {
                throw new CredentialException(task.getTeamId(), "no Slack installation");
            }
            var pagerDutyToken = Optional.ofNullable(task.getPagerDutyToken())
                    .or(() -> Optional.ofNullable(installation.getPagerDutyToken()))
                    .orElseThrow(() -> new CredentialException(task.getTeamId(), "no PagerDuty token set up"));

            var changed = rosterSyncService.sync(task, pagerDutyToken, installation.getAccessToken(), now);

            task.advanceTo(task.calculateNextOccurrence(now), now);
            var updated = taskRepository.updateOccurrence(task.getTeam(), task.getTaskId(),
                    task.getNextOccurrenceUtc(), task.getNextOccurrenceLocal(), task.getLastUpdatedAt());
            if (updated == 0) {
                log.warn("Task {} was deleted while it was being synced, not scheduling it again", task.describe());
                metricsConfig.recordSync(SyncOutcome.FAILED.metricTag());
                return SyncOutcome.REMOVED;
            }

            if (task.isRetired()) {
                log.info("Task {} has no future occurrence and is retired", task.describe());
            } else {
                log.info("Task {} next runs at {}", task.describe(), task.getNextOccurrenceLocal());
            }

            var outcome = changed ? SyncOutcome.CHANGED : SyncOutcome.UNCHANGED;
            metricsConfig.recordSync(outcome.metricTag());
            return outcome;
        } catch (Exception e) {
            log.error("Failed to update user group for task {}: {}", task.describe(), e.getMessage(), e);
            metricsConfig.recordSync(SyncOutcome.FAILED.metricTag());
            return SyncOutcome.FAILED;
        }
    }

    /**
     * Earliest occurrence after {@code now} across non-retired tasks. Tasks that failed this run
     * still count, so they are retried at their next scheduled time. Tasks deleted from the store
     * during the run do not.
     */
    private Optional<CronOccurrence> earliestOccurrence(List<RotationTask> tasks, Set<RotationTaskKey> removed, Instant now) {
        return tasks.stream()
                .filter(task -> !task.isRetired())
                .filter(task -> !removed.contains(task.getKey()))
                .map(task -> nextOccurrenceOrEmpty(task, now))
                .flatMap(Optional::stream)
                .min(Comparator.comparingLong(CronOccurrence::getNextTimestampUtc));
    }

    private Optional<CronOccurrence> nextOccurrenceOrEmpty(RotationTask task, Instant now) {
        try {
            return task.calculateNextOccurrence(now);
        } catch (InvalidInputException e) {
            log.error("Task {} has an unusable schedule '{}' in {}: {}", task.describe(), task.getCronExpression(), task.getTimezone(), e.getMessage());
            return Optional.empty();
        }
    }

    enum SyncOutcome {
        CHANGED, UNCHANGED, FAILED, REMOVED;

        boolean isFailure() {
            return this == FAILED || this == REMOVED;
        }

        String metricTag() {
            return name().toLowerCase();
        }
    }
}
