package com.example.oncallrotation.scheduler;

import com.example.oncallrotation.exception.ReconciliationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.scheduler.SchedulerClient;
import software.amazon.awssdk.services.scheduler.model.CreateScheduleRequest;
import software.amazon.awssdk.services.scheduler.model.DeleteScheduleRequest;
import software.amazon.awssdk.services.scheduler.model.FlexibleTimeWindow;
import software.amazon.awssdk.services.scheduler.model.FlexibleTimeWindowMode;
import software.amazon.awssdk.services.scheduler.model.GetScheduleRequest;
import software.amazon.awssdk.services.scheduler.model.ListSchedulesRequest;
import software.amazon.awssdk.services.scheduler.model.ResourceNotFoundException;
import software.amazon.awssdk.services.scheduler.model.ScheduleSummary;
import software.amazon.awssdk.services.scheduler.model.Target;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * {@link TriggerScheduler} backed by Amazon EventBridge Scheduler.
 * Triggers are created with {@code at(...)} expressions evaluated in the task zone, so each fires once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventBridgeTriggerScheduler implements TriggerScheduler {

    private static final int MAX_DESCRIPTION_LENGTH = 512;

    private final SchedulerClient schedulerClient;

    @Override
    public List<String> listTriggers(String namePrefix) {
        try {
            return schedulerClient.listSchedulesPaginator(ListSchedulesRequest.builder().namePrefix(namePrefix).build())
                    .schedules()
                    .stream()
                    .map(ScheduleSummary::name)
                    .toList();
        } catch (SdkException e) {
            throw new ReconciliationException("Failed to list schedules with prefix " + namePrefix, e);
        }
    }

    @Override
    public Optional<ExternalTrigger> getTriggerDetail(String name) {
        try {
            var schedule = schedulerClient.getSchedule(GetScheduleRequest.builder().name(name).build());

            return Optional.of(ExternalTrigger.builder()
                    .name(schedule.name())
                    .expression(schedule.scheduleExpression())
                    .timezone(schedule.scheduleExpressionTimezone())
                    .targetArn(schedule.target() == null ? null : schedule.target().arn())
                    .description(schedule.description())
                    .build());
        } catch (ResourceNotFoundException e) {
            log.debug("Schedule {} disappeared before it could be read", name);
            return Optional.empty();
        } catch (SdkException e) {
            throw new ReconciliationException(name, "failed to get schedule", e);
        }
    }

    @Override
    public void createOneShotTrigger(String name, String expression, ZoneId zone, TriggerTarget target, String description) {
        var request = CreateScheduleRequest.builder()
                .name(name)
                .scheduleExpression(expression)
                .scheduleExpressionTimezone(zone.getId())
                .flexibleTimeWindow(FlexibleTimeWindow.builder().mode(FlexibleTimeWindowMode.OFF).build())
                .target(Target.builder().arn(target.getArn()).roleArn(target.getRoleArn()).build())
                .description(truncate(description))
                .build();

        try {
            schedulerClient.createSchedule(request);
            log.info("Created schedule {} for {} in {}", name, expression, zone);
        } catch (SdkException e) {
            throw new ReconciliationException(name, "failed to create schedule", e);
        }
    }

    @Override
    public void deleteTrigger(String name) {
        try {
            schedulerClient.deleteSchedule(DeleteScheduleRequest.builder().name(name).build());
            log.info("Deleted schedule {}", name);
        } catch (ResourceNotFoundException e) {
            log.debug("Schedule {} was already deleted", name);
        } catch (SdkException e) {
            throw new ReconciliationException(name, "failed to delete schedule", e);
        }
    }

    private String truncate(String description) {
        if (description == null || description.length() <= MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, MAX_DESCRIPTION_LENGTH);
    }
}
