package com.example.oncallrotation.scheduler;

import com.example.oncallrotation.config.MetricsConfig;
import com.example.oncallrotation.config.TriggerSchedulerProperties;
import com.example.oncallrotation.cron.CronOccurrence;
import com.example.oncallrotation.exception.ReconciliationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TriggerReconciler Tests")
class TriggerReconcilerTest {

    private static final String PREFIX = "oncall-rotation-test-";
    private static final long NOW = 1_700_000_000L;
    private static final long DESIRED = NOW + 3600;
    private static final DateTimeFormatter AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    @Mock
    private TriggerScheduler triggerScheduler;

    @Mock
    private MetricsConfig metricsConfig;

    private TriggerReconciler reconciler;

    @BeforeEach
    void setUp() {
        var properties = new TriggerSchedulerProperties();
        properties.setNamePrefix(PREFIX);
        properties.setTargetArn("arn:aws:lambda:us-east-1:123456789012:function:rotate");
        properties.setTargetRoleArn("arn:aws:iam::123456789012:role/scheduler");
        properties.setGraceSeconds(300);
        reconciler = new TriggerReconciler(triggerScheduler, properties, metricsConfig);
    }

    private static CronOccurrence occurrenceAt(long epochSecond) {
        var at = Instant.ofEpochSecond(epochSecond).atZone(ZoneOffset.UTC);
        return CronOccurrence.builder()
                .cron("0 * ? * * *")
                .zone(ZoneId.of("UTC"))
                .singleShotExpression("at(" + AT_FORMAT.format(at) + ")")
                .nextTimestampUtc(epochSecond)
                .nextDateTime(at)
                .build();
    }

    private static String name(long epochSecond) {
        return PREFIX + epochSecond;
    }

    private void givenTriggers(long... timestamps) {
        var names = new ArrayList<String>();
        for (var ts : timestamps) {
            names.add(name(ts));
            when(triggerScheduler.getTriggerDetail(name(ts))).thenReturn(Optional.of(ExternalTrigger.builder()
                    .name(name(ts))
                    .expression(occurrenceAt(ts).getSingleShotExpression())
                    .timezone("UTC")
                    .build()));
        }
        when(triggerScheduler.listTriggers(PREFIX)).thenReturn(names);
    }

    @Nested
    @DisplayName("Create Tests")
    class CreateTests {

        @Test
        @DisplayName("Should create one trigger when none exist")
        void shouldCreateWhenEmpty() {
            // Given
            when(triggerScheduler.listTriggers(PREFIX)).thenReturn(List.of());

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.created()).isTrue();
            assertThat(result.getCreatedTrigger()).isEqualTo(name(DESIRED));
            assertThat(result.getDeletedTriggers()).isEmpty();
            assertThat(result.getEffectiveNextTimestampUtc()).isEqualTo(DESIRED);
            verify(triggerScheduler).createOneShotTrigger(
                    eq(name(DESIRED)),
                    eq(occurrenceAt(DESIRED).getSingleShotExpression()),
                    eq(ZoneId.of("UTC")),
                    eq(TriggerTarget.builder()
                            .arn("arn:aws:lambda:us-east-1:123456789012:function:rotate")
                            .roleArn("arn:aws:iam::123456789012:role/scheduler")
                            .build()),
                    anyString());
            verify(metricsConfig).recordTriggerCreated();
        }

        @Test
        @DisplayName("Should replace a later trigger with the desired one")
        void shouldReplaceLaterTrigger() {
            // Given
            givenTriggers(NOW + 7200);

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.getCreatedTrigger()).isEqualTo(name(DESIRED));
            assertThat(result.getDeletedTriggers()).containsExactly(name(NOW + 7200));
            verify(triggerScheduler).deleteTrigger(name(NOW + 7200));
            verify(metricsConfig).recordTriggerDeleted("redundant");
        }

        @Test
        @DisplayName("Should create when a listed trigger disappears before it is read")
        void shouldCreateWhenDetailMissing() {
            // Given
            when(triggerScheduler.listTriggers(PREFIX)).thenReturn(List.of(name(NOW + 600)));
            when(triggerScheduler.getTriggerDetail(name(NOW + 600))).thenReturn(Optional.empty());

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.getCreatedTrigger()).isEqualTo(name(DESIRED));
            verify(triggerScheduler, never()).deleteTrigger(anyString());
        }
    }

    @Nested
    @DisplayName("Keep Tests")
    class KeepTests {

        @Test
        @DisplayName("Should keep an earlier trigger and delete the ones after it")
        void shouldKeepEarlierTrigger() {
            // Given
            givenTriggers(NOW + 7200, NOW + 1800, DESIRED);

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.created()).isFalse();
            assertThat(result.getEffectiveNextTimestampUtc()).isEqualTo(NOW + 1800);
            assertThat(result.getDeletedTriggers()).containsExactly(name(DESIRED), name(NOW + 7200));
            verify(triggerScheduler, never()).createOneShotTrigger(anyString(), anyString(), any(), any(), anyString());
            verify(triggerScheduler, never()).deleteTrigger(name(NOW + 1800));
        }

        @Test
        @DisplayName("Should keep a trigger at exactly the desired time without creating another")
        void shouldKeepExactTrigger() {
            // Given
            givenTriggers(DESIRED);

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.created()).isFalse();
            assertThat(result.getDeletedTriggers()).isEmpty();
            assertThat(result.getEffectiveNextTimestampUtc()).isEqualTo(DESIRED);
        }

        @Test
        @DisplayName("Should be idempotent when run twice against the same state")
        void shouldBeIdempotent() {
            // Given
            givenTriggers(DESIRED);

            // When
            var first = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));
            var second = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(first).isEqualTo(second);
            verify(triggerScheduler, never()).createOneShotTrigger(anyString(), anyString(), any(), any(), anyString());
        }
    }

    @Nested
    @DisplayName("Cleanup Tests")
    class CleanupTests {

        @Test
        @DisplayName("Should delete past triggers older than the grace window")
        void shouldDeleteStaleTriggers() {
            // Given
            givenTriggers(NOW - 600, NOW - 100, DESIRED);

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.getDeletedTriggers()).containsExactly(name(NOW - 600));
            verify(triggerScheduler).deleteTrigger(name(NOW - 600));
            verify(triggerScheduler, never()).deleteTrigger(name(NOW - 100));
            verify(metricsConfig).recordTriggerDeleted("stale");
        }

        @Test
        @DisplayName("Should delete a past trigger exactly at the grace boundary")
        void shouldDeleteAtGraceBoundary() {
            // Given
            givenTriggers(NOW - 300, DESIRED);

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.getDeletedTriggers()).containsExactly(name(NOW - 300));
        }

        @Test
        @DisplayName("Should ignore triggers whose name carries no timestamp")
        void shouldIgnoreUnparsableNames() {
            // Given
            when(triggerScheduler.listTriggers(PREFIX)).thenReturn(Arrays.asList(PREFIX + "manual", PREFIX));

            // When
            var result = reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW));

            // Then
            assertThat(result.getDeletedTriggers()).isEmpty();
            verify(triggerScheduler, never()).getTriggerDetail(anyString());
            verify(triggerScheduler, never()).deleteTrigger(anyString());
        }
    }

    @Test
    @DisplayName("Should propagate a failure to list triggers")
    void shouldPropagateListFailure() {
        // Given
        when(triggerScheduler.listTriggers(PREFIX))
                .thenThrow(new ReconciliationException("Failed to list schedules", new RuntimeException("throttled")));

        // When/Then
        assertThatThrownBy(() -> reconciler.reconcile(occurrenceAt(DESIRED), Instant.ofEpochSecond(NOW)))
                .isInstanceOf(ReconciliationException.class);
        verify(triggerScheduler, never()).createOneShotTrigger(anyString(), anyString(), any(), any(), anyString());
    }

    @Test
    @DisplayName("Should describe the occurrence for the scheduler console")
    void shouldDescribeOccurrence() {
        assertThat(TriggerReconciler.describe(occurrenceAt(1672610400L)))
                .isEqualTo("{datetime: 2023-01-01T22:00:00Z, datetime_utc: 1672610400, original_cron: 0 * ? * * *}");
    }
}
