package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.notify.entity.AlertRule;
import org.lite.notify.entity.ExecutionLog;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.AlertType;
import org.lite.notify.enums.ChannelType;
import org.lite.notify.enums.ExecutionLogStatus;
import org.lite.notify.exception.DeliveryException;
import org.lite.notify.repository.AlertRuleRepository;
import org.lite.notify.service.ChannelDispatchService;
import org.lite.notify.service.impl.AlertEvaluationServiceImpl;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertEvaluationServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final Map<String, Object> ALERT_CHANNEL = Map.of("webhook_url", "https://hooks.slack.com/services/x");

    @Mock
    private AlertRuleRepository alertRuleRepository;

    @Mock
    private ChannelDispatchService channelDispatchService;

    private InMemoryExecutionLogService executionLogs;
    private AlertEvaluationServiceImpl alertEvaluationService;

    @BeforeEach
    void setUp() {
        InMemoryTaskStoreService taskStore = new InMemoryTaskStoreService();
        taskStore.save(NotificationTask.builder().id("t1").userId("u1").title("Nightly backup").content("x").build());
        executionLogs = new InMemoryExecutionLogService(Duration.ofSeconds(3));
        alertEvaluationService = new AlertEvaluationServiceImpl(alertRuleRepository, taskStore, executionLogs,
                channelDispatchService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AlertRule rule(AlertType type, Map<String, Object> parameters) {
        return AlertRule.builder()
                .id("r1")
                .userId("u1")
                .name("Backup alerts")
                .ruleType(type)
                .parameters(new HashMap<>(parameters))
                .alertChannel(ChannelType.SLACK_WEBHOOK)
                .alertChannelConfig(ALERT_CHANNEL)
                .build();
    }

    private void givenRules(AlertType type, AlertRule... rules) {
        when(alertRuleRepository.findByUserIdAndRuleTypeAndEnabledTrue("u1", type)).thenReturn(Flux.just(rules));
    }

    private void givenSaveEchoes() {
        when(alertRuleRepository.save(any(AlertRule.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
    }

    private void givenLogs(ExecutionLogStatus status, int count, Instant startTime) {
        for (int i = 0; i < count; i++) {
            executionLogs.add(ExecutionLog.builder().taskId("t1").status(status).startTime(startTime).build());
        }
    }

    @Test
    void testEvaluate_FailureThresholdReached() {
        // Given
        AlertRule rule = rule(AlertType.EXECUTION_FAILURE, Map.of(AlertRule.THRESHOLD, 2, AlertRule.TIME_WINDOW_MINUTES, 30));
        givenRules(AlertType.EXECUTION_FAILURE, rule);
        givenSaveEchoes();
        givenLogs(ExecutionLogStatus.FAILED, 2, NOW.minusSeconds(60));

        // When
        int sent = alertEvaluationService.evaluate("t1", AlertType.EXECUTION_FAILURE);

        // Then
        assertEquals(1, sent);
        verify(channelDispatchService).send(eq(ChannelType.SLACK_WEBHOOK), eq(ALERT_CHANNEL),
                eq("[Notify Alert] Backup alerts"), contains("2 failed executions in the last 30 minutes"));
        assertEquals(NOW, rule.getLastTriggeredAt());
    }

    @Test
    void testEvaluate_OldFailuresOutsideWindow() {
        // Given
        givenRules(AlertType.EXECUTION_FAILURE,
                rule(AlertType.EXECUTION_FAILURE, Map.of(AlertRule.THRESHOLD, 2, AlertRule.TIME_WINDOW_MINUTES, 30)));
        givenLogs(ExecutionLogStatus.FAILED, 1, NOW.minusSeconds(60));
        givenLogs(ExecutionLogStatus.FAILED, 5, NOW.minus(Duration.ofHours(2)));

        // When
        int sent = alertEvaluationService.evaluate("t1", AlertType.EXECUTION_FAILURE);

        // Then
        assertEquals(0, sent);
        verify(channelDispatchService, never()).send(any(), anyMap(), anyString(), anyString());
    }

    @Test
    void testEvaluate_DuplicateExecutionDefaults() {
        // Given: default threshold of one
        givenRules(AlertType.DUPLICATE_EXECUTION, rule(AlertType.DUPLICATE_EXECUTION, Map.of()));
        givenSaveEchoes();
        executionLogs.add(ExecutionLog.builder().taskId("t1").status(ExecutionLogStatus.SKIPPED)
                .duplicate(true).startTime(NOW.minusSeconds(5)).build());

        // When / Then
        assertEquals(1, alertEvaluationService.evaluate("t1", AlertType.DUPLICATE_EXECUTION));
    }

    @Test
    void testEvaluate_CooldownSuppressesRepeat() {
        // Given
        AlertRule rule = rule(AlertType.EXECUTION_FAILURE, Map.of(AlertRule.COOLDOWN_MINUTES, 15));
        rule.setLastTriggeredAt(NOW.minus(Duration.ofMinutes(5)));
        givenRules(AlertType.EXECUTION_FAILURE, rule);
        givenLogs(ExecutionLogStatus.FAILED, 3, NOW.minusSeconds(60));

        // When
        int sent = alertEvaluationService.evaluate("t1", AlertType.EXECUTION_FAILURE);

        // Then
        assertEquals(0, sent);
        verify(channelDispatchService, never()).send(any(), anyMap(), anyString(), anyString());
    }

    @Test
    void testEvaluate_RuleScopedToOtherTask() {
        // Given
        AlertRule other = rule(AlertType.EXECUTION_FAILURE, Map.of());
        other.setTaskId("t2");
        givenRules(AlertType.EXECUTION_FAILURE, other);
        givenLogs(ExecutionLogStatus.FAILED, 3, NOW.minusSeconds(60));

        // When / Then
        assertEquals(0, alertEvaluationService.evaluate("t1", AlertType.EXECUTION_FAILURE));
    }

    @Test
    void testEvaluate_DispatchFailureIsSwallowed() {
        // Given
        AlertRule rule = rule(AlertType.EXECUTION_FAILURE, Map.of());
        givenRules(AlertType.EXECUTION_FAILURE, rule);
        givenLogs(ExecutionLogStatus.FAILED, 1, NOW.minusSeconds(60));
        doThrow(new DeliveryException("slack_webhook returned HTTP 404: no_service"))
                .when(channelDispatchService).send(any(), anyMap(), anyString(), anyString());

        // When
        int sent = assertDoesNotThrow(() -> alertEvaluationService.evaluate("t1", AlertType.EXECUTION_FAILURE));

        // Then
        assertEquals(0, sent);
        assertNull(rule.getLastTriggeredAt());
        verify(alertRuleRepository, never()).save(any(AlertRule.class));
    }

    @Test
    void testEvaluate_RepositoryErrorIsSwallowed() {
        when(alertRuleRepository.findByUserIdAndRuleTypeAndEnabledTrue("u1", AlertType.EXECUTION_FAILURE))
                .thenReturn(Flux.error(new IllegalStateException("mongo down")));

        assertEquals(0, alertEvaluationService.evaluate("t1", AlertType.EXECUTION_FAILURE));
    }

    @Test
    void testEvaluate_HighFailureRate() {
        // Given
        givenRules(AlertType.HIGH_FAILURE_RATE, rule(AlertType.HIGH_FAILURE_RATE,
                Map.of(AlertRule.MIN_EXECUTIONS, 4, AlertRule.FAILURE_RATE_PERCENT, 50)));
        givenSaveEchoes();
        givenLogs(ExecutionLogStatus.FAILED, 3, NOW.minusSeconds(120));
        givenLogs(ExecutionLogStatus.SUCCESS, 1, NOW.minusSeconds(120));

        // When
        int sent = alertEvaluationService.evaluate("t1", AlertType.HIGH_FAILURE_RATE);

        // Then
        assertEquals(1, sent);
        verify(channelDispatchService).send(any(), anyMap(), anyString(), contains("failure rate 75% (3/4)"));
    }

    @Test
    void testEvaluate_HighFailureRateNeedsMinimumExecutions() {
        givenRules(AlertType.HIGH_FAILURE_RATE, rule(AlertType.HIGH_FAILURE_RATE, Map.of()));
        givenLogs(ExecutionLogStatus.FAILED, 3, NOW.minusSeconds(120));

        assertEquals(0, alertEvaluationService.evaluate("t1", AlertType.HIGH_FAILURE_RATE));
    }

    @Test
    void testEvaluate_LongRunning() {
        // Given
        givenRules(AlertType.LONG_RUNNING, rule(AlertType.LONG_RUNNING, Map.of(AlertRule.MAX_DURATION_SECONDS, "10")));
        givenSaveEchoes();
        executionLogs.add(ExecutionLog.builder().taskId("t1").status(ExecutionLogStatus.SUCCESS)
                .startTime(NOW.minusSeconds(60)).durationMs(12_000L).build());
        executionLogs.add(ExecutionLog.builder().taskId("t1").status(ExecutionLogStatus.SUCCESS)
                .startTime(NOW.minusSeconds(30)).durationMs(2_000L).build());

        // When
        int sent = alertEvaluationService.evaluate("t1", AlertType.LONG_RUNNING);

        // Then
        assertEquals(1, sent);
        verify(channelDispatchService).send(any(), anyMap(), anyString(), contains("1 executions longer than 10s"));
    }

    @Test
    void testEvaluate_UnknownTask() {
        assertEquals(0, alertEvaluationService.evaluate("missing", AlertType.EXECUTION_FAILURE));
        verify(alertRuleRepository, never()).findByUserIdAndRuleTypeAndEnabledTrue(anyString(), any());
    }
}
