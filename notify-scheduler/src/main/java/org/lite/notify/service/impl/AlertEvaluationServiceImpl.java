package org.lite.notify.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.entity.AlertRule;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.AlertType;
import org.lite.notify.enums.ExecutionLogStatus;
import org.lite.notify.repository.AlertRuleRepository;
import org.lite.notify.service.AlertEvaluationService;
import org.lite.notify.service.ChannelDispatchService;
import org.lite.notify.service.ExecutionLogService;
import org.lite.notify.service.TaskStoreService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluationServiceImpl implements AlertEvaluationService {

    private static final long DEFAULT_WINDOW_MINUTES = 60;
    private static final long DEFAULT_THRESHOLD = 1;
    private static final long DEFAULT_MAX_DURATION_SECONDS = 60;
    private static final long DEFAULT_MIN_EXECUTIONS = 5;
    private static final long DEFAULT_FAILURE_RATE_PERCENT = 50;

    private final AlertRuleRepository alertRuleRepository;
    private final TaskStoreService taskStoreService;
    private final ExecutionLogService executionLogService;
    private final ChannelDispatchService channelDispatchService;
    private final Clock clock;

    @Override
    public int evaluate(String taskId, AlertType alertType) {
        try {
            Optional<NotificationTask> task = taskStoreService.findById(taskId);
            if (task.isEmpty()) {
                log.debug("[Alert] Task {} not found, nothing to evaluate", taskId);
                return 0;
            }
            List<AlertRule> rules = alertRuleRepository
                    .findByUserIdAndRuleTypeAndEnabledTrue(task.get().getUserId(), alertType)
                    .filter(rule -> rule.appliesTo(taskId))
                    .collectList()
                    .block();
            if (rules == null || rules.isEmpty()) {
                return 0;
            }

            int sent = 0;
            for (AlertRule rule : rules) {
                if (evaluateRule(rule, task.get())) {
                    sent++;
                }
            }
            return sent;
        } catch (Exception e) {
            log.error("[Alert] Evaluation of {} for task {} failed: {}", alertType, taskId, e.getMessage(), e);
            return 0;
        }
    }

    private boolean evaluateRule(AlertRule rule, NotificationTask task) {
        Instant now = clock.instant();
        long cooldownMinutes = rule.longParameter(AlertRule.COOLDOWN_MINUTES, 0);
        if (cooldownMinutes > 0 && rule.getLastTriggeredAt() != null
                && rule.getLastTriggeredAt().plus(Duration.ofMinutes(cooldownMinutes)).isAfter(now)) {
            log.debug("[Alert] Rule {} in cooldown until {}", rule.getId(),
                    rule.getLastTriggeredAt().plus(Duration.ofMinutes(cooldownMinutes)));
            return false;
        }

        Instant since = now.minus(Duration.ofMinutes(rule.longParameter(AlertRule.TIME_WINDOW_MINUTES, DEFAULT_WINDOW_MINUTES)));
        Optional<String> detail = switch (rule.getRuleType()) {
            case DUPLICATE_EXECUTION -> thresholdReached(rule,
                    executionLogService.countDuplicates(task.getId(), since), "duplicate executions");
            case EXECUTION_FAILURE -> thresholdReached(rule,
                    executionLogService.countByStatus(task.getId(), ExecutionLogStatus.FAILED, since), "failed executions");
            case LONG_RUNNING -> {
                long maxSeconds = rule.longParameter(AlertRule.MAX_DURATION_SECONDS, DEFAULT_MAX_DURATION_SECONDS);
                yield thresholdReached(rule,
                        executionLogService.countLongerThan(task.getId(), maxSeconds * 1000, since),
                        "executions longer than " + maxSeconds + "s");
            }
            case HIGH_FAILURE_RATE -> failureRate(rule, task.getId(), since);
        };
        if (detail.isEmpty()) {
            return false;
        }

        String title = "[Notify Alert] " + (rule.getName() == null ? rule.getRuleType().name() : rule.getName());
        String body = "Task '" + task.getTitle() + "' (" + task.getId() + "): " + detail.get();
        try {
            channelDispatchService.send(rule.getAlertChannel(), rule.getAlertChannelConfig(), title, body);
        } catch (Exception e) {
            log.error("[Alert] Failed to send alert for rule {} on task {}: {}", rule.getId(), task.getId(), e.getMessage());
            return false;
        }

        rule.setLastTriggeredAt(now);
        alertRuleRepository.save(rule).block();
        log.info("[Alert] Rule {} triggered for task {}: {}", rule.getId(), task.getId(), detail.get());
        return true;
    }

    private Optional<String> thresholdReached(AlertRule rule, long count, String what) {
        long threshold = rule.longParameter(AlertRule.THRESHOLD, DEFAULT_THRESHOLD);
        if (count < threshold) {
            return Optional.empty();
        }
        return Optional.of(count + " " + what + " in the last "
                + rule.longParameter(AlertRule.TIME_WINDOW_MINUTES, DEFAULT_WINDOW_MINUTES) + " minutes (threshold " + threshold + ")");
    }

    private Optional<String> failureRate(AlertRule rule, String taskId, Instant since) {
        long completed = executionLogService.countCompleted(taskId, since);
        long minExecutions = rule.longParameter(AlertRule.MIN_EXECUTIONS, DEFAULT_MIN_EXECUTIONS);
        if (completed == 0 || completed < minExecutions) {
            return Optional.empty();
        }
        long failed = executionLogService.countByStatus(taskId, ExecutionLogStatus.FAILED, since);
        long percent = failed * 100 / completed;
        long limit = rule.longParameter(AlertRule.FAILURE_RATE_PERCENT, DEFAULT_FAILURE_RATE_PERCENT);
        if (percent < limit) {
            return Optional.empty();
        }
        return Optional.of("failure rate " + percent + "% (" + failed + "/" + completed + ") over limit " + limit + "%");
    }
}
