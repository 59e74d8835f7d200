package service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.ChannelType;
import org.lite.notify.enums.HookType;
import org.lite.notify.enums.ScriptType;
import org.lite.notify.model.HookConfig;
import org.lite.notify.model.HookResult;
import org.lite.notify.model.SingleChannelDelivery;
import org.lite.notify.service.impl.HookRunnerServiceImpl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class HookRunnerServiceImplTest {

    private HookRunnerServiceImpl hookRunnerService;

    @BeforeEach
    void setUp() {
        hookRunnerService = new HookRunnerServiceImpl(new SchedulerProperties(),
                new ObjectMapper().findAndRegisterModules(),
                Clock.fixed(Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private static NotificationTask taskWithHook(HookType hookType, HookConfig config) {
        return NotificationTask.builder()
                .id("t1")
                .userId("u1")
                .title("Standup")
                .content("Daily standup in 5 minutes")
                .delivery(new SingleChannelDelivery(ChannelType.WEBHOOK, Map.of("webhook_url", "https://hooks.example.com")))
                .scheduledTime(Instant.parse("2024-01-01T10:00:00Z"))
                .hooksConfig(config == null ? null : Map.of(hookType, config))
                .build();
    }

    private static HookConfig shell(String script) {
        return HookConfig.builder().enabled(true).scriptType(ScriptType.SHELL).script(script).build();
    }

    @Test
    void testRun_NoHookConfigured() {
        // When
        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, taskWithHook(HookType.BEFORE_EXECUTE, null), Map.of());

        // Then
        assertTrue(result.isSkipped());
        assertTrue(result.isSuccess());
    }

    @Test
    void testRun_DisabledHook() {
        HookConfig disabled = HookConfig.builder().enabled(false).scriptType(ScriptType.SHELL).script("exit 1").build();

        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, taskWithHook(HookType.BEFORE_EXECUTE, disabled), Map.of());

        assertTrue(result.isSkipped());
    }

    @Test
    void testRun_OtherHookTypeNotRun() {
        NotificationTask task = taskWithHook(HookType.AFTER_FAILURE, shell("exit 1"));

        HookResult result = hookRunnerService.run(HookType.AFTER_SUCCESS, task, Map.of());

        assertTrue(result.isSkipped());
    }

    @Test
    void testRun_ShellReceivesEnvironment() {
        // Given
        NotificationTask task = taskWithHook(HookType.BEFORE_EXECUTE,
                shell("echo \"task=$HOOK_TASK_ID type=$HOOK_TYPE at=$HOOK_TIMESTAMP\""));

        // When
        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, task, Map.of());

        // Then
        assertTrue(result.isSuccess(), result.getError());
        assertFalse(result.isSkipped());
        assertTrue(result.getOutput().contains("task=t1 type=before_execute at=2024-01-01T10:00:00Z"));
    }

    @Test
    void testRun_ShellAfterFailureSeesErrorAndContextFile() {
        // Given
        NotificationTask task = taskWithHook(HookType.AFTER_FAILURE,
                shell("echo \"error=$HOOK_ERROR\"\ncat \"$HOOK_CONTEXT_FILE\""));

        // When
        HookResult result = hookRunnerService.run(HookType.AFTER_FAILURE, task, Map.of("error", "webhook returned HTTP 500"));

        // Then
        assertTrue(result.isSuccess(), result.getError());
        assertTrue(result.getOutput().contains("error=webhook returned HTTP 500"));
        assertTrue(result.getOutput().contains("\"hook_type\":\"after_failure\""));
        assertTrue(result.getOutput().contains("\"title\":\"Standup\""));
    }

    @Test
    void testRun_ShellNonZeroExit() {
        NotificationTask task = taskWithHook(HookType.BEFORE_EXECUTE, shell("echo boom >&2\nexit 3"));

        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, task, Map.of());

        assertFalse(result.isSuccess());
        assertFalse(result.isTimedOut());
        assertEquals("boom", result.getError());
    }

    @Test
    void testRun_ShellSilentFailureReportsExitCode() {
        NotificationTask task = taskWithHook(HookType.BEFORE_EXECUTE, shell("exit 4"));

        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, task, Map.of());

        assertEquals("Script exited with code 4", result.getError());
    }

    @Test
    void testRun_ShellOutputWithInvalidUtf8() {
        // Given
        NotificationTask task = taskWithHook(HookType.BEFORE_EXECUTE, shell("printf '\\377\\376 ok\\n'"));

        // When
        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, task, Map.of());

        // Then
        assertTrue(result.isSuccess(), result.getError());
        assertTrue(result.getOutput().contains("ok"));
    }

    @Test
    void testRun_ShellResultPayloadBecomesData() {
        // Given
        NotificationTask task = taskWithHook(HookType.AFTER_SUCCESS, shell(
                "echo __HOOK_RESULT_START__\necho '{\"success\": true, \"data\": {\"rows\": 3}}'\necho __HOOK_RESULT_END__"));

        // When
        HookResult result = hookRunnerService.run(HookType.AFTER_SUCCESS, task, Map.of("send_results", Map.of()));

        // Then
        assertTrue(result.isSuccess());
        assertEquals(3, result.getData().get("rows"));
    }

    @Test
    void testRun_TimeoutKillsScript() {
        // Given
        HookConfig slow = HookConfig.builder().enabled(true).scriptType(ScriptType.SHELL)
                .script("sleep 10").timeoutSeconds(1).build();
        NotificationTask task = taskWithHook(HookType.BEFORE_EXECUTE, slow);

        // When
        long started = System.nanoTime();
        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, task, Map.of());
        long elapsedSeconds = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started);

        // Then
        assertTrue(result.isTimedOut());
        assertFalse(result.isSuccess());
        assertEquals("Script timeout after 1 seconds", result.getError());
        assertTrue(elapsedSeconds < 8, "hook was not killed at its deadline");
    }

    @Test
    void testRun_WorkingDirectoryRemoved() throws Exception {
        // Given
        NotificationTask task = taskWithHook(HookType.BEFORE_EXECUTE, shell("pwd"));

        // When
        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, task, Map.of());

        // Then
        Path workDir = Path.of(result.getOutput().strip());
        assertTrue(workDir.getFileName().toString().startsWith("notify-hook-"));
        assertFalse(Files.exists(workDir));
    }

    @Test
    void testRun_PythonResultData() {
        assumeTrue(pythonAvailable(), "python3 not installed");

        // Given
        HookConfig python = HookConfig.builder().enabled(true).scriptType(ScriptType.PYTHON)
                .script("result_data['task'] = task_id\nresult_data['count'] = len(task['title'])").build();
        NotificationTask task = taskWithHook(HookType.BEFORE_EXECUTE, python);

        // When
        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, task, Map.of());

        // Then
        assertTrue(result.isSuccess(), result.getError());
        assertEquals("t1", result.getData().get("task"));
        assertEquals(7, result.getData().get("count"));
    }

    @Test
    void testRun_PythonExceptionReported() {
        assumeTrue(pythonAvailable(), "python3 not installed");

        HookConfig python = HookConfig.builder().enabled(true).scriptType(ScriptType.PYTHON)
                .script("raise ValueError('bad input')").build();

        HookResult result = hookRunnerService.run(HookType.BEFORE_EXECUTE, taskWithHook(HookType.BEFORE_EXECUTE, python), Map.of());

        assertFalse(result.isSuccess());
        assertEquals("ValueError: bad input", result.getError());
    }

    private static boolean pythonAvailable() {
        try {
            Process process = new ProcessBuilder("python3", "--version").redirectErrorStream(true).start();
            return process.waitFor(5, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (Exception e) {
            return false;
        }
    }
}
