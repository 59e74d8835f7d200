package org.lite.notify.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.HookType;
import org.lite.notify.enums.ScriptType;
import org.lite.notify.executor.SandboxedScriptProcess;
import org.lite.notify.model.HookConfig;
import org.lite.notify.model.HookResult;
import org.lite.notify.service.HookRunnerService;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs user hook scripts in a per-invocation sandbox directory. Python
 * scripts are wrapped so that {@code result_data} and uncaught exceptions
 * come back between markers; shell scripts get their inputs as environment
 * variables.
 */
@Service
@Slf4j
public class HookRunnerServiceImpl implements HookRunnerService {

    static final String RESULT_START = "__HOOK_RESULT_START__";
    static final String RESULT_END = "__HOOK_RESULT_END__";
    static final String ERROR_START = "__HOOK_ERROR_START__";
    static final String ERROR_END = "__HOOK_ERROR_END__";

    private static final String CONTEXT_FILE = "context.json";

    private static final String PYTHON_PROLOGUE = """
            import json
            import sys
            import traceback

            with open('context.json', 'r', encoding='utf-8') as _f:
                context = json.load(_f)

            task = context.get('task', {})
            task_id = context.get('task_id')
            hook_type = context.get('hook_type')
            timestamp = context.get('timestamp')
            send_results = context.get('send_results', {})
            error = context.get('error')
            result_data = {}

            try:
                pass
            """;

    private static final String PYTHON_EPILOGUE = """
                print('__HOOK_RESULT_START__')
                print(json.dumps({'success': True, 'data': result_data}, ensure_ascii=False, default=str))
                print('__HOOK_RESULT_END__')
            except Exception as _e:
                print('__HOOK_ERROR_START__', file=sys.stderr)
                print(json.dumps({'error': str(_e), 'type': type(_e).__name__, 'traceback': traceback.format_exc()}), file=sys.stderr)
                print('__HOOK_ERROR_END__', file=sys.stderr)
                sys.exit(1)
            """;

    private final SchedulerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HookRunnerServiceImpl(SchedulerProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public HookConfig resolve(NotificationTask task, HookType hookType) {
        Map<HookType, HookConfig> hooks = task.getHooksConfig();
        if (hooks == null) {
            return null;
        }
        HookConfig config = hooks.get(hookType);
        return config != null && config.isRunnable() ? config : null;
    }

    @Override
    public HookResult run(HookType hookType, NotificationTask task, Map<String, Object> context) {
        HookConfig config = resolve(task, hookType);
        if (config == null) {
            return HookResult.skippedResult();
        }

        ScriptType scriptType = config.getScriptType() == null ? ScriptType.PYTHON : config.getScriptType();
        int timeoutSeconds = timeoutSeconds(config);

        Map<String, Object> hookContext = new LinkedHashMap<>();
        hookContext.put("task_id", task.getId());
        hookContext.put("task", task.toSnapshot());
        hookContext.put("hook_type", hookType.getValue());
        hookContext.put("timestamp", clock.instant().toString());
        if (context != null) {
            hookContext.putAll(context);
        }

        log.info("[Hook] Running {} {} hook for task {} (timeout={}s)",
                scriptType, hookType.getValue(), task.getId(), timeoutSeconds);

        try (SandboxedScriptProcess sandbox = SandboxedScriptProcess.create("notify-hook-")) {
            String contextJson = objectMapper.writeValueAsString(hookContext);
            sandbox.writeFile(CONTEXT_FILE, contextJson);

            SandboxedScriptProcess.Execution execution = switch (scriptType) {
                case PYTHON -> runPython(sandbox, config.getScript(), timeoutSeconds);
                case SHELL -> runShell(sandbox, config.getScript(), hookContext, contextJson, timeoutSeconds);
            };
            HookResult result = interpret(execution, timeoutSeconds);
            if (result.isSuccess()) {
                log.info("[Hook] {} hook for task {} succeeded", hookType.getValue(), task.getId());
            } else {
                log.warn("[Hook] {} hook for task {} failed: {}", hookType.getValue(), task.getId(), result.getError());
            }
            return result;
        } catch (IOException e) {
            log.error("[Hook] Failed to run {} hook for task {}: {}", hookType.getValue(), task.getId(), e.getMessage());
            return HookResult.failure("Failed to execute " + scriptType.name().toLowerCase() + " script: " + e.getMessage(), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HookResult.failure("Hook execution interrupted", null);
        }
    }

    private SandboxedScriptProcess.Execution runPython(SandboxedScriptProcess sandbox, String script, int timeoutSeconds)
            throws IOException, InterruptedException {
        sandbox.writeFile("hook_script.py", wrapPython(script));
        return sandbox.run(List.of(properties.getHooks().getPythonExecutable(), "hook_script.py"),
                Map.of("PYTHONIOENCODING", "utf-8"), Duration.ofSeconds(timeoutSeconds));
    }

    private SandboxedScriptProcess.Execution runShell(SandboxedScriptProcess sandbox, String script,
                                                      Map<String, Object> hookContext, String contextJson,
                                                      int timeoutSeconds) throws IOException, InterruptedException {
        sandbox.writeFile("hook_script.sh", script);

        Map<String, String> env = new HashMap<>();
        env.put("HOOK_TASK_ID", String.valueOf(hookContext.get("task_id")));
        env.put("HOOK_TYPE", String.valueOf(hookContext.get("hook_type")));
        env.put("HOOK_TIMESTAMP", String.valueOf(hookContext.get("timestamp")));
        env.put("HOOK_TASK_JSON", objectMapper.writeValueAsString(hookContext.get("task")));
        env.put("HOOK_CONTEXT_FILE", sandbox.getWorkDir().resolve(CONTEXT_FILE).toString());
        if (hookContext.containsKey("send_results")) {
            env.put("HOOK_SEND_RESULTS_JSON", objectMapper.writeValueAsString(hookContext.get("send_results")));
        }
        if (hookContext.get("error") != null) {
            env.put("HOOK_ERROR", String.valueOf(hookContext.get("error")));
        }
        log.debug("[Hook] Shell context size {} bytes", contextJson.length());

        return sandbox.run(List.of(properties.getHooks().getShellExecutable(), "hook_script.sh"),
                env, Duration.ofSeconds(timeoutSeconds));
    }

    HookResult interpret(SandboxedScriptProcess.Execution execution, int timeoutSeconds) {
        String stdout = execution.stdout();
        if (execution.timedOut()) {
            return HookResult.builder()
                    .success(false)
                    .timedOut(true)
                    .output(stdout)
                    .error("Script timeout after " + timeoutSeconds + " seconds")
                    .build();
        }

        Map<String, Object> payload = parseResultPayload(stdout);
        if (execution.exitCode() == 0) {
            Map<String, Object> data = new LinkedHashMap<>();
            if (payload != null && payload.get("data") instanceof Map<?, ?> raw) {
                raw.forEach((key, value) -> {
                    if (value != null) {
                        data.put(String.valueOf(key), value);
                    }
                });
            }
            return HookResult.builder().success(true).output(stdout).data(data).build();
        }

        return HookResult.failure(extractError(execution), stdout);
    }

    private String extractError(SandboxedScriptProcess.Execution execution) {
        String block = between(execution.stderr(), ERROR_START, ERROR_END);
        if (block != null) {
            try {
                Map<String, Object> error = objectMapper.readValue(block, new TypeReference<>() {});
                Object message = error.get("error");
                Object type = error.get("type");
                if (message != null) {
                    return type == null ? message.toString() : type + ": " + message;
                }
            } catch (JsonProcessingException e) {
                return block;
            }
        }
        String stderr = execution.stderr() == null ? "" : execution.stderr().strip();
        if (!stderr.isEmpty()) {
            return stderr;
        }
        return "Script exited with code " + execution.exitCode();
    }

    private Map<String, Object> parseResultPayload(String stdout) {
        String block = between(stdout, RESULT_START, RESULT_END);
        if (block == null) {
            return null;
        }
        try {
            return objectMapper.readValue(block, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            log.warn("[Hook] Unreadable result payload: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String between(String text, String start, String end) {
        if (text == null) {
            return null;
        }
        int from = text.indexOf(start);
        int to = text.indexOf(end, from + 1);
        if (from < 0 || to < 0) {
            return null;
        }
        return text.substring(from + start.length(), to).strip();
    }

    private int timeoutSeconds(HookConfig config) {
        Integer configured = config.getTimeoutSeconds();
        return configured != null && configured > 0 ? configured : properties.getHooks().getDefaultTimeoutSeconds();
    }

    static String wrapPython(String script) {
        String body = script.lines()
                .map(line -> "    " + line)
                .collect(Collectors.joining("\n"));
        return PYTHON_PROLOGUE + body + "\n" + PYTHON_EPILOGUE;
    }
}
