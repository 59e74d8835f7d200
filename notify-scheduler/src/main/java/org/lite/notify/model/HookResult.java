package org.lite.notify.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of one hook invocation. A skipped hook is reported as successful.
 */
@Value
@Builder
public class HookResult {
    boolean success;
    boolean skipped;
    boolean timedOut;
    String output;
    String error;
    @Builder.Default
    Map<String, Object> data = Map.of();

    public static HookResult skippedResult() {
        return HookResult.builder().success(true).skipped(true).build();
    }

    public static HookResult failure(String error, String output) {
        return HookResult.builder().success(false).error(error).output(output).build();
    }
}
