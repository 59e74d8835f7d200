package org.lite.notify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.notify.enums.ScriptType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HookConfig {
    private boolean enabled;
    @Builder.Default
    private ScriptType scriptType = ScriptType.PYTHON;
    private String script;
    private Integer timeoutSeconds;         // null falls back to notify.scheduler.hooks.default-timeout

    public boolean isRunnable() {
        return enabled && script != null && !script.isBlank();
    }
}
