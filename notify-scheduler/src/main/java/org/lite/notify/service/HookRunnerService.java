package org.lite.notify.service;

import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.HookType;
import org.lite.notify.model.HookConfig;
import org.lite.notify.model.HookResult;

import java.util.Map;

public interface HookRunnerService {

    /**
     * Run the task's script for a lifecycle point. Never throws: failures and
     * timeouts come back as unsuccessful results.
     * @param context extra values for the script, e.g. send_results or error
     */
    HookResult run(HookType hookType, NotificationTask task, Map<String, Object> context);

    /**
     * The enabled, non-empty hook config for the type, or null.
     */
    HookConfig resolve(NotificationTask task, HookType hookType);
}
