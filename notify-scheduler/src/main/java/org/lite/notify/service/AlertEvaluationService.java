package org.lite.notify.service;

import org.lite.notify.enums.AlertType;

public interface AlertEvaluationService {

    /**
     * Check the task owner's enabled rules of the given type and send an alert
     * for every rule whose threshold is reached. Never throws.
     * @return number of alerts sent
     */
    int evaluate(String taskId, AlertType alertType);
}
