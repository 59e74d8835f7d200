package org.lite.notify.model;

import java.time.Instant;

/**
 * Snapshot of one live Quartz registration.
 */
public record ScheduledJobInfo(String jobId, String taskId, Instant nextFireTime, String trigger) {
}
