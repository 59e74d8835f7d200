package org.lite.notify.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "notify.scheduler")
@Validated
@Data
public class SchedulerProperties {

    /**
     * Zone used for cron evaluation and message placeholders.
     */
    @NotBlank
    private String timeZone = "UTC";

    /**
     * Firings of the same task started closer together than this are treated as duplicates.
     */
    @NotNull
    private Duration duplicateWindow = Duration.ofSeconds(3);

    private Hooks hooks = new Hooks();
    private Dispatch dispatch = new Dispatch();
    private Events events = new Events();

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    @Data
    public static class Hooks {
        @Min(1)
        private int defaultTimeoutSeconds = 30;
        private String pythonExecutable = "python3";
        private String shellExecutable = "bash";
        private int maxOutputLength = 10000;        // stored stdout
        private int maxScriptSnapshotLength = 5000; // stored script copy
    }

    @Data
    public static class Dispatch {
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private String pushplusUrl = "http://www.pushplus.plus/send";
        private String serverchanUrlTemplate = "https://sctapi.ftqq.com/%s.send";
    }

    @Data
    public static class Events {
        @Min(1)
        private int listenerBufferSize = 10;
    }
}
