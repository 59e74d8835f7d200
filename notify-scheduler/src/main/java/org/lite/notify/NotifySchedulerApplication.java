package org.lite.notify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NotifySchedulerApplication {
    public static void main(String[] args) {
        SpringApplication.run(NotifySchedulerApplication.class, args);
    }
}
