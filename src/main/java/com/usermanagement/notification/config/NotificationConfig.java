package com.usermanagement.notification.config;

import com.usermanagement.notification.messaging.availability.AvailabilityGate;
import com.usermanagement.notification.messaging.capture.CaptureBuffer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class NotificationConfig {

    static final String TEST_MODE_PROPERTY = "notification.test-mode";

    /**
     * Test mode is looked up on each publish so that it can be switched without a restart.
     */
    @Bean
    public AvailabilityGate availabilityGate(Environment environment) {
        return new AvailabilityGate(() -> environment.getProperty(TEST_MODE_PROPERTY, Boolean.class, false));
    }

    @Bean
    public CaptureBuffer captureBuffer() {
        return new CaptureBuffer();
    }

    @Bean
    public ThreadPoolTaskScheduler notificationTaskScheduler(NotificationProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getWorker().getPoolSize());
        scheduler.setThreadNamePrefix("notification-worker-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
