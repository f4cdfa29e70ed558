package com.fintech.subscriptions.lifecycle;

import com.fintech.subscriptions.service.FatalConditionHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes the application context and exits with status 1. The service is expected to run
 * under a supervisor that restarts it.
 */
@Component
@Slf4j
public class ProcessExitHandler implements FatalConditionHandler {

    static final int EXIT_CODE = 1;

    private final ApplicationContext applicationContext;
    private final AtomicBoolean exiting = new AtomicBoolean();

    public ProcessExitHandler(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public void onFatal(Throwable error) {
        log.error("Fatal condition, shutting down: {}", error.getMessage(), error);
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        // Off the calling thread: closing the context interrupts the supervisor's threads
        Thread shutdown = new Thread(
                () -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_CODE)),
                "fatal-shutdown");
        shutdown.start();
    }
}
