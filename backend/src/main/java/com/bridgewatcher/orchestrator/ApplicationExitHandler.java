package com.bridgewatcher.orchestrator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Shuts the application down with exit code 1 after a fatal watcher error. Runs on its own thread because
 * closing the context stops the orchestrator, which must not wait on itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationExitHandler implements WatcherTerminationHandler {

    static final int FATAL_EXIT_CODE = 1;

    private final ConfigurableApplicationContext context;

    @Override
    public void onFatalError(Throwable cause) {
        Thread exit = new Thread(() -> {
            log.error("Shutting down bridge watcher after fatal error: {}", cause.getMessage());
            System.exit(SpringApplication.exit(context, () -> FATAL_EXIT_CODE));
        }, "watcher-exit");
        exit.setDaemon(false);
        exit.start();
    }
}
