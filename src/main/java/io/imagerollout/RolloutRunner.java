package io.imagerollout;

import io.imagerollout.health.NoHealthyEndpointException;
import io.imagerollout.report.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Starts the rollout once the application context is up and turns its outcome into a process exit code.
 * A run that reaches its summary exits with 0 even if individual actions failed.
 */
@Slf4j
public class RolloutRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_NO_HEALTHY_ENDPOINT = 1;

    private final RolloutManager rolloutManager;
    private int exitCode = 0;
    private RunSummary summary;

    public RolloutRunner(RolloutManager rolloutManager) {
        this.rolloutManager = rolloutManager;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            summary = rolloutManager.run();
        } catch (NoHealthyEndpointException e) {
            log.error("Aborting rollout: {}", e.getMessage());
            exitCode = EXIT_NO_HEALTHY_ENDPOINT;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public RunSummary getSummary() {
        return summary;
    }
}
