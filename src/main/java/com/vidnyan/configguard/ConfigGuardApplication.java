package com.vidnyan.configguard;

import com.vidnyan.configguard.adapter.in.cli.ScanCliRunner;
import com.vidnyan.configguard.exception.RuleLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Optional;

/**
 * ConfigGuard - security scanner and deployment gate for generated
 * Dockerfiles, compose files and Kubernetes manifests.
 */
@Slf4j
@SpringBootApplication
public class ConfigGuardApplication {

    public static void main(String[] args) {
        try {
            SpringApplication.run(ConfigGuardApplication.class, args);
        } catch (RuntimeException e) {
            Optional<RuleLoadException> ruleLoadFailure = ruleLoadFailure(e);
            if (ruleLoadFailure.isEmpty()) {
                throw e;
            }
            log.error("Startup aborted, rule configuration error: {}", ruleLoadFailure.get().getMessage());
            System.exit(ScanCliRunner.EXIT_CONFIGURATION_ERROR);
        }
    }

    /**
     * Rule load failure anywhere in the cause chain of a startup failure.
     */
    static Optional<RuleLoadException> ruleLoadFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof RuleLoadException) {
                return Optional.of((RuleLoadException) t);
            }
        }
        return Optional.empty();
    }
}
