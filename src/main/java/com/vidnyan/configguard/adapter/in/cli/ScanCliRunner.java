package com.vidnyan.configguard.adapter.in.cli;

import com.vidnyan.configguard.adapter.out.report.SecurityReportFormatter;
import com.vidnyan.configguard.application.port.in.ScanConfigurationUseCase;
import com.vidnyan.configguard.application.port.out.RuleRepository;
import com.vidnyan.configguard.domain.artifact.ArtifactSet;
import com.vidnyan.configguard.domain.rule.RuleSet;
import com.vidnyan.configguard.domain.scan.ScanResult;
import com.vidnyan.configguard.exception.RuleLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * CLI Runner for scanning a directory of generated artifacts.
 * Runs when configguard.scan.path is set, then exits with the gate decision:
 * 0 approved, 1 review required, 2 blocked, 3 rule document, input or scanner failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanCliRunner implements CommandLineRunner {

    public static final int EXIT_APPROVED = 0;
    public static final int EXIT_REVIEW_REQUIRED = 1;
    public static final int EXIT_BLOCKED = 2;
    public static final int EXIT_CONFIGURATION_ERROR = 3;

    private final ScanConfigurationUseCase scanUseCase;
    private final RuleRepository ruleRepository;
    private final ArtifactDirectoryReader artifactReader;
    private final SecurityReportFormatter reportFormatter;
    private final ConfigurableApplicationContext context;

    @Value("${configguard.scan.path:}")
    private String scanPath;

    @Value("${configguard.scan.rules:}")
    private String rulesPath;

    @Override
    public void run(String... args) {
        if (scanPath == null || scanPath.isBlank()) {
            log.info("No scan path specified. Set configguard.scan.path to scan from the command line.");
            return;
        }

        int exitCode = EXIT_CONFIGURATION_ERROR;
        try {
            exitCode = scan(Path.of(scanPath), rulesPath);
        } catch (RuntimeException e) {
            log.error("Scan of {} failed", scanPath, e);
        } finally {
            int code = exitCode;
            System.exit(SpringApplication.exit(context, () -> code));
        }
    }

    /**
     * Scan the directory and log the report.
     *
     * @return process exit code for the gate decision
     */
    int scan(Path directory, String ruleDocument) {
        log.info("Scanning generated artifacts in {}", directory.toAbsolutePath());

        ArtifactSet artifacts;
        try {
            artifacts = artifactReader.read(directory);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot read artifacts from {}: {}", directory, e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        if (artifacts.isEmpty()) {
            log.warn("No Dockerfile, compose file, manifest or pipeline found in {}", directory);
        }

        ScanResult result;
        try {
            if (ruleDocument == null || ruleDocument.isBlank()) {
                result = scanUseCase.scan(artifacts);
            } else {
                RuleSet rules = ruleRepository.load(new FileSystemResource(ruleDocument));
                result = scanUseCase.scan(rules, artifacts);
            }
        } catch (RuleLoadException e) {
            log.error("Rule configuration error, scan aborted: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        log.info("\n{}", reportFormatter.format(result));

        return switch (result.status()) {
            case APPROVED -> EXIT_APPROVED;
            case REVIEW_REQUIRED -> EXIT_REVIEW_REQUIRED;
            case BLOCKED -> EXIT_BLOCKED;
        };
    }
}
