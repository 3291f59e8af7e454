package com.vidnyan.configguard.adapter.in.cli;

import com.vidnyan.configguard.TestFixtures;
import com.vidnyan.configguard.adapter.out.report.SecurityReportFormatter;
import com.vidnyan.configguard.domain.scan.ScoringPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScanCliRunnerTest {

    @TempDir
    Path tempDir;

    private ScanCliRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ScanCliRunner(
                TestFixtures.scanService(TestFixtures.bundledRules()),
                TestFixtures.ruleRepository(),
                new ArtifactDirectoryReader(),
                new SecurityReportFormatter(ScoringPolicy.defaults()),
                null);
    }

    @Test
    void insecureDockerfile_ShouldExitBlocked() throws Exception {
        Files.writeString(tempDir.resolve("Dockerfile"), "FROM python:latest\nCMD [\"python\"]\n");

        assertEquals(ScanCliRunner.EXIT_BLOCKED, runner.scan(tempDir, ""));
    }

    @Test
    void hardenedDockerfile_ShouldExitApproved() throws Exception {
        Files.writeString(tempDir.resolve("Dockerfile"), """
                FROM python:3.11-slim
                USER appuser
                HEALTHCHECK CMD curl -f http://localhost:8080/health || exit 1
                """);

        assertEquals(ScanCliRunner.EXIT_APPROVED, runner.scan(tempDir, null));
    }

    @Test
    void customRuleDocument_ShouldDriveTheGate() throws Exception {
        Files.writeString(tempDir.resolve("Dockerfile"), "FROM python:latest\nUSER app\n");
        Path rules = Files.writeString(tempDir.resolve("rules.yaml"), """
                security_rules:
                  - id: LATEST-ONLY
                    severity: HIGH
                    check: PATTERN
                    patterns: [':latest']
                    applies_to: [dockerfile]
                """);

        assertEquals(ScanCliRunner.EXIT_REVIEW_REQUIRED, runner.scan(tempDir, rules.toString()));
    }

    @Test
    void invalidRuleDocument_ShouldExitWithConfigurationError() throws Exception {
        Files.writeString(tempDir.resolve("Dockerfile"), "FROM alpine:3.19\n");
        Path rules = Files.writeString(tempDir.resolve("rules.yaml"), "security_rules: []\n");

        assertEquals(ScanCliRunner.EXIT_CONFIGURATION_ERROR, runner.scan(tempDir, rules.toString()));
    }

    @Test
    void missingDirectory_ShouldExitWithConfigurationError() {
        assertEquals(ScanCliRunner.EXIT_CONFIGURATION_ERROR, runner.scan(tempDir.resolve("missing"), null));
    }
}
