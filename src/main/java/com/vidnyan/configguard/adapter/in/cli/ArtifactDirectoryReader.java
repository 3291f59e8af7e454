package com.vidnyan.configguard.adapter.in.cli;

import com.vidnyan.configguard.domain.artifact.ArtifactKinds;
import com.vidnyan.configguard.domain.artifact.ArtifactSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Collects generated deployment artifacts from a directory.
 * <p>
 * Several manifests (or workflows) are joined into one multi-document YAML text, in file name
 * order, so reported line numbers refer to the joined text.
 */
@Slf4j
@Component
public class ArtifactDirectoryReader {

    static final String DOCUMENT_SEPARATOR = "---";

    private static final Set<String> COMPOSE_FILES = Set.of(
            "docker-compose.yml", "docker-compose.yaml", "compose.yml", "compose.yaml");
    private static final Set<String> MANIFEST_FILES = Set.of("deployment.yml", "deployment.yaml");
    private static final List<String> MANIFEST_DIRS = List.of("k8s", "kubernetes");
    private static final Path WORKFLOW_DIR = Path.of(".github", "workflows");

    /**
     * Read every recognised artifact under the directory.
     */
    public ArtifactSet read(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }

        Map<String, String> artifacts = new LinkedHashMap<>();

        Path dockerfile = directory.resolve("Dockerfile");
        if (Files.isRegularFile(dockerfile)) {
            artifacts.put(ArtifactKinds.DOCKERFILE, Files.readString(dockerfile));
        }

        List<Path> composeFiles = filesIn(directory, name -> COMPOSE_FILES.contains(name));
        if (!composeFiles.isEmpty()) {
            if (composeFiles.size() > 1) {
                log.warn("Several compose files in {}, scanning {}", directory, composeFiles.get(0).getFileName());
            }
            artifacts.put(ArtifactKinds.COMPOSE, Files.readString(composeFiles.get(0)));
        }

        List<Path> manifests = new ArrayList<>(filesIn(directory, name -> MANIFEST_FILES.contains(name)));
        for (String dir : MANIFEST_DIRS) {
            manifests.addAll(filesIn(directory.resolve(dir), ArtifactDirectoryReader::isYaml));
        }
        join(manifests).ifPresent(text -> artifacts.put(ArtifactKinds.KUBERNETES, text));

        List<Path> pipelines = new ArrayList<>(filesIn(directory, ".gitlab-ci.yml"::equals));
        pipelines.addAll(filesIn(directory.resolve(WORKFLOW_DIR), ArtifactDirectoryReader::isYaml));
        join(pipelines).ifPresent(text -> artifacts.put(ArtifactKinds.CICD, text));

        log.info("Found artifacts {} in {}", artifacts.keySet(), directory);
        return ArtifactSet.of(artifacts);
    }

    private static List<Path> filesIn(Path dir, Predicate<String> nameFilter) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> nameFilter.test(p.getFileName().toString()))
                    .sorted()
                    .toList();
        }
    }

    private static Optional<String> join(List<Path> files) throws IOException {
        if (files.isEmpty()) {
            return Optional.empty();
        }
        List<String> documents = new ArrayList<>();
        for (Path file : files) {
            documents.add(Files.readString(file).stripTrailing());
        }
        return Optional.of(String.join("\n" + DOCUMENT_SEPARATOR + "\n", documents) + "\n");
    }

    private static boolean isYaml(String name) {
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }
}
