package com.whereq.pacer.generator;

import com.whereq.pacer.config.PacerProperties;
import com.whereq.pacer.model.JobKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps job keys to artifact files. The location depends on the key alone,
 * so any instance sharing the directory can serve a download.
 */
@Slf4j
@Component
public class ArtifactLocator {

    public static final String ARTIFACT_SUFFIX = "_plan.xlsx";

    private final Path directory;

    @Autowired
    public ArtifactLocator(PacerProperties properties) {
        this(Path.of(properties.getArtifacts().getDirectory()));
    }

    public ArtifactLocator(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
        log.info("Training plan artifacts stored in {}", this.directory);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * File name of the artifact for a key, e.g. {@code jane_doe_plan.xlsx}
     */
    public String fileNameFor(JobKey key) {
        return key.artifactSlug() + ARTIFACT_SUFFIX;
    }

    public Path pathFor(JobKey key) {
        return directory.resolve(fileNameFor(key));
    }

    /**
     * Resolve a stored artifact reference, rejecting anything outside the artifact directory
     */
    public Optional<Path> resolve(String artifactRef) {
        if (artifactRef == null || artifactRef.isBlank()) {
            return Optional.empty();
        }
        Path resolved = directory.resolve(artifactRef).normalize();
        if (!resolved.startsWith(directory) || resolved.equals(directory)) {
            log.warn("Artifact reference {} escapes {}", artifactRef, directory);
            return Optional.empty();
        }
        return Optional.of(resolved);
    }
}
