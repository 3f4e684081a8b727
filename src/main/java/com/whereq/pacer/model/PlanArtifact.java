package com.whereq.pacer.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * A completed plan's spreadsheet, verified to exist when resolved
 */
@Value
public class PlanArtifact {
    JobRecord record;
    String fileName;
    Path path;
    long size;
}
