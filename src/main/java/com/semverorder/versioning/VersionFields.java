package com.semverorder.versioning;

import java.util.Objects;
import java.util.Optional;

public record VersionFields(
        String major,
        String minor,
        String patch,
        Optional<String> preRelease,
        Optional<String> buildMetadata) {

    public VersionFields {
        Objects.requireNonNull(major, "major");
        Objects.requireNonNull(minor, "minor");
        Objects.requireNonNull(patch, "patch");
        preRelease = preRelease == null ? Optional.empty() : preRelease;
        buildMetadata = buildMetadata == null ? Optional.empty() : buildMetadata;
    }
}
