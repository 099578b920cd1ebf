package com.semverorder.versioning;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SemanticVersion implements Comparable<SemanticVersion> {
    public static final Comparator<SemanticVersion> PRECEDENCE = new PrecedenceComparator();

    private final BigInteger major;
    private final BigInteger minor;
    private final BigInteger patch;
    private final String preRelease;
    private final String buildMetadata;
    private final String raw;

    private SemanticVersion(BigInteger major, BigInteger minor, BigInteger patch, String preRelease, String buildMetadata, String raw) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.preRelease = preRelease;
        this.buildMetadata = buildMetadata;
        this.raw = raw;
    }

    public static SemanticVersion parse(String value) {
        VersionFields fields = VersionGrammar.parse(value);
        return new SemanticVersion(
                toNumber("major", fields.major(), value),
                toNumber("minor", fields.minor(), value),
                toNumber("patch", fields.patch(), value),
                fields.preRelease().orElse(null),
                fields.buildMetadata().orElse(null),
                value);
    }

    public static Optional<SemanticVersion> tryParse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(value));
        } catch (VersionFormatException e) {
            return Optional.empty();
        }
    }

    public static SemanticVersion of(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be non-negative: " + major + "." + minor + "." + patch);
        }
        return new SemanticVersion(
                BigInteger.valueOf(major),
                BigInteger.valueOf(minor),
                BigInteger.valueOf(patch),
                null,
                null,
                major + "." + minor + "." + patch);
    }

    // the grammar only lets digits through, so this failure is not expected
    static BigInteger toNumber(String field, String digits, String input) {
        try {
            return new BigInteger(digits);
        } catch (NumberFormatException e) {
            throw new InvalidNumericFieldException(field, input, e);
        }
    }

    public BigInteger major() {
        return major;
    }

    public BigInteger minor() {
        return minor;
    }

    public BigInteger patch() {
        return patch;
    }

    public Optional<String> preRelease() {
        return Optional.ofNullable(preRelease);
    }

    public Optional<String> buildMetadata() {
        return Optional.ofNullable(buildMetadata);
    }

    public boolean isPreRelease() {
        return preRelease != null;
    }

    // split on each call
    public List<String> preReleaseIdentifiers() {
        return preRelease == null ? List.of() : Arrays.asList(preRelease.split("\\."));
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return PRECEDENCE.compare(this, other);
    }

    public boolean isLowerThan(SemanticVersion other) {
        return compareTo(other) < 0;
    }

    public boolean isHigherThan(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    public boolean isAtMost(SemanticVersion other) {
        return compareTo(other) <= 0;
    }

    public boolean isAtLeast(SemanticVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SemanticVersion)) {
            return false;
        }
        SemanticVersion that = (SemanticVersion) o;
        return major.equals(that.major)
                && minor.equals(that.minor)
                && patch.equals(that.patch)
                && Objects.equals(preRelease, that.preRelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease);
    }

    @Override
    public String toString() {
        return raw;
    }
}
