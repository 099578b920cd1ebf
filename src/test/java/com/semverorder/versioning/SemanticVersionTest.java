package com.semverorder.versioning;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.Test;

class SemanticVersionTest {

    private static final List<String> CORPUS = List.of(
            "0.0.0",
            "0.0.1-0",
            "1.0.0",
            "1.0.0+build.1",
            "1.0.0+build.2",
            "1.0.0-0",
            "1.0.0-1",
            "1.0.0-2",
            "1.0.0-10",
            "1.0.0--",
            "1.0.0-A",
            "1.0.0-a",
            "1.0.0-0a",
            "1.0.0-alpha",
            "1.0.0alpha",
            "1.0.0-alpha.1",
            "1.0.0-alpha.1.1",
            "1.0.0-alpha.beta",
            "1.0.0-alpha-beta",
            "1.0.0-beta.2",
            "1.0.0-beta.11",
            "1.0.0-rc.1+sha.1",
            "1.0.1b",
            "1.0.10-alpha.beta",
            "1.42.0",
            "2.0.0");

    @Test
    void shouldExposeParsedComponents() {
        SemanticVersion version = SemanticVersion.parse("3.14.159-rc.2+exp.sha.5114f85");

        assertEquals(BigInteger.valueOf(3), version.major());
        assertEquals(BigInteger.valueOf(14), version.minor());
        assertEquals(BigInteger.valueOf(159), version.patch());
        assertEquals(Optional.of("rc.2"), version.preRelease());
        assertEquals(Optional.of("exp.sha.5114f85"), version.buildMetadata());
        assertEquals(List.of("rc", "2"), version.preReleaseIdentifiers());
        assertTrue(version.isPreRelease());
        assertEquals("3.14.159-rc.2+exp.sha.5114f85", version.toString());
    }

    @Test
    void shouldTreatVersionWithoutPreReleaseAsRelease() {
        SemanticVersion version = SemanticVersion.parse("1.2.3");

        assertFalse(version.isPreRelease());
        assertEquals(List.of(), version.preReleaseIdentifiers());
        assertEquals(SemanticVersion.of(1, 2, 3), version);
    }

    @Test
    void shouldIgnoreBuildMetadataForEqualityAndOrdering() {
        SemanticVersion plain = SemanticVersion.parse("1.0.0");
        SemanticVersion build1 = SemanticVersion.parse("1.0.0+build.1");
        SemanticVersion build2 = SemanticVersion.parse("1.0.0+build.2");

        assertEquals(plain, build1);
        assertEquals(build1, build2);
        assertEquals(build1.hashCode(), build2.hashCode());
        assertEquals(0, build1.compareTo(build2));
        assertTrue(build1.isAtMost(build2));
        assertTrue(build1.isAtLeast(build2));
    }

    @Test
    void shouldOrderPreReleaseBeforeRelease() {
        assertTrue(SemanticVersion.parse("1.0.0-alpha").isLowerThan(SemanticVersion.parse("1.0.0")));
        assertTrue(SemanticVersion.parse("1.0.0").isHigherThan(SemanticVersion.parse("1.0.0-rc.1")));
    }

    @Test
    void shouldOrderNumericIdentifierBelowAlphanumeric() {
        assertTrue(SemanticVersion.parse("1.0.0-alpha.1").isLowerThan(SemanticVersion.parse("1.0.0-alpha.beta")));
        assertTrue(SemanticVersion.parse("1.0.0-999").isLowerThan(SemanticVersion.parse("1.0.0-0a")));
    }

    @Test
    void shouldCompareNumericIdentifiersByMagnitude() {
        assertTrue(SemanticVersion.parse("1.0.0-beta.2").isLowerThan(SemanticVersion.parse("1.0.0-beta.11")));
        assertTrue(SemanticVersion.parse("1.0.0-99999999999999999999")
                .isLowerThan(SemanticVersion.parse("1.0.0-100000000000000000000")));
    }

    @Test
    void shouldOrderShorterPreReleasePrefixFirst() {
        assertTrue(SemanticVersion.parse("1.0.0-alpha").isLowerThan(SemanticVersion.parse("1.0.0-alpha.1")));
        assertTrue(SemanticVersion.parse("1.0.0-alpha.1").isLowerThan(SemanticVersion.parse("1.0.0-alpha.1.0")));
    }

    @Test
    void shouldCompareAlphanumericIdentifiersOrdinally() {
        assertTrue(SemanticVersion.parse("1.0.0-Beta").isLowerThan(SemanticVersion.parse("1.0.0-alpha")));
        assertTrue(SemanticVersion.parse("1.0.0--").isLowerThan(SemanticVersion.parse("1.0.0-A")));
    }

    @Test
    void shouldParseUnseparatedPreReleaseAndCompareOnCore() {
        SemanticVersion relaxed = SemanticVersion.parse("1.0.1b");

        assertEquals(Optional.of("b"), relaxed.preRelease());
        assertTrue(relaxed.isLowerThan(SemanticVersion.parse("1.0.10-alpha.beta")));
        assertTrue(relaxed.isLowerThan(SemanticVersion.parse("1.0.1")));
        assertEquals(SemanticVersion.parse("1.0.1-b"), relaxed);
    }

    @Test
    void shouldHoldOriginalDemonstrationPairs() {
        List<List<String>> pairs = List.of(
                List.of("1.0.0", "2.0.0"),
                List.of("1.0.0", "1.42.0"),
                List.of("1.2.0", "1.2.42"),
                List.of("1.1.0-alpha", "1.2.0-alpha.1"),
                List.of("1.0.1b", "1.0.10-alpha.beta"),
                List.of("1.0.0-rc.1", "1.0.0"));

        for (List<String> pair : pairs) {
            SemanticVersion lower = SemanticVersion.parse(pair.get(0));
            SemanticVersion higher = SemanticVersion.parse(pair.get(1));
            assertTrue(lower.isLowerThan(higher), pair.toString());
            assertTrue(higher.isHigherThan(lower), pair.toString());
            assertNotEquals(higher, lower, pair.toString());
        }
    }

    @Test
    void shouldSortPrecedenceChainIntoSpecifiedSequence() {
        List<String> chain = List.of(
                "1.0.0-alpha",
                "1.0.0-alpha.1",
                "1.0.0-alpha.beta",
                "1.0.0-beta",
                "1.0.0-beta.2",
                "1.0.0-beta.11",
                "1.0.0-rc.1",
                "1.0.0");
        List<SemanticVersion> versions = new ArrayList<>();
        chain.forEach(value -> versions.add(SemanticVersion.parse(value)));

        for (long seed = 0; seed < 10; seed++) {
            List<SemanticVersion> shuffled = new ArrayList<>(versions);
            Collections.shuffle(shuffled, new Random(seed));
            Collections.sort(shuffled);

            assertEquals(chain, shuffled.stream().map(SemanticVersion::toString).toList());
        }
    }

    @Test
    void shouldKeepRelationsTotalAndConsistentAcrossCorpus() {
        List<SemanticVersion> versions = CORPUS.stream().map(SemanticVersion::parse).toList();

        for (SemanticVersion a : versions) {
            for (SemanticVersion b : versions) {
                String label = a + " vs " + b;
                boolean lower = a.isLowerThan(b);
                boolean equal = a.equals(b);
                boolean higher = a.isHigherThan(b);

                assertEquals(1, (lower ? 1 : 0) + (equal ? 1 : 0) + (higher ? 1 : 0), label);
                assertEquals(lower || equal, a.isAtMost(b), label);
                assertEquals(higher || equal, a.isAtLeast(b), label);
                assertEquals(equal, a.compareTo(b) == 0, label);
                assertEquals(Integer.signum(a.compareTo(b)), -Integer.signum(b.compareTo(a)), label);
                if (equal) {
                    assertEquals(a.hashCode(), b.hashCode(), label);
                }
            }
        }
    }

    @Test
    void shouldRejectMalformedVersionsAtConstruction() {
        for (String value : List.of("1.0", "1.0.0-", "01.0.0", "1.0.0-+build")) {
            MalformedVersionException ex = assertThrows(MalformedVersionException.class, () -> SemanticVersion.parse(value));
            assertEquals(value, ex.input());
            assertTrue(ex.getMessage().contains(value));
        }
    }

    @Test
    void shouldAcceptCoreComponentsBeyondIntRange() {
        assertTrue(VersionGrammar.matches("2147483648.0.0"));
        SemanticVersion large = assertDoesNotThrow(() -> SemanticVersion.parse("2147483648.0.0"));

        assertEquals(new BigInteger("2147483648"), large.major());
        assertEquals(new BigInteger("99999999999999999999"),
                SemanticVersion.parse("1.99999999999999999999.0").minor());
        assertTrue(SemanticVersion.parse("2147483647.0.0").isLowerThan(large));
        assertTrue(SemanticVersion.parse("1.0.99999999999999999999")
                .isLowerThan(SemanticVersion.parse("1.0.100000000000000000000-rc.1")));
        assertEquals(SemanticVersion.parse("4294967296.0.0+a"), SemanticVersion.parse("4294967296.0.0+b"));
    }

    @Test
    void shouldReportNonDigitCoreComponentAsInvalidNumericField() {
        InvalidNumericFieldException ex = assertThrows(
                InvalidNumericFieldException.class,
                () -> SemanticVersion.toNumber("minor", "1x", "1.1x.0"));

        assertEquals("minor", ex.field());
        assertEquals("1.1x.0", ex.input());
        assertTrue(ex.getCause() instanceof NumberFormatException);
    }

    @Test
    void shouldReturnEmptyFromTryParseOnFailure() {
        assertTrue(SemanticVersion.tryParse("1.0").isEmpty());
        assertTrue(SemanticVersion.tryParse("1.0.0-01").isEmpty());
        assertTrue(SemanticVersion.tryParse(null).isEmpty());
        assertEquals(Optional.of(SemanticVersion.of(1, 0, 0)), SemanticVersion.tryParse("1.0.0+meta"));
    }

    @Test
    void shouldRejectNegativeComponentsInFactory() {
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.of(1, -1, 0));
    }
}
