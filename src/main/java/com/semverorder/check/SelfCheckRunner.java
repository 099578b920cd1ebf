package com.semverorder.check;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semverorder.runtime.AppConfig;
import com.semverorder.versioning.SemanticVersion;
import com.semverorder.versioning.VersionFormatException;

public class SelfCheckRunner {
    private static final Logger log = LoggerFactory.getLogger(SelfCheckRunner.class);
    private final Random random;

    public SelfCheckRunner() {
        this(new Random(42L));
    }

    public SelfCheckRunner(Random random) {
        this.random = random;
    }

    public SelfCheckReport run(AppConfig.SelfCheckConfig config) {
        List<SelfCheckResult> results = new ArrayList<>();
        List<List<String>> pairs = config.getPairs();
        for (int i = 0; i < pairs.size(); i++) {
            results.add(checkPair("pair-" + (i + 1), pairs.get(i)));
        }
        List<List<String>> chains = config.getChains();
        for (int i = 0; i < chains.size(); i++) {
            results.add(checkChain("chain-" + (i + 1), chains.get(i)));
        }
        SelfCheckReport report = new SelfCheckReport(results);
        log.debug("Self-check finished: checks={} failed={}", results.size(), report.failedCount());
        return report;
    }

    SelfCheckResult checkPair(String checkId, List<String> pair) {
        List<String> failures = new ArrayList<>();
        if (pair == null || pair.size() != 2) {
            failures.add("expected exactly two versions [lower, higher] but got " + pair);
            return new SelfCheckResult(checkId, pair == null ? List.of() : pair, failures);
        }
        List<SemanticVersion> parsed = parseAll(pair, failures);
        if (!failures.isEmpty()) {
            return new SelfCheckResult(checkId, pair, failures);
        }
        SemanticVersion lower = parsed.get(0);
        SemanticVersion higher = parsed.get(1);
        if (!lower.isLowerThan(higher)) {
            failures.add(lower + " < " + higher + " does not hold");
        }
        if (!higher.isHigherThan(lower)) {
            failures.add(higher + " > " + lower + " does not hold");
        }
        if (higher.equals(lower)) {
            failures.add(higher + " != " + lower + " does not hold");
        }
        return new SelfCheckResult(checkId, pair, failures);
    }

    SelfCheckResult checkChain(String checkId, List<String> chain) {
        List<String> failures = new ArrayList<>();
        if (chain == null || chain.isEmpty()) {
            failures.add("chain must contain at least one version");
            return new SelfCheckResult(checkId, List.of(), failures);
        }
        List<SemanticVersion> expected = parseAll(chain, failures);
        if (!failures.isEmpty()) {
            return new SelfCheckResult(checkId, chain, failures);
        }
        for (int i = 1; i < expected.size(); i++) {
            if (!expected.get(i - 1).isLowerThan(expected.get(i))) {
                failures.add(expected.get(i - 1) + " < " + expected.get(i) + " does not hold");
            }
        }
        List<SemanticVersion> shuffled = new ArrayList<>(expected);
        Collections.shuffle(shuffled, random);
        shuffled.sort(SemanticVersion.PRECEDENCE);
        if (!shuffled.equals(expected)) {
            failures.add("sorting produced " + shuffled + " instead of " + expected);
        }
        return new SelfCheckResult(checkId, chain, failures);
    }

    private static List<SemanticVersion> parseAll(List<String> values, List<String> failures) {
        List<SemanticVersion> parsed = new ArrayList<>();
        for (String value : values) {
            if (value == null) {
                failures.add("Missing version value");
                continue;
            }
            try {
                parsed.add(SemanticVersion.parse(value));
            } catch (VersionFormatException e) {
                failures.add(e.getMessage());
            }
        }
        return parsed;
    }
}
