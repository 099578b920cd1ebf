package com.semverorder.versioning;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;

public class PrecedenceComparator implements Comparator<SemanticVersion> {

    @Override
    public int compare(SemanticVersion left, SemanticVersion right) {
        int result = left.major().compareTo(right.major());
        if (result != 0) {
            return result;
        }
        result = left.minor().compareTo(right.minor());
        if (result != 0) {
            return result;
        }
        result = left.patch().compareTo(right.patch());
        if (result != 0) {
            return result;
        }
        return comparePreRelease(left, right);
    }

    private static int comparePreRelease(SemanticVersion left, SemanticVersion right) {
        if (left.isPreRelease() != right.isPreRelease()) {
            // a pre-release sorts before the release it precedes
            return left.isPreRelease() ? -1 : 1;
        }
        if (!left.isPreRelease()) {
            return 0;
        }
        List<String> leftIds = left.preReleaseIdentifiers();
        List<String> rightIds = right.preReleaseIdentifiers();
        int shared = Math.min(leftIds.size(), rightIds.size());
        for (int i = 0; i < shared; i++) {
            int result = compareIdentifier(leftIds.get(i), rightIds.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(leftIds.size(), rightIds.size());
    }

    static int compareIdentifier(String left, String right) {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            return new BigInteger(left).compareTo(new BigInteger(right));
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }

    static boolean isNumeric(String identifier) {
        if (identifier.isEmpty()) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
