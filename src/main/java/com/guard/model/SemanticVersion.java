package com.guard.model;

import com.guard.exception.InvalidVersionException;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A SemVer 2.0.0 version number. Ordering follows SemVer precedence: numeric components
 * first, a pre-release sorts before the matching release, build metadata is ignored.
 *
 * @param major      Major component.
 * @param minor      Minor component.
 * @param patch      Patch component.
 * @param preRelease Dot-separated pre-release identifiers, empty when absent.
 * @param build      Build metadata, empty when absent.
 */
public record SemanticVersion(long major, long minor, long patch, String preRelease, String build)
        implements Comparable<SemanticVersion> {

    // Leading zeros are rejected in numeric components, as SemVer requires.
    private static final Pattern SEMVER = Pattern.compile(
            "^v?(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
                    + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?$");

    /**
     * Parses a declared version string. Surrounding whitespace and one leading {@code v} are tolerated.
     *
     * @throws InvalidVersionException if the string is not a semantic version.
     */
    public static SemanticVersion parse(String text) {
        if (text == null) {
            throw new InvalidVersionException("Version is missing");
        }
        Matcher matcher = SEMVER.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidVersionException("'" + text + "' is not a semantic version (expected MAJOR.MINOR.PATCH)");
        }
        try {
            return new SemanticVersion(
                    Long.parseLong(matcher.group(1)),
                    Long.parseLong(matcher.group(2)),
                    Long.parseLong(matcher.group(3)),
                    matcher.group(4) == null ? "" : matcher.group(4),
                    matcher.group(5) == null ? "" : matcher.group(5));
        } catch (NumberFormatException e) {
            throw new InvalidVersionException("'" + text + "' has a version component that is out of range");
        }
    }

    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    /**
     * The most significant component that increased going from {@code this} to {@code newer}.
     * Returns {@link BumpLevel#NONE} when no component increased, which includes a newer version
     * that only differs in its pre-release or build suffix.
     */
    public BumpLevel bumpTo(SemanticVersion newer) {
        if (newer.major > major) {
            return BumpLevel.MAJOR;
        }
        if (newer.major == major && newer.minor > minor) {
            return BumpLevel.MINOR;
        }
        if (newer.major == major && newer.minor == minor && newer.patch > patch) {
            return BumpLevel.PATCH;
        }
        return BumpLevel.NONE;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Long.compare(major, other.major);
        if (result == 0) {
            result = Long.compare(minor, other.minor);
        }
        if (result == 0) {
            result = Long.compare(patch, other.patch);
        }
        if (result == 0) {
            result = comparePreRelease(preRelease, other.preRelease);
        }
        return result;
    }

    private static int comparePreRelease(String left, String right) {
        if (left.equals(right)) {
            return 0;
        }
        if (left.isEmpty()) {
            return 1;
        }
        if (right.isEmpty()) {
            return -1;
        }
        List<String> leftIds = List.of(left.split("\\."));
        List<String> rightIds = List.of(right.split("\\."));
        int shared = Math.min(leftIds.size(), rightIds.size());
        for (int i = 0; i < shared; i++) {
            int result = compareIdentifier(leftIds.get(i), rightIds.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(leftIds.size(), rightIds.size());
    }

    private static int compareIdentifier(String left, String right) {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            // Compare by length first so that arbitrarily long numeric identifiers never overflow.
            int byLength = Integer.compare(left.length(), right.length());
            return byLength != 0 ? byLength : left.compareTo(right);
        }
        if (leftNumeric) {
            return -1;
        }
        if (rightNumeric) {
            return 1;
        }
        return left.compareTo(right);
    }

    private static boolean isNumeric(String identifier) {
        return identifier.chars().allMatch(Character::isDigit);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
        if (!preRelease.isEmpty()) {
            text.append('-').append(preRelease);
        }
        if (!build.isEmpty()) {
            text.append('+').append(build);
        }
        return text.toString();
    }
}
