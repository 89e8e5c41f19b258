package com.workflowops.planner;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code major.minor} versions of recorded state snapshots.
 *
 * <p>
 * Versions advance by one minor step; a minor of 9 rolls over to the next
 * major, so {@code 1.9} is followed by {@code 2.0}.
 * </p>
 */
public final class StateVersion {

    /** Version of the first snapshot. */
    public static final String INITIAL = "1.0";

    /** Orders versions numerically, major first. */
    public static final Comparator<String> ORDER = Comparator
            .comparingInt((String v) -> parse(v)[0])
            .thenComparingInt(v -> parse(v)[1]);

    private static final Pattern VERSION = Pattern.compile("(\\d+)\\.(\\d+)");

    private StateVersion() {
    }

    /**
     * @param current the latest recorded version; {@code null} or blank when
     *                nothing has been recorded yet
     * @return the version to record next
     * @throws IllegalArgumentException if {@code current} is not
     *                                  {@code major.minor}
     */
    public static String next(String current) {
        if (current == null || current.isBlank()) {
            return INITIAL;
        }
        int[] parts = parse(current);
        int major = parts[0];
        int minor = parts[1];
        if (minor == 9) {
            return (major + 1) + ".0";
        }
        return major + "." + (minor + 1);
    }

    public static boolean isValid(String version) {
        return version != null && VERSION.matcher(version.trim()).matches();
    }

    private static int[] parse(String version) {
        Matcher m = version == null ? null : VERSION.matcher(version.trim());
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Version must be 'major.minor', got: " + version);
        }
        try {
            return new int[] {Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version component out of range: " + version, e);
        }
    }
}
