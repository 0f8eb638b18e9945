package work.lcod.distpack.shared;

/**
 * Major.minor version comparisons (e.g. {@code 3.13.1} meets minimum {@code 3.13}).
 * Patch and build metadata are ignored.
 */
public final class VersionPredicates {
    private VersionPredicates() {}

    public static boolean meetsMinimum(String actual, String wanted) {
        return compare(parse(actual), parse(wanted)) >= 0;
    }

    public static boolean meetsMaximum(String actual, String wanted) {
        return compare(parse(actual), parse(wanted)) <= 0;
    }

    /**
     * Returns {@code major.minor} of a version string.
     */
    public static String majorMinor(String version) {
        int[] parsed = parse(version);
        return parsed[0] + "." + parsed[1];
    }

    static int[] parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Version must not be empty");
        }
        String[] parts = raw.trim().split("\\.");
        if (parts.length < 2) {
            throw new IllegalArgumentException("Version must be of the form major.minor: " + raw);
        }
        try {
            return new int[] { Integer.parseInt(parts[0]), Integer.parseInt(leadingDigits(parts[1])) };
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported version: " + raw, ex);
        }
    }

    // "13rc1" -> "13"
    private static String leadingDigits(String part) {
        int end = 0;
        while (end < part.length() && Character.isDigit(part.charAt(end))) {
            end++;
        }
        return part.substring(0, end);
    }

    private static int compare(int[] left, int[] right) {
        int major = Integer.compare(left[0], right[0]);
        return major != 0 ? major : Integer.compare(left[1], right[1]);
    }
}
