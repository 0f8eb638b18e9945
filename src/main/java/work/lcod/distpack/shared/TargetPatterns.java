package work.lcod.distpack.shared;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex full-match helpers for target triples. Triples are never parsed structurally here.
 */
public final class TargetPatterns {
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private TargetPatterns() {}

    /**
     * True iff at least one pattern fully matches {@code triple}. An empty list never matches,
     * which is what restricting lists (disabled-targets, required-targets) need.
     */
    public static boolean matchesAny(String triple, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (compile(pattern).matcher(triple).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Like {@link #matchesAny} but an absent or empty target restriction applies everywhere.
     */
    public static boolean appliesTo(String triple, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return true;
        }
        return matchesAny(triple, patterns);
    }

    public static void checkSyntax(String pattern) {
        compile(pattern);
    }

    private static Pattern compile(String pattern) {
        try {
            return CACHE.computeIfAbsent(pattern, Pattern::compile);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("Invalid target pattern: " + pattern, ex);
        }
    }
}
