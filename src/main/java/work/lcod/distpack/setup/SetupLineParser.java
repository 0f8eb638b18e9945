package work.lcod.distpack.setup;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tokenizer/parser pair for the legacy Setup grammar. Tokens are whitespace separated,
 * {@code #} starts a comment, and {@code -framework}/{@code -Xlinker} consume the following word.
 */
public final class SetupLineParser {
    static final Set<String> SOURCE_SUFFIXES = Set.of(".c", ".cc", ".cpp", ".m");
    private static final String HIDDEN_LINK_PREFIX = "-hidden-l";

    private SetupLineParser() {}

    /**
     * Splits a line into words, dropping any trailing comment.
     */
    public static List<String> tokenize(String line) {
        if (line == null) {
            return List.of();
        }
        String content = line;
        int comment = content.indexOf('#');
        if (comment >= 0) {
            content = content.substring(0, comment);
        }
        content = content.strip();
        if (content.isEmpty()) {
            return List.of();
        }
        return List.of(content.split("\\s+"));
    }

    public static Optional<SetupLine> parse(String line) {
        return parseWords(tokenize(line));
    }

    public static Optional<SetupLine> parseWords(List<String> words) {
        if (words.isEmpty()) {
            return Optional.empty();
        }
        var sources = new ArrayList<String>();
        var defines = new ArrayList<String>();
        var includes = new ArrayList<String>();
        var links = new ArrayList<LinkToken>();
        var frameworks = new ArrayList<String>();
        var other = new ArrayList<String>();

        for (int i = 1; i < words.size(); i++) {
            String word = words.get(i);
            if ("-framework".equals(word) && i + 1 < words.size()) {
                frameworks.add(words.get(++i));
            } else if ("-Xlinker".equals(word) && i + 1 < words.size()) {
                String next = words.get(++i);
                if (next.startsWith(HIDDEN_LINK_PREFIX) && next.length() > HIDDEN_LINK_PREFIX.length()) {
                    String name = next.substring(HIDDEN_LINK_PREFIX.length());
                    links.add(new LinkToken(name, LinkToken.Kind.HIDDEN_LIBRARY, word + " " + next));
                } else if (next.endsWith(".a")) {
                    links.add(new LinkToken(LinkToken.archiveBareName(next), LinkToken.Kind.ARCHIVE_PATH, word + " " + next));
                } else {
                    other.add(word);
                    other.add(next);
                }
            } else if (word.startsWith("-l") && word.length() > 2) {
                links.add(new LinkToken(word.substring(2), LinkToken.Kind.LIBRARY, word));
            } else if (word.startsWith("-I") && word.length() > 2) {
                includes.add(word.substring(2));
            } else if (word.startsWith("-D") && word.length() > 2) {
                defines.add(word.substring(2));
            } else if (!word.startsWith("-") && word.endsWith(".a")) {
                links.add(new LinkToken(LinkToken.archiveBareName(word), LinkToken.Kind.ARCHIVE_PATH, word));
            } else if (!word.startsWith("-") && isSource(word)) {
                sources.add(word);
            } else {
                other.add(word);
            }
        }
        return Optional.of(new SetupLine(words.get(0), sources, defines, includes, links, frameworks, other));
    }

    static boolean isSource(String word) {
        int dot = word.lastIndexOf('.');
        return dot > 0 && SOURCE_SUFFIXES.contains(word.substring(dot));
    }
}
