package strata.core.cache;

import java.util.regex.Pattern;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Matches cache keys against invalidation patterns.
 *
 * <p>The only wildcard is {@code *}, which matches any run of characters
 * (including {@code :} and the empty string). Every other character is literal,
 * so keys containing regex or glob metacharacters are matched exactly.
 *
 * <p>Compiled patterns are cached since the same invalidation patterns are
 * issued repeatedly by write paths.
 */
public class KeyPatternMatcher {

    private static final char WILDCARD = '*';
    private static final long DEFAULT_MAX_COMPILED = 256;

    private final Cache<String, Pattern> compiled;

    public KeyPatternMatcher() {
        this(DEFAULT_MAX_COMPILED);
    }

    /**
     * @param maxCompiled maximum number of compiled patterns kept in memory
     */
    public KeyPatternMatcher(long maxCompiled) {
        this.compiled = Caffeine.newBuilder().maximumSize(maxCompiled).build();
    }

    /**
     * Tests if a key matches a pattern.
     *
     * @param pattern the invalidation pattern (e.g., "user:*:profile")
     * @param key the cache key to test
     * @return true if the whole key matches the pattern
     */
    public boolean matches(String pattern, String key) {
        return compile(pattern).matcher(key).matches();
    }

    /**
     * Returns the anchored regular expression for a pattern.
     *
     * @param pattern the invalidation pattern
     * @return compiled pattern matching whole keys only
     */
    public Pattern compile(String pattern) {
        return compiled.get(pattern, KeyPatternMatcher::toRegex);
    }

    /**
     * Translates a pattern into a Redis glob for {@code KEYS}/{@code SCAN MATCH}.
     *
     * <p>Redis globs also treat {@code ?}, {@code [}, {@code ]} and {@code \} as
     * special; those are escaped so they match literally.
     *
     * @param pattern the invalidation pattern
     * @return an equivalent Redis glob
     */
    public String toRedisGlob(String pattern) {
        final var glob = new StringBuilder(pattern.length() + 8);
        for (int i = 0; i < pattern.length(); i++) {
            final var c = pattern.charAt(i);
            if (c == '?' || c == '[' || c == ']' || c == '\\') {
                glob.append('\\');
            }
            glob.append(c);
        }
        return glob.toString();
    }

    static Pattern toRegex(String pattern) {
        final var regex = new StringBuilder("^");
        int literalStart = 0;
        for (int i = 0; i < pattern.length(); i++) {
            if (pattern.charAt(i) == WILDCARD) {
                appendLiteral(regex, pattern.substring(literalStart, i));
                regex.append(".*");
                literalStart = i + 1;
            }
        }
        appendLiteral(regex, pattern.substring(literalStart));
        regex.append('$');
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void appendLiteral(StringBuilder regex, String literal) {
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal));
        }
    }
}
