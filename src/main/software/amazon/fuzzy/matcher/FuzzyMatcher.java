package software.amazon.fuzzy.matcher;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * Finds the occurrences of wildcard patterns in texts. Each call builds its own {@link WildcardMatcher} and scans
 * the text once, left to right, so offsets come out in increasing order.
 * <p>
 * An empty pattern matches at every offset from 0 to the text length, both included.
 */
@ThreadSafe
public class FuzzyMatcher {

    private final Configuration configuration;

    public FuzzyMatcher() {
        this(new Configuration.Builder().build());
    }

    public FuzzyMatcher(@Nonnull final Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * @param pattern the pattern, using the configured wildcard
     * @param text the text to search
     * @return the offset of the first character of every occurrence, in increasing order
     */
    public IntList matches(@Nonnull final String pattern, @Nonnull final String text) {
        return findFuzzyMatches(pattern, text, configuration.getWildcard());
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    /**
     * Returns the offset of the first character of every occurrence of the pattern in the text, with {@code '?'}
     * as the wildcard.
     */
    public static IntList findFuzzyMatches(@Nonnull final String pattern, @Nonnull final String text) {
        return findFuzzyMatches(pattern, text, Constants.DEFAULT_WILDCARD);
    }

    /**
     * Returns the offset of the first character of every occurrence of the pattern in the text.
     *
     * @param pattern the pattern
     * @param text the text to search
     * @param wildcard the character of the pattern that matches any single character
     * @return the offsets, in increasing order; empty if the pattern is longer than the text
     */
    public static IntList findFuzzyMatches(@Nonnull final String pattern, @Nonnull final String text,
                                           final char wildcard) {
        Objects.requireNonNull(text, "text");
        return scan(WildcardMatcher.buildFor(pattern, wildcard), text);
    }

    static IntList scan(final WildcardMatcher matcher, final String text) {
        final IntList occurrences = new IntArrayList();
        final int patternLength = matcher.patternLength();

        if (matcher.matchesEmptyPrefix()) {
            occurrences.add(0);
        }
        for (int i = 0; i < text.length(); i++) {
            if (matcher.scan(text.charAt(i))) {
                occurrences.add(i + 1 - patternLength);
            }
        }
        return occurrences;
    }
}
