package software.amazon.fuzzy.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.fuzzy.matcher.input.SubWord;
import software.amazon.fuzzy.matcher.input.WildcardPatternParser;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Objects;

/**
 * Matches a pattern in which a wildcard character stands for any single character against a stream of characters,
 * one character at a time.
 * <p>
 * The pattern is split into the words between its wildcards and an Aho-Corasick automaton is built over them. As
 * characters are scanned, the automaton reports which words end at the current position. A window of counters, one
 * per alignment of the pattern's right edge ahead of the current position, counts the words seen for each
 * alignment: when the counter for the alignment ending here reaches the number of words, every word was found at
 * its place and the whole pattern matches. Counter k holds the words matched for a pattern whose right edge lies
 * k characters ahead of the last scanned character.
 * <p>
 * Memory is O(pattern length) for the automaton and the window, regardless of how much text is scanned.
 */
@NotThreadSafe
public class WildcardMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(WildcardMatcher.class);

    private final Automaton automaton;
    private final CounterWindow wordOccurrences;
    private final int numberOfWords;
    private final int patternLength;
    private final char wildcard;

    private NodeReference state = NodeReference.EMPTY;
    private boolean matchesEmptyPrefix;

    private WildcardMatcher(final Automaton automaton, final int numberOfWords, final int patternLength,
                            final char wildcard) {
        this.automaton = automaton;
        this.numberOfWords = numberOfWords;
        this.patternLength = patternLength;
        this.wildcard = wildcard;
        this.wordOccurrences = new CounterWindow(patternLength + 1);
    }

    /**
     * Builds a matcher for a pattern. Any pattern is valid, including the empty one.
     *
     * @param pattern the pattern
     * @param wildcard the character that matches any single character
     * @return a matcher ready to scan
     */
    public static WildcardMatcher buildFor(@Nonnull final String pattern, final char wildcard) {
        Objects.requireNonNull(pattern, "pattern");
        final List<SubWord> words = new WildcardPatternParser(wildcard).parse(pattern);

        final AutomatonBuilder builder = new AutomatonBuilder();
        for (SubWord word : words) {
            builder.add(word.getWord(), word.getEndId());
        }

        final WildcardMatcher matcher = new WildcardMatcher(builder.build(), words.size(), pattern.length(),
                wildcard);
        matcher.reset();

        LOG.debug("Built matcher for pattern of length {} with {} words", pattern.length(), words.size());
        return matcher;
    }

    /**
     * Abandons everything scanned so far. A new stream can be scanned afterwards; the automaton is kept.
     */
    public void reset() {
        state = automaton.root();
        wordOccurrences.clear();
        // empty words match before the first character
        updateWordOccurrences();
        matchesEmptyPrefix = wordOccurrences.get(0) == numberOfWords;
        wordOccurrences.shift();
    }

    /**
     * Consumes the next character of the stream.
     *
     * @param character the character
     * @param onMatch run if an occurrence of the pattern ends with this character
     */
    public void scan(final char character, @Nonnull final Runnable onMatch) {
        Objects.requireNonNull(onMatch, "onMatch");
        if (scan(character)) {
            onMatch.run();
        }
    }

    /**
     * Consumes the next character of the stream.
     *
     * @param character the character
     * @return true if an occurrence of the pattern ends with this character
     */
    public boolean scan(final char character) {
        state = state.next(character);
        updateWordOccurrences();
        final boolean matched = wordOccurrences.get(0) == numberOfWords;
        wordOccurrences.shift();
        return matched;
    }

    /**
     * @return true if the pattern matches the empty input, which only the empty pattern does; such an occurrence
     * ends before any character is scanned and is never reported by {@link #scan(char)}
     */
    public boolean matchesEmptyPrefix() {
        return matchesEmptyPrefix;
    }

    public int patternLength() {
        return patternLength;
    }

    public int numberOfWords() {
        return numberOfWords;
    }

    public char wildcard() {
        return wildcard;
    }

    NodeReference state() {
        return state;
    }

    Automaton automaton() {
        return automaton;
    }

    private void updateWordOccurrences() {
        state.generateMatches(id -> wordOccurrences.increment(patternLength - id));
    }
}
