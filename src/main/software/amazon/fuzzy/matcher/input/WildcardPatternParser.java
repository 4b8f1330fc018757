package software.amazon.fuzzy.matcher.input;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Breaks a pattern into the sub-words found between its wildcard characters. There is no escaping: every
 * occurrence of the wildcard character is a wildcard.
 */
public class WildcardPatternParser {

    private final char wildcard;

    public WildcardPatternParser(final char wildcard) {
        this.wildcard = wildcard;
    }

    public char getWildcard() {
        return wildcard;
    }

    /**
     * Parses a pattern. A pattern with n wildcards yields n + 1 sub-words, some of them empty when wildcards are
     * adjacent or sit at either end of the pattern. Each sub-word carries the offset just past its last character,
     * so the last sub-word's end id is always the pattern length.
     *
     * @param pattern the pattern
     * @return the sub-words, in pattern order
     */
    public List<SubWord> parse(@Nonnull final String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        final List<String> words = PatternSplitter.split(pattern, character -> character == wildcard);
        final List<SubWord> result = new ArrayList<>(words.size());

        int endId = 0;
        for (String word : words) {
            endId += word.length();
            result.add(new SubWord(word, endId));
            // step over the wildcard that follows
            endId++;
        }
        return result;
    }
}
