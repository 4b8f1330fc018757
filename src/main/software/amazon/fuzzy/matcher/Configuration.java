package software.amazon.fuzzy.matcher;

import javax.annotation.concurrent.Immutable;

/**
 * Configuration for a FuzzyMatcher.
 */
@Immutable
public class Configuration {

    /**
     * The character that stands for any single character in patterns. Every occurrence of it in a pattern is a
     * wildcard; in the text it is an ordinary character. Defaults to '?'. Surrogate code units are refused since
     * matching works on UTF-16 code units and half a surrogate pair can't be a meaningful wildcard.
     */
    private final char wildcard;

    private Configuration(char wildcard) {
        this.wildcard = wildcard;
    }

    public char getWildcard() {
        return wildcard;
    }

    public static class Builder {

        private char wildcard = Constants.DEFAULT_WILDCARD;

        public Builder withWildcard(char wildcard) {
            if (Character.isSurrogate(wildcard)) {
                throw new IllegalArgumentException(
                        String.format("Wildcard must not be a surrogate code unit, got \\u%04x", (int) wildcard));
            }
            this.wildcard = wildcard;
            return this;
        }

        public Configuration build() {
            return new Configuration(wildcard);
        }
    }
}
