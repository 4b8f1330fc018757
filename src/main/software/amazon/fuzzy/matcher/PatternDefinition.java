package software.amazon.fuzzy.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * A wildcard pattern together with its wildcard character, as read by {@link JsonPatternCompiler}.
 */
@Immutable
public final class PatternDefinition {

    private final String pattern;
    private final char wildcard;

    public PatternDefinition(final String pattern, final char wildcard) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.wildcard = wildcard;
    }

    public String getPattern() {
        return pattern;
    }

    public char getWildcard() {
        return wildcard;
    }

    public WildcardMatcher toMatcher() {
        return WildcardMatcher.buildFor(pattern, wildcard);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PatternDefinition other = (PatternDefinition) o;
        return wildcard == other.wildcard && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, wildcard);
    }

    @Override
    public String toString() {
        return "PatternDefinition{pattern=" + pattern + ", wildcard=" + wildcard + "}";
    }
}
