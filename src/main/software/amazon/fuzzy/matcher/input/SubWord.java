package software.amazon.fuzzy.matcher.input;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * A maximal run of non-wildcard characters of a pattern, possibly empty. The end id is the offset, in the
 * pattern, of the character right after the word; it tells how far the word's right edge sits from the start of
 * the pattern.
 */
@Immutable
public final class SubWord {

    private final String word;
    private final int endId;

    public SubWord(final String word, final int endId) {
        this.word = Objects.requireNonNull(word, "word");
        this.endId = endId;
    }

    public String getWord() {
        return word;
    }

    public int getEndId() {
        return endId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SubWord other = (SubWord) o;
        return endId == other.endId && word.equals(other.word);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, endId);
    }

    @Override
    public String toString() {
        return "SubWord{" + word + "@" + endId + "}";
    }
}
