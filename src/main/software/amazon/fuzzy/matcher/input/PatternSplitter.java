package software.amazon.fuzzy.matcher.input;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Splits strings on delimiter characters. Unlike {@link String#split(String)}, consecutive delimiters are not
 * grouped together and leading or trailing delimiters are not dropped: each delimits an empty string. The result
 * therefore always holds one more element than there are delimiters in the input.
 */
public final class PatternSplitter {

    private PatternSplitter() { }

    public static List<String> split(@Nonnull final String string, @Nonnull final IntPredicate isDelimiter) {
        final List<String> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < string.length(); i++) {
            if (isDelimiter.test(string.charAt(i))) {
                result.add(string.substring(start, i));
                start = i + 1;
            }
        }
        result.add(string.substring(start));
        return result;
    }
}
