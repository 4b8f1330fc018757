package software.amazon.fuzzy.matcher;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

/**
 * Compiles a pattern definition described by a JSON object into a {@link PatternDefinition}. The object has a
 * mandatory "pattern" string and an optional "wildcard" string of exactly one character, e.g.
 * <pre>
 *   { "pattern": "a?c", "wildcard": "?" }
 * </pre>
 * When "wildcard" is absent, '?' is used. Any other field is rejected.
 */
public class JsonPatternCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a pattern definition
     * @param source pattern definition, as a String
     * @return null if the definition is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern definition from its JSON form.
     *
     * @param source pattern definition, as a String
     * @return the definition
     * @throws IOException if the definition isn't syntactically valid
     */
    public static PatternDefinition compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static PatternDefinition compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static PatternDefinition compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static PatternDefinition compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static PatternDefinition doCompile(final JsonParser parser) throws IOException {
        try {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                barf(parser, "Pattern definition is not an object");
            }

            String pattern = null;
            char wildcard = Constants.DEFAULT_WILDCARD;
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                final String fieldName = parser.getCurrentName();
                final JsonToken valueToken = parser.nextToken();

                if (Constants.PATTERN_FIELD.equals(fieldName)) {
                    if (pattern != null) {
                        barf(parser, "\"" + Constants.PATTERN_FIELD + "\" is given more than once");
                    }
                    if (valueToken != JsonToken.VALUE_STRING) {
                        barf(parser, "\"" + Constants.PATTERN_FIELD + "\" must be a string");
                    }
                    pattern = parser.getText();
                } else if (Constants.WILDCARD_FIELD.equals(fieldName)) {
                    if (valueToken != JsonToken.VALUE_STRING) {
                        barf(parser, "\"" + Constants.WILDCARD_FIELD + "\" must be a string");
                    }
                    final String text = parser.getText();
                    if (text.length() != 1 || Character.isSurrogate(text.charAt(0))) {
                        barf(parser, "\"" + Constants.WILDCARD_FIELD + "\" must be a single character");
                    }
                    wildcard = text.charAt(0);
                } else {
                    barf(parser, String.format("Unrecognized field \"%s\"", fieldName));
                }
            }

            if (pattern == null) {
                barf(parser, "\"" + Constants.PATTERN_FIELD + "\" is missing");
            }
            if (parser.nextToken() != null) {
                barf(parser, "Unexpected content after the pattern definition");
            }
            return new PatternDefinition(pattern, wildcard);
        } finally {
            parser.close();
        }
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
