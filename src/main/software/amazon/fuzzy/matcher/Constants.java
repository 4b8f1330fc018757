package software.amazon.fuzzy.matcher;

final class Constants {

  private Constants() {
    throw new UnsupportedOperationException("You can't create instance of utility class.");
  }

  final static char DEFAULT_WILDCARD = '?';

  // field names of a JSON pattern definition
  final static String PATTERN_FIELD = "pattern";
  final static String WILDCARD_FIELD = "wildcard";
}
