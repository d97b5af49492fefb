package io.civiltime.core;

/**
 * Base class for civil time conversion errors.
 *
 * <p>Every failure of an encode, decode or scan operation is reported through one of the
 * nested subclasses. The original cause is preserved when there is one.
 */
public abstract class CivilTimeException extends RuntimeException {

    protected CivilTimeException(String message) {
        super(message);
    }

    protected CivilTimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a field is outside the range the text format can represent.
     */
    public static class OutOfRange extends CivilTimeException {
        private final String field;
        private final long value;

        public OutOfRange(String field, long value, long min, long max) {
            super(field + " '" + value + "' outside of range [" + min + "," + max + "]");
            this.field = field;
            this.value = value;
        }

        public String field() {
            return field;
        }

        public long value() {
            return value;
        }
    }

    /**
     * Raised when text does not strictly match a layout or names a value the calendar rejects.
     */
    public static class ParseFailure extends CivilTimeException {
        private final String literal;
        private final String layout;

        public ParseFailure(String kind, String literal, String layout, Throwable cause) {
            super(message(kind, literal, layout, cause), cause);
            this.literal = literal;
            this.layout = layout;
        }

        /**
         * The rejected text.
         */
        public String literal() {
            return literal;
        }

        public String layout() {
            return layout;
        }

        private static String message(String kind, String literal, String layout, Throwable cause) {
            String base = "invalid " + kind + ": cannot parse \"" + literal + "\" as \"" + layout + "\"";
            return cause == null || cause.getMessage() == null ? base : base + ": " + cause.getMessage();
        }
    }

    /**
     * Raised when a scan source is neither text nor a calendar reading.
     */
    public static class UnsupportedScanInput extends CivilTimeException {
        private final Class<?> inputType;

        public UnsupportedScanInput(Class<?> inputType, String target) {
            super("cannot scan " + (inputType == null ? "null" : inputType.getName()) + " into " + target);
            this.inputType = inputType;
        }

        public Class<?> inputType() {
            return inputType;
        }
    }
}
