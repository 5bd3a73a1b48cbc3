package alpha.nomagicheaders.message;

import java.util.Map;

import static java.util.Arrays.stream;
import static java.util.Locale.ROOT;
import static java.util.stream.Collectors.toMap;

/**
 * Utility enumeration of char values relevant for the grammar of structured
 * header values.<p>
 *
 * Also hosts the character classes of
 * <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-5.6">RFC 9110 §5.6</a>
 * that the parser is built from; token characters ("tchar"), quoted-string
 * text ("qdtext") and the characters allowed to be escaped in a
 * "quoted-pair".
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public enum Char {
    /** The space character. */
    SPACE           (' ', " "),
    /** The tab character {@code \t}. */
    TAB             ('\t', "\\t"),
    /** The line feed character {@code \n}. */
    LINE_FEED       ('\n', "\\n"),
    /** The carriage return character {@code \r}. */
    CARRIAGE_RETURN ('\r', "\\r"),
    /** The double quote character {@code \"}. */
    DOUBLE_QUOTE    ('\"', "\\\""),
    /** The backslash character {@code \\}. */
    BACKSLASH       ('\\', "\\\\");

    private static final String TCHAR_SPECIALS = "!#$%&'*+-.^_`|~";

    /**
     * Returns {@code true} if the given char is a "tchar".<p>
     *
     * A tchar is an ASCII letter or digit, or one of
     * {@code !#$%&'*+-.^_`|~}.
     *
     * @param c to test
     *
     * @return see JavaDoc
     */
    public static boolean isTokenChar(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               (c >= '0' && c <= '9') ||
               TCHAR_SPECIALS.indexOf(c) != -1;
    }

    /**
     * Returns {@code true} if the given char may appear unescaped within a
     * quoted-string.
     *
     * @param c to test
     *
     * @return see JavaDoc
     */
    public static boolean isQuotedText(char c) {
        return c == '\t' || c == ' ' || c == 0x21 ||
               (c >= 0x23 && c <= 0x5B) ||
               (c >= 0x5D && c <= 0x7E) ||
               isObsText(c);
    }

    /**
     * Returns {@code true} if the given char may follow a backslash within a
     * quoted-string.
     *
     * @param c to test
     *
     * @return see JavaDoc
     */
    public static boolean isQuotedPairText(char c) {
        return c == '\t' || c == ' ' ||
               (c >= 0x21 && c <= 0x7E) ||
               isObsText(c);
    }

    private static boolean isObsText(char c) {
        return c >= 0x80 && c <= 0xFF;
    }

    /**
     * Returns a char debug String, like this (example provided for '\n'):
     * <pre>
     *   (hex:0xA, decimal:10, char:"\n")
     * </pre>
     *
     * @param c character to dump
     *
     * @return see JavaDoc
     */
    public static String toDebugString(char c) {
        final String hex = Integer.toHexString(c).toUpperCase(ROOT),
                     dec = Integer.toString(c),
                     chr = Char.toString(c);

        return "(hex:0x" + hex + ", decimal:" + dec + ", char:\"" + chr + "\")";
    }

    private final char c;
    private final String s;

    Char(char c, String s) {
        this.c = c;
        this.s = s;
    }

    /**
     * Returns the backing char.
     *
     * @return the backing char
     */
    public char charValue() {
        return c;
    }

    private String escaped() {
        return s;
    }

    private static final Map<Character, String> INDEX = stream(Char.values())
            .collect(toMap(Char::charValue, Char::escaped));

    private static String toString(char c) {
        return INDEX.getOrDefault(c, String.valueOf(c));
    }
}
