package alpha.nomagicheaders.message;

import static alpha.nomagicheaders.message.Char.isQuotedPairText;
import static alpha.nomagicheaders.message.Char.isQuotedText;
import static alpha.nomagicheaders.message.Char.isTokenChar;
import static alpha.nomagicheaders.message.Char.toDebugString;

/**
 * A cursor over the text of a header value.<p>
 *
 * The scanner recognizes tokens, quoted strings, optional whitespace and
 * single separator characters. It has no knowledge of what is being parsed;
 * that is the job of the caller, who also decides what is optional and what
 * is required.<p>
 *
 * The static length methods do the actual matching. They report how many
 * chars, starting from a given index, constitute a match. Zero means no
 * match.<p>
 *
 * Optional whitespace is SP and HTAB, and also the obsolete line folding
 * (CRLF followed by SP or HTAB) which
 * <a href="https://datatracker.ietf.org/doc/html/rfc9112#section-5.2">RFC 9112 §5.2</a>
 * tells a recipient to replace with a space.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class HeaderValueScanner
{
    /**
     * Returned by {@link #quotedStringLength(CharSequence, int)} if the text
     * starts a quoted string which is never terminated, or contains an illegal
     * char.
     */
    static final int INVALID = -1;

    /**
     * Returns the length of a token starting at the given index.
     *
     * @param str to scan
     * @param start index
     *
     * @return the length of the token (0 if there is none)
     */
    static int tokenLength(CharSequence str, int start) {
        int i = start;
        while (i < str.length() && isTokenChar(str.charAt(i))) {
            ++i;
        }
        return i - start;
    }

    /**
     * Returns the length of optional whitespace starting at the given index.
     *
     * @param str to scan
     * @param start index
     *
     * @return the length of whitespace (0 if there is none)
     */
    static int whitespaceLength(CharSequence str, int start) {
        int i = start;
        while (i < str.length()) {
            final char c = str.charAt(i);
            if (c == ' ' || c == '\t') {
                ++i;
            } else if (c == '\r' && isFold(str, i)) {
                i += 3;
            } else {
                break;
            }
        }
        return i - start;
    }

    private static boolean isFold(CharSequence str, int cr) {
        if (cr + 2 >= str.length() || str.charAt(cr + 1) != '\n') {
            return false;
        }
        final char c = str.charAt(cr + 2);
        return c == ' ' || c == '\t';
    }

    /**
     * Returns the length of a quoted string starting at the given index,
     * including both quote characters.
     *
     * @param str to scan
     * @param start index
     *
     * @return the length of the quoted string,
     *         0 if there is no quoted string, or
     *         {@link #INVALID} if the quoted string is malformed
     */
    static int quotedStringLength(CharSequence str, int start) {
        if (start >= str.length() || str.charAt(start) != '"') {
            return 0;
        }
        int i = start + 1;
        while (i < str.length()) {
            final char c = str.charAt(i);
            if (c == '"') {
                return i - start + 1;
            }
            if (c == '\\') {
                if (i + 1 >= str.length() || !isQuotedPairText(str.charAt(i + 1))) {
                    return INVALID;
                }
                i += 2;
            } else if (isQuotedText(c)) {
                ++i;
            } else {
                return INVALID;
            }
        }
        return INVALID;
    }

    /**
     * Returns {@code true} if the given string, in its entirety, is a token.
     *
     * @param str to test
     *
     * @return see JavaDoc
     */
    static boolean isToken(CharSequence str) {
        return !str.isEmpty() && tokenLength(str, 0) == str.length();
    }

    /**
     * Returns {@code true} if the given string, in its entirety, is a quoted
     * string.
     *
     * @param str to test
     *
     * @return see JavaDoc
     */
    static boolean isQuotedString(CharSequence str) {
        return !str.isEmpty() && quotedStringLength(str, 0) == str.length();
    }

    private final String text;
    private int pos;

    HeaderValueScanner(String text) {
        this.text = text;
        this.pos  = 0;
    }

    /**
     * Returns the current position.
     *
     * @return the current position
     */
    int position() {
        return pos;
    }

    /**
     * Returns {@code true} if there is more text to scan.
     *
     * @return see JavaDoc
     */
    boolean hasRemaining() {
        return pos < text.length();
    }

    /**
     * Skip whitespace.
     *
     * @return the number of chars skipped
     */
    int skipWhitespace() {
        final int n = whitespaceLength(text, pos);
        pos += n;
        return n;
    }

    /**
     * Consume the given char, if it is the current char.
     *
     * @param c expected char
     *
     * @return {@code true} if consumed, otherwise {@code false}
     */
    boolean consume(char c) {
        if (hasRemaining() && text.charAt(pos) == c) {
            ++pos;
            return true;
        }
        return false;
    }

    /**
     * Consume a token.
     *
     * @return the token, or {@code null} if there is no token at the current
     *         position
     */
    String nextToken() {
        final int n = tokenLength(text, pos);
        if (n == 0) {
            return null;
        }
        final String tkn = text.substring(pos, pos + n);
        pos += n;
        return tkn;
    }

    /**
     * Consume a quoted string.<p>
     *
     * The returned string retains the enclosing quotes and escape characters.
     *
     * @return the quoted string, or {@code null} if the current char is not a
     *         double quote
     *
     * @throws MediaTypeParseException
     *             if the quoted string is not terminated, or
     *             it contains an illegal char
     */
    String nextQuotedString() {
        final int n = quotedStringLength(text, pos);
        if (n == 0) {
            return null;
        }
        if (n == INVALID) {
            throw parseException("Unterminated or malformed quoted string.");
        }
        final String qs = text.substring(pos, pos + n);
        pos += n;
        return qs;
    }

    /**
     * Returns a parse exception for the current position.
     *
     * @param msg describing what went wrong
     *
     * @return a parse exception
     */
    MediaTypeParseException parseException(String msg) {
        return new MediaTypeParseException(text, msg + " Position: " + pos + ".", pos);
    }

    /**
     * Returns a parse exception for an unexpected char at the current position.
     *
     * @param expected describing what was expected
     *
     * @return a parse exception
     */
    MediaTypeParseException unexpected(String expected) {
        final String found = hasRemaining() ?
                toDebugString(text.charAt(pos)) : "end of input";
        return parseException("Expected " + expected + ", found " + found + ".");
    }
}
