package alpha.nomagicheaders.util;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * String utilities.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Strings
{
    private Strings() {
        // Empty
    }

    /**
     * Split a string into a returned stream.<p>
     *
     * Works just as {@code String.split}, except this method respects exclusion
     * zones within which, the delimiter will have no effect. Also, this method
     * never returns empty substrings.<p>
     *
     * For example, good to use when substrings may be quoted and no split
     * should occur within the quoted parts.
     *
     * <pre>
     *   split("one.two", '.', '"') returns "one", "two"
     *   split("one.\"keep.this\"", '.', '"') returns "one", ""keep.this""
     *   split("...", '.', '"') returns an empty Stream
     * </pre>
     *
     * Note how the quoted part is kept intact. It can be unquoted using {@link
     * #unquote(String)}.<p>
     *
     * An immediately preceding backslash character is interpreted as escaping
     * the next character, but only within exclusion zones. The escaping
     * backslash is kept.
     * <pre>
     *   split("one.\"t\\\"w.o\"", '.', '"') returns "one", ""t\"w.o""
     * </pre>
     *
     * Outside an exclusion zone, the backslash character is just like any other
     * character.
     * <pre>
     *   split("one\\.two", '.', '"') returns "one\", "two"
     * </pre>
     *
     * An exclusion zone that is never closed extends to the end of the
     * string.
     *
     * @param str to split
     * @param delimiter to split by (if not excluded)
     * @param excludeBoundary defines the exclusion zone
     *
     * @return the substrings
     *
     * @throws NullPointerException
     *            if {@code str} is {@code null}
     *
     * @throws IllegalArgumentException
     *             if {@code delimiter} is the backslash character, or
     *             if {@code delimiter} and {@code excludeBoundary} are the same
     *
     * @see #unquote(String)
     */
    public static Stream<String> split(
            CharSequence str, char delimiter, char excludeBoundary) {
        var b = Stream.<String>builder();
        splitToSink(str, delimiter, excludeBoundary, b);
        return b.build();
    }

    /**
     * Split a string into tokens put in a sink.<p>
     *
     * Works just as {@link #split(CharSequence, char, char)}, except pushes all
     * substrings to the given sink instead of a returned stream.
     *
     * @param str to split
     * @param delimiter to split by (if not excluded)
     * @param excludeBoundary defines the exclusion zone
     * @param sink of substrings
     *
     * @throws NullPointerException
     *            if {@code str} or {@code sink} is {@code null}
     *
     * @throws IllegalArgumentException
     *             if {@code delimiter} is the backslash character, or
     *             if {@code delimiter} and {@code excludeBoundary} are the same
     */
    public static void splitToSink(
            CharSequence str, char delimiter, char excludeBoundary,
            Consumer<String> sink)
    {
        if (delimiter == '\\') {
            throw new IllegalArgumentException(
                    "Delimiter char can not be the escape char.");
        }
        if (delimiter == excludeBoundary) {
            throw new IllegalArgumentException(
                    "Delimiter char can not be the same as exclude char.");
        }
        requireNonNull(sink);
        StringBuilder tkn = null;

        final int len = str.length();
        boolean excluding = false,
                escaped   = false;

        for (int i = 0; i < len; ++i) {
            final char c = str.charAt(i);
            boolean split = false;

            if (excluding && escaped) {
                // Whatever c is, it is kept, and it escapes nothing
                escaped = false;
            } else if (excluding && c == '\\') {
                escaped = true;
            } else if (c == excludeBoundary) {
                excluding = !excluding;
            } else if (c == delimiter) {
                split = !excluding;
            }

            if (split) {
                pushNullable(tkn, sink);
                tkn = null;
            } else {
                if (tkn == null) {
                    tkn = new StringBuilder();
                }
                tkn.append(c);
            }
        }

        pushNullable(tkn, sink);
    }

    private static void pushNullable(StringBuilder sb, Consumer<String> sink) {
        if (sb != null) {
            var s = sb.toString();
            assert !s.isEmpty();
            sink.accept(s);
        }
    }

    /**
     * Unquote a quoted string.<p>
     *
     * If the given string does not start and end with a double quote, the
     * string is returned as-is. Otherwise, the enclosing quotes are removed
     * and each quoted-pair (a backslash followed by any char) is replaced by
     * the char that was escaped.<p>
     *
     * For example, literal string value becomes
     * <pre>
     *   no\"effect       no\"effect   (no surrounding quotes returns the input)
     *   "one"            one          (unquoted)
     *   "one\"two\""     one"two"     (quote character escaped)
     *   "one\\two"       one\two      (backslash escaped)
     *   "\n"             n            (not a Java escape sequence)
     *   ""               (empty)
     * </pre>
     *
     * @param str to unquote
     * @return an unquoted string
     *
     * @throws NullPointerException if {@code str} is {@code null}
     *
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-5.6.4">RFC 9110 §5.6.4</a>
     */
    public static String unquote(String str) {
        if (str.length() < 2 || !(str.startsWith("\"") && str.endsWith("\""))) {
            return str;
        }
        final int end = str.length() - 1;
        final var b = new StringBuilder(end - 1);
        for (int i = 1; i < end; ++i) {
            char c = str.charAt(i);
            if (c == '\\' && i + 1 < end) {
                c = str.charAt(++i);
            }
            b.append(c);
        }
        return b.toString();
    }

    /**
     * Lower case the given string using the root locale.
     *
     * @param str to lower case (may be {@code null})
     *
     * @return the lower cased string, or {@code null} if {@code str} is
     *         {@code null}
     */
    public static String lowerCase(String str) {
        return str == null ? null : str.toLowerCase(Locale.ROOT);
    }

    /**
     * Equivalent to {@link String#equalsIgnoreCase(String)}, except both
     * operands may be {@code null}.
     *
     * @param a left operand
     * @param b right operand
     *
     * @return {@code true} if both are {@code null},
     *         or both are equal ignoring case,
     *         otherwise {@code false}
     */
    public static boolean equalsIgnoreCase(String a, String b) {
        return a == null ? b == null : a.equalsIgnoreCase(b);
    }

    /**
     * Throws {@code IllegalArgumentException} if the given {@code str} contains
     * leading or trailing whitespace.
     *
     * @param str to validate
     *
     * @return the same {@code str} reference
     *
     * @throws NullPointerException
     *             if {@code str} is {@code null}
     * @throws IllegalArgumentException
     *             see JavaDoc
     *
     * @see Character#isWhitespace(int)
     */
    public static String requireNoSurroundingWS(String str) {
        requireNoEffect(str, str.stripLeading(), "Leading");
        requireNoEffect(str, str.stripTrailing(), "Trailing");
        return str;
    }

    private static void requireNoEffect(String org, String res, String prefix) {
        if (!Objects.equals(org, res)) {
            throw new IllegalArgumentException(
                    prefix + " whitespace in \"" + org + "\".");
        }
    }
}
