package alpha.nomagicheaders.message;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static alpha.nomagicheaders.message.HeaderValueScanner.isToken;
import static alpha.nomagicheaders.message.MediaTypeValue.CHARSET;
import static alpha.nomagicheaders.message.MediaTypeValue.Q;
import static java.lang.System.Logger;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Parses a single media type header value.<p>
 *
 * The grammar is that of
 * <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-8.3.1">RFC 9110 §8.3.1</a>,
 * with one relaxation; optional whitespace is also accepted around the forward
 * slash. Leading and trailing whitespace is ignored, as is a trailing
 * semicolon. A parameter may be bare (no "=") or have an empty value.<p>
 *
 * A "q" parameter must have a decimal value. It is not validated to be within
 * [0, 1].
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class MediaTypeParser
{
    private static final Logger LOG = System.getLogger(MediaTypeParser.class.getPackageName());

    private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private MediaTypeParser() {
        // Empty
    }

    /**
     * The parsed parts of a media type header value.
     *
     * @param type of media type
     * @param subtype of media type
     * @param params of media type, in order
     */
    record Parts(String type, String subtype, List<Parameter> params) {
        // Empty
    }

    /**
     * Parses the given text.
     *
     * @param text to parse
     *
     * @return the parts
     *
     * @throws MediaTypeParseException
     *             if {@code text} is {@code null} or not well-formed
     */
    static Parts parse(String text) {
        if (text == null) {
            throw new MediaTypeParseException(null, "Text is null.");
        }
        final var s = new HeaderValueScanner(text);
        s.skipWhitespace();
        if (!s.hasRemaining()) {
            throw new MediaTypeParseException(text, "Text is empty or blank.");
        }

        final String type = requireToken(s, "type");
        s.skipWhitespace();
        if (!s.consume('/')) {
            throw s.unexpected("'/'");
        }
        s.skipWhitespace();
        final String subtype = requireToken(s, "subtype");
        s.skipWhitespace();

        final List<Parameter> params = new ArrayList<>();
        while (s.consume(';')) {
            s.skipWhitespace();
            if (!s.hasRemaining()) {
                break;
            }
            final String name = requireToken(s, "parameter name");
            s.skipWhitespace();
            String value = null;
            if (s.consume('=')) {
                s.skipWhitespace();
                value = s.nextQuotedString();
                if (value == null) {
                    value = s.nextToken();
                }
                if (value == null) {
                    value = "";
                }
                s.skipWhitespace();
            }
            if (name.equalsIgnoreCase(Q)) {
                requireDecimal(s, text, value);
            }
            params.add(Parameter.ofValidated(name, value));
        }

        if (s.hasRemaining()) {
            throw s.unexpected("';' or end of input");
        }

        warnIfRepeated(text, params, CHARSET);
        warnIfRepeated(text, params, Q);
        return new Parts(type, subtype, params);
    }

    /**
     * Parses a strict "type/subtype".<p>
     *
     * No whitespace and no parameters are accepted.
     *
     * @param mediaType to parse
     *
     * @return a two-element array; type and subtype
     *
     * @throws NullPointerException
     *             if {@code mediaType} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code mediaType} is not exactly "token/token"
     */
    static String[] parseStrict(String mediaType) {
        final int slash = mediaType.indexOf('/');
        if (slash == -1) {
            throw new MediaTypeParseException(mediaType, "Expected \"type/subtype\".");
        }
        final String type = mediaType.substring(0, slash),
                  subtype = mediaType.substring(slash + 1);
        requireToken(mediaType, type, "Type");
        requireToken(mediaType, subtype, "Subtype");
        return new String[]{ type, subtype };
    }

    /**
     * Throws {@code MediaTypeParseException} if the given string is not a
     * token.
     *
     * @param text being processed
     * @param token to validate
     * @param what is being validated, e.g. "Type"
     *
     * @return the token
     *
     * @throws NullPointerException if {@code token} is {@code null}
     */
    static String requireToken(String text, String token, String what) {
        if (!isToken(token)) {
            throw new MediaTypeParseException(text, what + " is not a token.");
        }
        return token;
    }

    private static String requireToken(HeaderValueScanner s, String what) {
        final String tkn = s.nextToken();
        if (tkn == null) {
            throw s.unexpected(what);
        }
        return tkn;
    }

    private static void requireDecimal(HeaderValueScanner s, String text, String value) {
        if (value == null || !DECIMAL.matcher(value).matches()) {
            throw new MediaTypeParseException(text,
                    "Non-parsable value for " + Q + "-parameter. Position: " +
                    s.position() + ".", s.position());
        }
    }

    private static void warnIfRepeated(String text, List<Parameter> params, String name) {
        if (params.stream().filter(p -> p.hasName(name)).count() > 1) {
            LOG.log(WARNING, () -> "Repeated \"" + name + "\" parameter in \"" +
                    text + "\", only the first occurrence is used.");
        }
    }
}
