package alpha.nomagicheaders.message;

import alpha.nomagicheaders.HttpConstants;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static alpha.nomagicheaders.message.MediaTypeParser.parseStrict;
import static java.lang.System.Logger;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * An immutable media type header value.<p>
 *
 * A {@code MediaType} is most commonly created by parsing a header value:
 *
 * <pre>
 *   MediaType json = MediaType.parse("application/json; charset=utf-8");
 *   List&lt;MediaType&gt; accept = MediaType.parseList(
 *           "text/html, application/xhtml+xml", "*&#47;*; q=0.8");
 * </pre>
 *
 * Parsing is lenient with regards to whitespace, but strict with regards to
 * everything else. The same value can also be constructed strictly, using
 * {@link #of(String)} or {@link #of(String, double)}, or by freezing a
 * {@link MutableMediaType} using {@link #copyAsReadOnly()}.<p>
 *
 * The type, subtype and parameter names retain their casing. They are
 * compared without regards to casing (see {@link MediaTypeValue}).<p>
 *
 * The parameters returned by {@link #parameters()} is an unmodifiable list;
 * any attempt to modify it throws {@link UnsupportedOperationException}. Use
 * {@link #copy()} to get a modifiable copy.
 *
 *
 * <h2>Thread-safety and identity.</h2>
 *
 * {@code MediaType} is thread-safe and value-based.
 *
 * @see HttpConstants.HeaderName#CONTENT_TYPE
 * @see HttpConstants.HeaderName#ACCEPT
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-8.3.1">RFC 9110 §8.3.1</a>
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class MediaType extends MediaTypeValue
{
    private static final Logger LOG = System.getLogger(MediaType.class.getPackageName());

    /** Any media type. Value: "*&#47;*". */
    public static final MediaType ALL = parse("*/*");

    /** Text. Value: "text/plain". File extension: ".txt". */
    public static final MediaType TEXT_PLAIN = parse("text/plain");

    /** Text. Value: "text/plain; charset=utf-8". File extension: ".txt". */
    public static final MediaType TEXT_PLAIN_UTF8 = parse("text/plain; charset=utf-8");

    /** HyperText Markup Language. Value: "text/html". File extension: ".html". */
    public static final MediaType TEXT_HTML = parse("text/html");

    /** HyperText Markup Language. Value: "text/html; charset=utf-8". File extension: ".html". */
    public static final MediaType TEXT_HTML_UTF8 = parse("text/html; charset=utf-8");

    /** Cascading Style Sheets. Value: "text/css". File extension: ".css". */
    public static final MediaType TEXT_CSS = parse("text/css");

    /** Comma-separated values. Value: "text/csv". File extension: ".csv". */
    public static final MediaType TEXT_CSV = parse("text/csv");

    /** JavaScript. Value: "text/javascript". File extension: ".js". */
    public static final MediaType TEXT_JAVASCRIPT = parse("text/javascript");

    /** Extensible Markup Language. Value: "text/xml". File extension: ".xml". */
    public static final MediaType TEXT_XML = parse("text/xml");

    /** Any kind of binary data. Value: "application/octet-stream". */
    public static final MediaType APPLICATION_OCTET_STREAM = parse("application/octet-stream");

    /** JSON. Value: "application/json". File extension: ".json". */
    public static final MediaType APPLICATION_JSON = parse("application/json");

    /** JSON. Value: "application/json; charset=utf-8". File extension: ".json". */
    public static final MediaType APPLICATION_JSON_UTF8 = parse("application/json; charset=utf-8");

    /** Extensible Markup Language. Value: "application/xml". File extension: ".xml". */
    public static final MediaType APPLICATION_XML = parse("application/xml");

    /** HTML form data. Value: "application/x-www-form-urlencoded". */
    public static final MediaType APPLICATION_X_WWW_FORM_URLENCODED = parse("application/x-www-form-urlencoded");

    /** Portable Document Format. Value: "application/pdf". File extension: ".pdf". */
    public static final MediaType APPLICATION_PDF = parse("application/pdf");

    /** ZIP archive. Value: "application/zip". File extension: ".zip". */
    public static final MediaType APPLICATION_ZIP = parse("application/zip");

    /** Multipart form data. Value: "multipart/form-data". */
    public static final MediaType MULTIPART_FORM_DATA = parse("multipart/form-data");

    /** Portable Network Graphics. Value: "image/png". File extension: ".png". */
    public static final MediaType IMAGE_PNG = parse("image/png");

    /** JPEG images. Value: "image/jpeg". File extension: ".jpg", ".jpeg". */
    public static final MediaType IMAGE_JPEG = parse("image/jpeg");

    /** Graphics Interchange Format. Value: "image/gif". File extension: ".gif". */
    public static final MediaType IMAGE_GIF = parse("image/gif");

    /** Scalable Vector Graphics. Value: "image/svg+xml". File extension: ".svg". */
    public static final MediaType IMAGE_SVG_XML = parse("image/svg+xml");

    /**
     * Parses a media type header value.<p>
     *
     * Examples of well-formed values:
     * <pre>
     *   text/plain
     *   text / plain ; charset = utf-8
     *   text/plain; custom="quoted value"; q=0.5
     *   text/plain; bare
     *   text/plain;
     * </pre>
     *
     * The text must hold exactly one value. A comma-separated list of values,
     * as used by the "Accept" header, is parsed using {@link
     * #parseList(String...)}.
     *
     * @param text to parse
     *
     * @return a parsed media type (never {@code null})
     *
     * @throws MediaTypeParseException
     *             if {@code text} is {@code null}, blank or not well-formed
     */
    public static MediaType parse(String text) {
        var p = MediaTypeParser.parse(text);
        return new MediaType(p.type(), p.subtype(), p.params());
    }

    /**
     * Parses a media type header value, if possible.<p>
     *
     * This method never throws {@code MediaTypeParseException}; a failure is
     * logged on level {@code DEBUG} and an empty optional is returned.
     *
     * @param text to parse (may be {@code null})
     *
     * @return the parsed media type, if well-formed
     *
     * @see #parse(String)
     */
    public static Optional<MediaType> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (MediaTypeParseException e) {
            LOG.log(DEBUG, () -> "Rejected media type \"" + text + "\".", e);
            return Optional.empty();
        }
    }

    /**
     * Parses header values, each of which may hold a comma-separated list of
     * media types.<p>
     *
     * Empty elements are ignored, e.g. "text/plain, , text/html," yields two
     * media types. A comma inside a quoted string does not separate
     * elements.<p>
     *
     * The operation is atomic; if one element is malformed, an exception is
     * thrown and nothing is returned.
     *
     * @param values to parse (may be {@code null} or empty)
     *
     * @return the parsed media types, in order (never {@code null})
     *
     * @throws MediaTypeParseException
     *             if an element is not well-formed
     */
    public static List<MediaType> parseList(String... values) {
        return values == null ? List.of() : parseList(Arrays.asList(values));
    }

    /**
     * Parses header values, each of which may hold a comma-separated list of
     * media types.
     *
     * @param values to parse (may be {@code null} or empty)
     *
     * @return the parsed media types, in order (never {@code null})
     *
     * @throws MediaTypeParseException
     *             if an element is not well-formed
     *
     * @see #parseList(String...)
     */
    public static List<MediaType> parseList(List<String> values) {
        return MediaTypeListParser.parse(values);
    }

    /**
     * Parses header values, if possible.<p>
     *
     * An empty optional is returned if an element is malformed, and also if
     * no media types were found at all.
     *
     * @param values to parse (may be {@code null} or empty)
     *
     * @return the parsed media types, if any
     *
     * @see #parseList(String...)
     */
    public static Optional<List<MediaType>> tryParseList(String... values) {
        return values == null ? Optional.empty() : tryParseList(Arrays.asList(values));
    }

    /**
     * Parses header values, if possible.
     *
     * @param values to parse (may be {@code null} or empty)
     *
     * @return the parsed media types, if any
     *
     * @see #tryParseList(String...)
     */
    public static Optional<List<MediaType>> tryParseList(List<String> values) {
        return MediaTypeListParser.tryParse(values);
    }

    /**
     * Creates a media type without parameters.<p>
     *
     * The argument must be exactly "type/subtype", with no whitespace and no
     * parameters.
     *
     * @param mediaType e.g. "text/plain"
     *
     * @return a media type
     *
     * @throws NullPointerException
     *             if {@code mediaType} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code mediaType} is not well-formed
     */
    public static MediaType of(String mediaType) {
        final String[] t = parseStrict(mediaType);
        return new MediaType(t[0], t[1], List.of());
    }

    /**
     * Creates a media type with a "q" parameter.
     *
     * @param mediaType e.g. "text/plain"
     * @param quality within [0, 1]
     *
     * @return a media type
     *
     * @throws NullPointerException
     *             if {@code mediaType} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code mediaType} is not well-formed
     * @throws IllegalArgumentException
     *             if {@code quality} is not within [0, 1]
     */
    public static MediaType of(String mediaType, double quality) {
        final String[] t = parseStrict(mediaType);
        final String q = formatQuality(quality);
        return new MediaType(t[0], t[1], List.of(Parameter.ofValidated(Q, q)));
    }

    private final String type, subtype;
    private final List<Parameter> params;
    private int hash;
    private boolean hashIsZero;

    MediaType(String type, String subtype, List<Parameter> params) {
        this.type    = type;
        this.subtype = subtype;
        this.params  = List.copyOf(params);
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String subtype() {
        return subtype;
    }

    /**
     * Returns the parameters, in order.<p>
     *
     * The returned list is unmodifiable.
     *
     * @return the parameters (never {@code null})
     */
    @Override
    public List<Parameter> parameters() {
        return params;
    }

    @Override
    List<Parameter> parameterView() {
        return params;
    }

    /**
     * Returns {@code true}.
     *
     * @return {@code true}
     */
    @Override
    public boolean isReadOnly() {
        return true;
    }

    @Override
    public int hashCode() {
        // Copy-paste from String.hashCode()
        int h = hash;
        if (h == 0 && !hashIsZero) {
            h = super.hashCode();
            if (h == 0) {
                hashIsZero = true;
            } else {
                hash = h;
            }
        }
        return h;
    }
}
