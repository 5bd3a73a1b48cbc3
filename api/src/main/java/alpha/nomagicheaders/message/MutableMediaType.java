package alpha.nomagicheaders.message;

import java.util.List;

import static alpha.nomagicheaders.message.MediaTypeParser.parseStrict;
import static alpha.nomagicheaders.message.MediaTypeParser.requireToken;
import static java.util.Objects.requireNonNull;

/**
 * A modifiable media type header value.<p>
 *
 * Used to build a value piece by piece, for example a "Content-Type" header
 * to be sent:
 *
 * <pre>
 *   var mt = new MutableMediaType("text/plain");
 *   mt.setCharset("utf-8");
 *   mt.parameters().add(Parameter.of("format", "flowed"));
 *   // "text/plain; charset=utf-8; format=flowed"
 *   String header = mt.toString();
 * </pre>
 *
 * All modifications are validated; the value can never become malformed.
 * {@link #copyAsReadOnly()} returns an immutable snapshot.<p>
 *
 * This class is not thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class MutableMediaType extends MediaTypeValue
{
    private String type, subtype;
    private final ParameterList params;

    /**
     * Constructs a {@code MutableMediaType}.<p>
     *
     * The argument must be exactly "type/subtype", with no whitespace and no
     * parameters.
     *
     * @param mediaType e.g. "text/plain"
     *
     * @throws NullPointerException
     *             if {@code mediaType} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code mediaType} is not well-formed
     */
    public MutableMediaType(String mediaType) {
        final String[] t = parseStrict(mediaType);
        this.type    = t[0];
        this.subtype = t[1];
        this.params  = new ParameterList();
    }

    /**
     * Constructs a {@code MutableMediaType} with a "q" parameter.
     *
     * @param mediaType e.g. "text/plain"
     * @param quality within [0, 1]
     *
     * @throws NullPointerException
     *             if {@code mediaType} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code mediaType} is not well-formed
     * @throws IllegalArgumentException
     *             if {@code quality} is not within [0, 1]
     */
    public MutableMediaType(String mediaType, double quality) {
        this(mediaType);
        setQuality(quality);
    }

    MutableMediaType(String type, String subtype, List<Parameter> copyFrom) {
        this.type    = type;
        this.subtype = subtype;
        this.params  = new ParameterList(copyFrom);
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
     * Returns the live parameter list.<p>
     *
     * Modifications of the returned list are modifications of this value.
     *
     * @return the live parameter list (never {@code null})
     */
    @Override
    public ParameterList parameters() {
        return params;
    }

    @Override
    List<Parameter> parameterView() {
        return params.asList();
    }

    /**
     * Returns {@code false}.
     *
     * @return {@code false}
     */
    @Override
    public boolean isReadOnly() {
        return false;
    }

    /**
     * Sets both the type and the subtype.<p>
     *
     * Parameters are not affected.
     *
     * @param mediaType e.g. "text/plain"
     *
     * @throws NullPointerException
     *             if {@code mediaType} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code mediaType} is not exactly "type/subtype"
     */
    public void setMediaType(String mediaType) {
        final String[] t = parseStrict(mediaType);
        type    = t[0];
        subtype = t[1];
    }

    /**
     * Sets the type.
     *
     * @param type e.g. "text"
     *
     * @throws NullPointerException
     *             if {@code type} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code type} is not a token
     */
    public void setType(String type) {
        this.type = requireToken(type, requireNonNull(type), "Type");
    }

    /**
     * Sets the subtype.
     *
     * @param subtype e.g. "plain"
     *
     * @throws NullPointerException
     *             if {@code subtype} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code subtype} is not a token
     */
    public void setSubtype(String subtype) {
        this.subtype = requireToken(subtype, requireNonNull(subtype), "Subtype");
    }

    /**
     * Sets the charset.<p>
     *
     * If a "charset" parameter is present, its value is replaced; the
     * parameter keeps both its position and the casing of its name. Otherwise,
     * a new parameter is appended.
     *
     * @param charset value, or {@code null} to remove the first "charset"
     *        parameter
     *
     * @throws MediaTypeParseException
     *             if {@code charset} is not empty, a token or a quoted string
     */
    public void setCharset(String charset) {
        if (charset == null) {
            params.remove(CHARSET);
        } else {
            replaceOrAdd(CHARSET, charset);
        }
    }

    /**
     * Sets the quality.<p>
     *
     * The value is rounded half-up to three fractional digits, and is
     * serialized with at least one fractional digit. For example, 1 is
     * serialized as "1.0", and 0.563156454 as "0.563".<p>
     *
     * If a "q" parameter is present, its value is replaced; otherwise a new
     * parameter is appended.
     *
     * @param quality within [0, 1], or {@code null} to remove the first "q"
     *        parameter
     *
     * @throws IllegalArgumentException
     *             if {@code quality} is not within [0, 1]
     */
    public void setQuality(Double quality) {
        if (quality == null) {
            params.remove(Q);
        } else {
            replaceOrAdd(Q, formatQuality(quality));
        }
    }

    private void replaceOrAdd(String name, String value) {
        final int i = params.indexOf(name);
        if (i == -1) {
            params.add(Parameter.of(name, value));
        } else {
            params.set(i, params.get(i).withValue(value));
        }
    }
}
