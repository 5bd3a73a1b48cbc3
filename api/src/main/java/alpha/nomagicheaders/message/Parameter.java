package alpha.nomagicheaders.message;

import alpha.nomagicheaders.util.Strings;

import static alpha.nomagicheaders.message.HeaderValueScanner.isQuotedString;
import static alpha.nomagicheaders.message.HeaderValueScanner.isToken;
import static alpha.nomagicheaders.util.Strings.equalsIgnoreCase;
import static alpha.nomagicheaders.util.Strings.lowerCase;
import static java.util.Objects.requireNonNull;

/**
 * A media type parameter; a name, optionally followed by "=" and a value.<p>
 *
 * The value is stored exactly as it appeared on the wire, which for a quoted
 * string includes the enclosing quotes and any escape characters. Use {@link
 * #unquotedValue()} to get the content of a quoted string.<p>
 *
 * A parameter may have no value at all ("bare"), e.g. ";custom", which is
 * different from having an empty value, e.g. ";custom=".
 *
 *
 * <h2>Thread-safety and identity.</h2>
 *
 * {@code Parameter} is an immutable value-based class.<p>
 *
 * Both the name and the value are compared without regards to casing. A bare
 * parameter is only equal to another bare parameter of the same name.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Parameter
{
    /**
     * Creates a bare parameter.
     *
     * @param name of parameter
     *
     * @return a parameter
     *
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code name} is not a token
     */
    public static Parameter of(String name) {
        return new Parameter(requireName(name), null);
    }

    /**
     * Creates a parameter.<p>
     *
     * The value must be empty, a token or a quoted string. Quotes are not added
     * implicitly; {@code Parameter.of("x", "\"a b\"")} is legal but
     * {@code Parameter.of("x", "a b")} is not.
     *
     * @param name of parameter
     * @param value of parameter (may be {@code null}, for a bare parameter)
     *
     * @return a parameter
     *
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws MediaTypeParseException
     *             if {@code name} is not a token, or
     *             {@code value} is not empty, a token or a quoted string
     */
    public static Parameter of(String name, String value) {
        return new Parameter(requireName(name), requireValue(value));
    }

    private static String requireName(String name) {
        if (!isToken(requireNonNull(name))) {
            throw new MediaTypeParseException(name, "Parameter name is not a token.");
        }
        return name;
    }

    private static String requireValue(String value) {
        if (value != null && !value.isEmpty() &&
                !isToken(value) && !isQuotedString(value)) {
            throw new MediaTypeParseException(value,
                    "Parameter value is neither a token nor a quoted string.");
        }
        return value;
    }

    /**
     * Creates a parameter from already validated parts.
     *
     * @param name of parameter
     * @param value of parameter
     *
     * @return a parameter
     */
    static Parameter ofValidated(String name, String value) {
        assert isToken(name);
        return new Parameter(name, value);
    }

    private final String name, value;

    private Parameter(String name, String value) {
        this.name  = name;
        this.value = value;
    }

    /**
     * Returns the parameter name.<p>
     *
     * The casing is retained as given.
     *
     * @return the parameter name (never {@code null} or empty)
     */
    public String name() {
        return name;
    }

    /**
     * Returns the parameter value.<p>
     *
     * If the value is a quoted string, then the returned string includes the
     * quotes.
     *
     * @return the parameter value, or {@code null} if this parameter is bare
     */
    public String value() {
        return value;
    }

    /**
     * Returns the parameter value, unquoted.
     *
     * @return the parameter value, or {@code null} if this parameter is bare
     *
     * @see Strings#unquote(String)
     */
    public String unquotedValue() {
        return value == null ? null : Strings.unquote(value);
    }

    /**
     * Returns {@code true} if this parameter has the given name, ignoring case.
     *
     * @param name to compare with
     *
     * @return see JavaDoc
     */
    public boolean hasName(String name) {
        return this.name.equalsIgnoreCase(name);
    }

    /**
     * Returns a parameter with the same name as this parameter, but with the
     * given value.
     *
     * @param value of the new parameter (may be {@code null})
     *
     * @return a new parameter
     *
     * @throws MediaTypeParseException
     *             if {@code value} is not empty, a token or a quoted string
     */
    public Parameter withValue(String value) {
        return new Parameter(name, requireValue(value));
    }

    @Override
    public int hashCode() {
        final int h = lowerCase(name).hashCode();
        return value == null ? h : 31 * h + lowerCase(value).hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Parameter other)) {
            return false;
        }
        return name.equalsIgnoreCase(other.name) &&
               equalsIgnoreCase(value, other.value);
    }

    /**
     * Returns "name=value", or only "name" if this parameter is bare.
     *
     * @return "name=value", or only "name" if this parameter is bare
     */
    @Override
    public String toString() {
        return value == null ? name : name + "=" + value;
    }
}
