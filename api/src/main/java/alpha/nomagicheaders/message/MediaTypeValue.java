package alpha.nomagicheaders.message;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import static alpha.nomagicheaders.util.Strings.lowerCase;
import static java.lang.Double.parseDouble;

/**
 * The read API shared by the two shapes of a media type header value; the
 * immutable {@link MediaType} and the {@link MutableMediaType}.<p>
 *
 * A media type header value is a type, a subtype and zero or more parameters,
 * for example "text/plain; charset=utf-8; q=0.8". It is the value of the
 * "Content-Type" header, and each comma-separated element of the "Accept"
 * header.<p>
 *
 * Two special parameters have accessors; "charset" ({@link #charset()}) and
 * "q" ({@link #quality()}). They both operate on the first parameter with the
 * name, ignoring case.
 *
 *
 * <h2>Identity</h2>
 *
 * Two values are equal if their types and subtypes are equal ignoring case,
 * and they have equal parameters ignoring order. Parameters are compared by
 * name and value, both ignoring case (see {@link Parameter}).<p>
 *
 * Equality is defined by this class and is independent of the shape. A {@code
 * MutableMediaType} is equal to a {@code MediaType} with the same type, subtype
 * and parameters. This is the same contract as implemented by
 * {@code java.util.AbstractList}; a mutable value must not be modified while
 * it is used as a key in a hash-based collection.
 *
 *
 * <h2>Serialization</h2>
 *
 * {@link #toString()} returns the canonical wire form, "type/subtype" followed
 * by "; name=value" for each parameter, in order. Casing is retained, and
 * whitespace is normalized. {@link MediaType#parse(String)} of the returned
 * string yields an equal value.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public sealed abstract class MediaTypeValue permits MediaType, MutableMediaType
{
    static final String WILDCARD = "*",
                        CHARSET  = "charset",
                        Q        = "q";

    MediaTypeValue() {
        // Package-private
    }

    /**
     * Returns the type.<p>
     *
     * For example, "text/plain; charset=utf-8" returns "text".
     *
     * @return the type (never {@code null} or empty)
     */
    public abstract String type();

    /**
     * Returns the subtype.<p>
     *
     * For example, "text/plain; charset=utf-8" returns "plain".
     *
     * @return the subtype (never {@code null} or empty)
     */
    public abstract String subtype();

    /**
     * Returns the parameters, in order.
     *
     * @return the parameters (never {@code null})
     */
    public abstract Iterable<Parameter> parameters();

    /**
     * Returns {@code true} if this value can not be modified.
     *
     * @return see JavaDoc
     */
    public abstract boolean isReadOnly();

    abstract List<Parameter> parameterView();

    /**
     * Returns "type/subtype".
     *
     * @return "type/subtype"
     */
    public final String mediaType() {
        return type() + "/" + subtype();
    }

    /**
     * Returns {@code true} if the type is a wildcard ("*").
     *
     * @return see JavaDoc
     */
    public final boolean isWildcardType() {
        return WILDCARD.equals(type());
    }

    /**
     * Returns {@code true} if the subtype is a wildcard ("*").
     *
     * @return see JavaDoc
     */
    public final boolean isWildcardSubtype() {
        return WILDCARD.equals(subtype());
    }

    /**
     * Returns the value of the first "charset" parameter.<p>
     *
     * The value is returned as-is; a quoted value retains its quotes.
     *
     * @return the charset, if present
     */
    public final Optional<String> charset() {
        return first(CHARSET).map(Parameter::value);
    }

    /**
     * Returns the value of the first "q" parameter, as a double.<p>
     *
     * A parsed value has a numeric "q" parameter. A value built by hand may
     * have been given a parameter that is not numeric, in which case this
     * method throws.
     *
     * @return the quality value, if present
     *
     * @throws NumberFormatException
     *             if the "q" parameter is not numeric
     */
    public final OptionalDouble quality() {
        Optional<Parameter> q = first(Q);
        if (q.isEmpty()) {
            return OptionalDouble.empty();
        }
        String v = q.get().value();
        if (v == null) {
            throw new NumberFormatException("Parameter \"" + q.get().name() + "\" has no value.");
        }
        return OptionalDouble.of(parseDouble(v));
    }

    final Optional<Parameter> first(String name) {
        for (Parameter p : parameterView()) {
            if (p.hasName(name)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns {@code true} if this value is a subset of the given pattern.<p>
     *
     * That is to say, this value is acceptable to someone who accepts the
     * given pattern, for example a media range from an "Accept" header.<p>
     *
     * The type and subtype are each matched if the pattern's is a wildcard,
     * or else equal to this value's, ignoring case. A wildcard in this value
     * does not match a specific type or subtype of the pattern.<p>
     *
     * Further, each parameter of the pattern, except for the "q" parameter,
     * must also be present in this value, with the same value, ignoring case.
     * This value may have more parameters than the pattern.<p>
     *
     * "text/plain" is a subset of "text/*".<br>
     * "text/*" is not a subset of "text/plain".<br>
     * "text/plain; charset=utf-8; q=0.5" is a subset of "text/plain; q=1".<br>
     * "text/plain" is not a subset of "text/plain; charset=utf-8".<br>
     *
     * @param pattern to match against
     *
     * @return see JavaDoc
     *
     * @throws NullPointerException if {@code pattern} is {@code null}
     */
    public final boolean isSubsetOf(MediaTypeValue pattern) {
        if (!pattern.isWildcardType() && !type().equalsIgnoreCase(pattern.type())) {
            return false;
        }
        if (!pattern.isWildcardSubtype() && !subtype().equalsIgnoreCase(pattern.subtype())) {
            return false;
        }
        final List<Parameter> mine = parameterView();
        for (Parameter required : pattern.parameterView()) {
            if (required.hasName(Q)) {
                continue;
            }
            if (!mine.contains(required)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a new mutable copy of this value.
     *
     * @return a new mutable copy of this value
     */
    public final MutableMediaType copy() {
        return new MutableMediaType(type(), subtype(), parameterView());
    }

    /**
     * Returns a new immutable copy of this value.<p>
     *
     * A new instance is returned even if this value is already immutable.
     *
     * @return a new immutable copy of this value
     */
    public final MediaType copyAsReadOnly() {
        return new MediaType(type(), subtype(), parameterView());
    }

    @Override
    public int hashCode() {
        int h = 31 * lowerCase(type()).hashCode() + lowerCase(subtype()).hashCode();
        // Sum of distinct parameters; order and duplicates are irrelevant
        for (Parameter p : new HashSet<>(parameterView())) {
            h += p.hashCode();
        }
        return h;
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MediaTypeValue that)) {
            return false;
        }
        if (!type().equalsIgnoreCase(that.type()) ||
            !subtype().equalsIgnoreCase(that.subtype())) {
            return false;
        }
        final List<Parameter> a = this.parameterView(),
                              b = that.parameterView();
        return a.size() == b.size() &&
               b.containsAll(a) &&
               a.containsAll(b);
    }

    /**
     * Returns the canonical string form of this value.<p>
     *
     * For example, "text/plain; charset=utf-8".
     *
     * @return the canonical string form of this value
     */
    @Override
    public final String toString() {
        final List<Parameter> params = parameterView();
        if (params.isEmpty()) {
            return mediaType();
        }
        return mediaType() + params.stream()
                .map(Parameter::toString)
                .collect(Collectors.joining("; ", "; ", ""));
    }

    /**
     * Format a quality value.<p>
     *
     * The value is rounded half-up to three fractional digits. The result has
     * at least one, and at most three, fractional digits. For example, 1
     * becomes "1.0", 0.08 becomes "0.08", and 0.5635 becomes "0.564".
     *
     * @param quality to format
     *
     * @return the formatted value
     *
     * @throws IllegalArgumentException
     *             if {@code quality} is not within [0, 1]
     */
    static String formatQuality(double quality) {
        if (!(quality >= 0. && quality <= 1.)) {
            throw new IllegalArgumentException(
                    "Quality must be within [0, 1], got: " + quality);
        }
        BigDecimal v = BigDecimal.valueOf(quality)
                .setScale(3, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        if (v.scale() < 1) {
            v = v.setScale(1);
        }
        return v.toPlainString();
    }
}
