package alpha.nomagicheaders.message;

import alpha.nomagicheaders.util.Strings;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.System.Logger;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * Parses header values holding comma-separated lists of media types.<p>
 *
 * Each header value is split on commas that are not within a quoted string.
 * Blank elements are skipped, and each remaining element is parsed by {@link
 * MediaType#parse(String)}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class MediaTypeListParser
{
    private static final Logger LOG = System.getLogger(MediaTypeListParser.class.getPackageName());

    private MediaTypeListParser() {
        // Empty
    }

    /**
     * Parses all elements of all given header values.
     *
     * @param values to parse (may be {@code null})
     *
     * @return the parsed media types (unmodifiable)
     *
     * @throws MediaTypeParseException
     *             if an element is not well-formed
     */
    static List<MediaType> parse(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        final var parsed = new ArrayList<MediaType>();
        for (String v : values) {
            if (v == null) {
                continue;
            }
            Strings.split(v, ',', '"')
                   .filter(e -> !e.isBlank())
                   .map(MediaType::parse)
                   .forEach(parsed::add);
        }
        return List.copyOf(parsed);
    }

    /**
     * Parses all elements of all given header values, if possible.<p>
     *
     * Returns an empty optional if an element is malformed, or if there were no
     * elements at all.
     *
     * @param values to parse (may be {@code null})
     *
     * @return the parsed media types, if any
     */
    static Optional<List<MediaType>> tryParse(List<String> values) {
        final List<MediaType> parsed;
        try {
            parsed = parse(values);
        } catch (MediaTypeParseException e) {
            LOG.log(DEBUG, () -> "Rejected media type list " + values + ".", e);
            return Optional.empty();
        }
        return parsed.isEmpty() ? Optional.empty() : Optional.of(parsed);
    }
}
