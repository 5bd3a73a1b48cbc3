package alpha.nomagicheaders.message;

import alpha.nomagicheaders.HttpConstants;

import java.util.List;
import java.util.Optional;

import static alpha.nomagicheaders.HttpConstants.HeaderName.ACCEPT;
import static alpha.nomagicheaders.HttpConstants.HeaderName.CONTENT_TYPE;

/**
 * Extraction methods for content-related headers.<p>
 *
 * An implementation need only provide {@link #allValues(String)}. The default
 * methods interpret the raw values.
 *
 * <pre>
 *   ContentHeaders headers = // from "Content-Type: text/plain; charset=utf-8"
 *   headers.contentType().flatMap(MediaType::charset) // "utf-8"
 * </pre>
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface ContentHeaders
{
    /**
     * Returns all values of the given header.<p>
     *
     * The header name is case-insensitive.
     *
     * @param headerName the header name
     *
     * @return all values, in order (never {@code null})
     *
     * @throws NullPointerException
     *             if {@code headerName} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code headerName} has leading or trailing whitespace
     */
    List<String> allValues(String headerName);

    /**
     * Parses one "Content-Type" value into a media type.<p>
     *
     * This header indicates the media type of the message body and should be
     * set by the sender if the message carries a body payload.<p>
     *
     * An empty optional is returned if the header is not present.
     *
     * @return parsed value (never {@code null})
     *
     * @throws BadHeaderException
     *           if the headers has multiple Content-Type values, or
     *           if parsing failed (cause set to {@link MediaTypeParseException})
     *
     * @see HttpConstants.HeaderName#CONTENT_TYPE
     */
    default Optional<MediaType> contentType() {
        final var values = allValues(CONTENT_TYPE).stream()
                .filter(v -> !v.isBlank())
                .toList();
        if (values.isEmpty()) {
            return Optional.empty();
        }
        if (values.size() > 1) {
            throw new BadHeaderException(
                "Multiple " + CONTENT_TYPE + " values.");
        }
        try {
            return Optional.of(MediaType.parse(values.get(0)));
        } catch (MediaTypeParseException e) {
            throw new BadHeaderException(
                "Failed to parse " + CONTENT_TYPE + " header.", e);
        }
    }

    /**
     * Parses all "Accept" values into media types.<p>
     *
     * The header may be repeated, and each value may hold many media types.
     * Either all of them parse, or the header as a whole is rejected.
     *
     * @return parsed values, in order (never {@code null})
     *
     * @throws BadHeaderException
     *           if parsing failed (cause set to {@link MediaTypeParseException})
     *
     * @see HttpConstants.HeaderName#ACCEPT
     */
    default List<MediaType> accept() {
        try {
            return MediaType.parseList(allValues(ACCEPT));
        } catch (MediaTypeParseException e) {
            throw new BadHeaderException(
                "Failed to parse " + ACCEPT + " header.", e);
        }
    }
}
