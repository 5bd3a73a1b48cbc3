package alpha.nomagicheaders.message;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiConsumer;

import static alpha.nomagicheaders.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicheaders.util.Strings.requireNoSurroundingWS;
import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link ContentHeaders}.<p>
 *
 * Header names retain their casing and iteration order, but are looked up
 * without regards to casing. The implementation is immutable and
 * thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultContentHeaders
        implements ContentHeaders, Iterable<Map.Entry<String, List<String>>>
{
    private static final DefaultContentHeaders EMPTY
            = new DefaultContentHeaders(new LinkedHashMap<>());

    /**
     * Returns an empty {@code DefaultContentHeaders} (singleton).
     *
     * @return see JavaDoc
     */
    public static DefaultContentHeaders empty() {
        return EMPTY;
    }

    /** Saved iteration order. */
    private final String[] keys;
    /** Case-insensitive. Modifiable; don't leak. */
    private final Map<String, List<String>> lookup;

    /**
     * Constructs this object.
     *
     * @param entries multivalued {@code Map} of headers
     *
     * @throws NullPointerException
     *             if {@code entries} is {@code null}, or
     *             a header name or value is {@code null}
     * @throws IllegalArgumentException
     *             if a header name has leading or trailing whitespace, or
     *             if a header name is repeated using different casing
     */
    public DefaultContentHeaders(LinkedHashMap<String, List<String>> entries) {
        var keys = new String[entries.size()];
        var idx  = new int[1];
        var lookup = new TreeMap<String, List<String>>(CASE_INSENSITIVE_ORDER);
        entries.forEach((k, v) -> {
            requireNoSurroundingWS(k);
            if (lookup.put(k, List.copyOf(v)) != null) {
                throw new IllegalArgumentException(
                        "Header name repeated with different casing: " + k);
            }
            keys[idx[0]++] = k;
        });
        this.keys = keys;
        this.lookup = lookup;
    }

    @Override
    public List<String> allValues(String headerName) {
        requireNoSurroundingWS(headerName);
        return lookup.getOrDefault(headerName, List.of());
    }

    private Optional<MediaType> cc;

    @Override
    public Optional<MediaType> contentType() {
        var cc = this.cc;
        return cc != null ? cc : (this.cc = ContentHeaders.super.contentType());
    }

    /**
     * Returns a copy of these headers, with the given media type as the only
     * "Content-Type" value.<p>
     *
     * The value is set using its canonical string form, and replaces any
     * previous "Content-Type" header. If a previous header is present, its
     * name and position is retained. Otherwise, the header is added last.
     *
     * @param mediaType to set
     *
     * @return a new {@code DefaultContentHeaders}
     *
     * @throws NullPointerException
     *             if {@code mediaType} is {@code null}
     */
    public DefaultContentHeaders withContentType(MediaTypeValue mediaType) {
        final List<String> value = List.of(mediaType.toString());
        var copy = new LinkedHashMap<String, List<String>>();
        boolean replaced = false;
        for (String k : keys) {
            if (k.equalsIgnoreCase(CONTENT_TYPE)) {
                copy.put(k, value);
                replaced = true;
            } else {
                copy.put(k, lookup.get(k));
            }
        }
        if (!replaced) {
            copy.put(CONTENT_TYPE, value);
        }
        return new DefaultContentHeaders(copy);
    }

    /**
     * Performs the given action for each header, in order.
     *
     * @param action to perform
     *
     * @throws NullPointerException
     *             if {@code action} is {@code null}
     */
    public void forEach(BiConsumer<String, List<String>> action) {
        requireNonNull(action);
        for (String k : keys) {
            action.accept(k, lookup.get(k));
        }
    }

    @Override
    public Iterator<Map.Entry<String, List<String>>> iterator() {
        return new IteratorImpl();
    }

    @Override
    public String toString() {
        return lookup.toString();
    }

    private final class IteratorImpl implements Iterator<Map.Entry<String, List<String>>> {
        private int idx = 0;

        @Override
        public boolean hasNext() {
            return idx < keys.length;
        }

        @Override
        public Map.Entry<String, List<String>> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var k = keys[idx++];
            return Map.entry(k, lookup.get(k));
        }
    }
}
