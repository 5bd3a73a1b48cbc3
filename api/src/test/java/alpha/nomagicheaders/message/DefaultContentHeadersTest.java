package alpha.nomagicheaders.message;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static alpha.nomagicheaders.HttpConstants.HeaderName.ACCEPT;
import static alpha.nomagicheaders.HttpConstants.HeaderName.CONTENT_TYPE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link DefaultContentHeaders}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class DefaultContentHeadersTest
{
    @Test
    void contentType() {
        var testee = of("content-type", "text/plain; charset=utf-8");
        assertThat(testee.contentType()).contains(MediaType.TEXT_PLAIN_UTF8);
        assertThat(testee.contentType().flatMap(MediaType::charset)).contains("utf-8");
        // Cached
        assertThat(testee.contentType().get()).isSameAs(testee.contentType().get());
    }

    @Test
    void contentType_absent() {
        assertThat(DefaultContentHeaders.empty().contentType()).isEmpty();
        assertThat(of(CONTENT_TYPE, "").contentType()).isEmpty();
    }

    @Test
    void contentType_repeated() {
        var entries = new LinkedHashMap<String, List<String>>();
        entries.put(CONTENT_TYPE, List.of("text/plain", "text/html"));
        assertThatThrownBy(() -> new DefaultContentHeaders(entries).contentType())
                .isExactlyInstanceOf(BadHeaderException.class)
                .hasMessage("Multiple Content-Type values.")
                .hasNoCause();
    }

    @Test
    void contentType_malformed() {
        assertThatThrownBy(() -> of(CONTENT_TYPE, "text/").contentType())
                .isExactlyInstanceOf(BadHeaderException.class)
                .hasMessage("Failed to parse Content-Type header.")
                .hasCauseExactlyInstanceOf(MediaTypeParseException.class);
    }

    @Test
    void accept() {
        var entries = new LinkedHashMap<String, List<String>>();
        entries.put("ACCEPT", List.of("text/html, application/xhtml+xml", "*/*; q=0.8"));
        var testee = new DefaultContentHeaders(entries);
        assertThat(testee.accept()).containsExactly(
                MediaType.TEXT_HTML,
                MediaType.parse("application/xhtml+xml"),
                MediaType.of("*/*", 0.8));
        assertThat(DefaultContentHeaders.empty().accept()).isEmpty();
    }

    @Test
    void accept_malformed() {
        assertThatThrownBy(() -> of(ACCEPT, "text/html, text").accept())
                .isExactlyInstanceOf(BadHeaderException.class)
                .hasMessage("Failed to parse Accept header.")
                .hasCauseExactlyInstanceOf(MediaTypeParseException.class);
    }

    @Test
    void withContentType_replaces() {
        var entries = new LinkedHashMap<String, List<String>>();
        entries.put("Accept", List.of("*/*"));
        entries.put("content-type", List.of("text/plain"));
        entries.put("X-Custom", List.of("1"));
        var mt = new MutableMediaType("application/json");
        mt.setCharset("utf-8");

        var testee = new DefaultContentHeaders(entries).withContentType(mt);

        var names = new ArrayList<String>();
        for (Map.Entry<String, List<String>> e : testee) {
            names.add(e.getKey());
        }
        assertThat(names).containsExactly("Accept", "content-type", "X-Custom");
        assertThat(testee.allValues(CONTENT_TYPE)).containsExactly("application/json; charset=utf-8");
        assertThat(testee.contentType()).contains(MediaType.APPLICATION_JSON_UTF8);
    }

    @Test
    void withContentType_adds() {
        var testee = DefaultContentHeaders.empty().withContentType(MediaType.TEXT_HTML);
        assertThat(testee.allValues("Content-Type")).containsExactly("text/html");
        assertThat(DefaultContentHeaders.empty().allValues(CONTENT_TYPE)).isEmpty();
    }

    @Test
    void forEach_order() {
        var entries = new LinkedHashMap<String, List<String>>();
        entries.put("b", List.of("1"));
        entries.put("a", List.of("2", "3"));
        var seen = new LinkedHashMap<String, List<String>>();
        new DefaultContentHeaders(entries).forEach((k, v) -> seen.put(k, v));
        assertThat(seen).isEqualTo(entries);
    }

    @Test
    void headerName_whitespace() {
        assertThatThrownBy(() -> DefaultContentHeaders.empty().allValues(" Accept"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> of("Accept ", "text/plain"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void headerName_repeatedWithDifferentCasing() {
        var entries = new LinkedHashMap<String, List<String>>();
        entries.put("Accept", List.of("a/b"));
        entries.put("accept", List.of("c/d"));
        assertThatThrownBy(() -> new DefaultContentHeaders(entries))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Header name repeated with different casing: accept");
    }

    private static DefaultContentHeaders of(String name, String value) {
        var entries = new LinkedHashMap<String, List<String>>();
        entries.put(name, List.of(value));
        return new DefaultContentHeaders(entries);
    }
}
