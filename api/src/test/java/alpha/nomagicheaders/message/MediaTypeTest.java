package alpha.nomagicheaders.message;

import alpha.nomagicheaders.testutil.Logging;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mockito;

import java.util.List;
import java.util.Set;
import java.util.logging.Handler;

import static alpha.nomagicheaders.message.MediaType.ALL;
import static alpha.nomagicheaders.message.MediaType.APPLICATION_JSON;
import static alpha.nomagicheaders.message.MediaType.TEXT_PLAIN;
import static alpha.nomagicheaders.message.MediaType.TEXT_PLAIN_UTF8;
import static alpha.nomagicheaders.message.MediaType.parse;
import static java.util.logging.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;

/**
 * Small tests of {@link MediaType}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class MediaTypeTest
{
    @Nested
    class Parse {
        @Test
        void no_params() {
            var actual = parse("\r\n text/plain  ");
            assertThat(actual.type()).isEqualTo("text");
            assertThat(actual.subtype()).isEqualTo("plain");
            assertThat(actual.mediaType()).isEqualTo("text/plain");
            assertThat(actual.parameters()).isEmpty();
            assertThat(actual.charset()).isEmpty();
            assertThat(actual.quality()).isEmpty();
            assertThat(actual).hasToString("text/plain");
        }

        @Test
        void whitespace_everywhere() {
            var actual = parse("\r\n text   /  plain ;  charset =   utf-8 ");
            assertThat(actual.mediaType()).isEqualTo("text/plain");
            assertThat(actual.charset()).contains("utf-8");
            assertThat(actual).hasToString("text/plain; charset=utf-8");
        }

        @Test
        void two_params() {
            var actual = parse(" text/plain; custom=value;charset=utf-8");
            assertThat(actual.parameters()).containsExactly(
                    Parameter.of("custom", "value"),
                    Parameter.of("charset", "utf-8"));
            assertThat(actual.charset()).contains("utf-8");
            assertThat(actual).hasToString("text/plain; custom=value; charset=utf-8");
        }

        @Test
        void bare_param() {
            var actual = parse(" text/plain; custom");
            assertThat(actual.parameters()).containsExactly(Parameter.of("custom"));
            assertThat(actual.parameters().get(0).value()).isNull();
            assertThat(actual).hasToString("text/plain; custom");
        }

        @Test
        void quoted_value_afterFoldedWhitespace() {
            var actual = parse("text / plain ; custom =\r\n \"x\" ; charset = utf-8 ");
            assertThat(actual.parameters()).containsExactly(
                    Parameter.of("custom", "\"x\""),
                    Parameter.of("charset", "utf-8"));
            assertThat(actual).hasToString("text/plain; custom=\"x\"; charset=utf-8");
        }

        @Test
        void quoted_value_withSeparators() {
            var actual = parse("text/plain; custom=\"a; b, c=d \\\"e\\\"\"");
            var p = actual.parameters().get(0);
            assertThat(p.value()).isEqualTo("\"a; b, c=d \\\"e\\\"\"");
            assertThat(p.unquotedValue()).isEqualTo("a; b, c=d \"e\"");
        }

        @Test
        void trailing_semicolon() {
            assertThat(parse("text/plain;").parameters()).isEmpty();
            assertThat(parse("text/plain; ").parameters()).isEmpty();
            assertThat(parse("text/plain;name=value;").parameters())
                    .containsExactly(Parameter.of("name", "value"));
        }

        @Test
        void empty_value() {
            var actual = parse("text/plain;name=");
            assertThat(actual.parameters()).containsExactly(Parameter.of("name", ""));
            assertThat(actual).hasToString("text/plain; name=");
        }

        @Test
        void casing_retained() {
            var actual = parse("TEXT/Plain; CharSet=UTF-8");
            assertThat(actual.type()).isEqualTo("TEXT");
            assertThat(actual.subtype()).isEqualTo("Plain");
            assertThat(actual.charset()).contains("UTF-8");
            assertThat(actual).hasToString("TEXT/Plain; CharSet=UTF-8");
        }

        @Test
        void quality() {
            assertThat(parse("text/plain; q=0.5").quality()).hasValue(0.5);
            assertThat(parse("text/plain; Q=1").quality()).hasValue(1.0);
            assertThat(parse("text/plain; q=.5").quality()).hasValue(0.5);
            assertThat(parse("text/plain; q=1.").quality()).hasValue(1.0);
            // Range is not validated when parsing
            assertThat(parse("bla/bla;Q=1.5").quality()).hasValue(1.5);
        }

        @Test
        void wildcards() {
            var actual = parse("*/xml; charset=utf-8; q=0.5");
            assertThat(actual.isWildcardType()).isTrue();
            assertThat(actual.isWildcardSubtype()).isFalse();
            assertThat(actual.quality()).hasValue(0.5);
            assertThat(ALL.isWildcardType()).isTrue();
            assertThat(ALL.isWildcardSubtype()).isTrue();
        }

        @Test
        void equals_built() {
            var expected = new MutableMediaType("text/plain");
            expected.setCharset("iso-8859-1");
            expected.setQuality(1.0);
            assertThat(parse("text/plain; charset=iso-8859-1; q=1.0")).isEqualTo(expected);

            var zero = new MutableMediaType("text/plain");
            zero.setCharset("utf-8");
            zero.parameters().add(Parameter.of("foo", "bar"));
            zero.setQuality(0.0);
            assertThat(parse("text/plain; charset=utf-8; foo=bar; q=0.0")).isEqualTo(zero);
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {
            "  ",
            "text/plain会",
            "text/plain ,",
            "text/plain,",
            "text/plain; charset=utf-8 ,",
            "textplain",
            "text/",
            "/plain",
            "text/plain, text/html",
            " , */xml; charset=utf-8; q=0.5 ",
            "text/plain; =value",
            "text/plain; name=\"unterminated",
            "text/plain; name=a b",
            "text/plain; q=high",
            "text/plain; q",
            "text/plain; q=",
            "text/plain; q=-1"})
        void bad(String text) {
            assertThatThrownBy(() -> parse(text))
                    .isExactlyInstanceOf(MediaTypeParseException.class);
            assertThat(MediaType.tryParse(text)).isEmpty();
        }

        @Test
        void bad_message() {
            assertThatThrownBy(() -> parse("text/plain; q=high"))
                    .isExactlyInstanceOf(MediaTypeParseException.class)
                    .hasMessage("Can not parse \"text/plain; q=high\". " +
                                "Non-parsable value for q-parameter. Position: 18.");
            assertThatThrownBy(() -> parse("textplain"))
                    .hasMessage("Can not parse \"textplain\". " +
                                "Expected '/', found end of input. Position: 9.");
            assertThatThrownBy(() -> parse("text/plain ,"))
                    .hasMessage("Can not parse \"text/plain ,\". Expected ';' or end of input, " +
                                "found (hex:0x2C, decimal:44, char:\",\"). Position: 11.");
        }

        @Test
        void tryParse_good() {
            assertThat(MediaType.tryParse("text/plain")).contains(TEXT_PLAIN);
        }

        @Test
        void repeated_charset_warns() {
            Handler h = Mockito.mock(Handler.class);
            Logging.addHandler(MediaType.class, h);
            try {
                var actual = parse("text/plain; charset=a; CHARSET=b");
                assertThat(actual.charset()).contains("a");
                Mockito.verify(h).publish(argThat(r ->
                        r.getLevel().equals(WARNING) &&
                        r.getMessage().equals(
                            "Repeated \"charset\" parameter in " +
                            "\"text/plain; charset=a; CHARSET=b\", " +
                            "only the first occurrence is used.")));
            } finally {
                Logging.removeHandler(MediaType.class, h);
            }
        }

        @Test
        void single_params_doNotWarn() {
            Handler h = Mockito.mock(Handler.class);
            Logging.addHandler(MediaType.class, h);
            try {
                parse("text/plain; charset=utf-8; q=1; x=1; x=2");
                Mockito.verify(h, never()).publish(any());
            } finally {
                Logging.removeHandler(MediaType.class, h);
            }
        }
    }

    @Nested
    class Of {
        @Test
        void good() {
            var actual = MediaType.of("text/plain");
            assertThat(actual).isEqualTo(TEXT_PLAIN);
            assertThat(actual.parameters()).isEmpty();
            assertThat(MediaType.of("application/vnd.api+json").subtype())
                    .isEqualTo("vnd.api+json");
        }

        @Test
        void with_quality() {
            assertThat(MediaType.of("text/plain", 0.563156454))
                    .hasToString("text/plain; q=0.563");
            assertThat(MediaType.of("text/plain", 1)).hasToString("text/plain; q=1.0");
            assertThat(MediaType.of("text/plain", 0)).hasToString("text/plain; q=0.0");
            assertThat(MediaType.of("text/plain", 0.08)).hasToString("text/plain; q=0.08");
            assertThat(MediaType.of("text/plain", 0.5635)).hasToString("text/plain; q=0.564");
        }

        @ParameterizedTest
        @ValueSource(strings = {
            " text/plain ",
            "text / plain",
            "te xt/plain",
            "te=xt/plain",
            "teäxt/plain",
            "text/pläin",
            "text",
            "\"text/plain\"",
            "text/plain;",
            "text/plain;charset=utf-8",
            "text/plain/x",
            "",
            "/"})
        void bad(String mediaType) {
            assertThatThrownBy(() -> MediaType.of(mediaType))
                    .isExactlyInstanceOf(MediaTypeParseException.class);
        }

        @Test
        void bad_quality() {
            assertThatThrownBy(() -> MediaType.of("text/plain", -0.01))
                    .isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Quality must be within [0, 1], got: -0.01");
            assertThatThrownBy(() -> MediaType.of("text/plain", 1.01))
                    .isExactlyInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> MediaType.of("text/plain", Double.NaN))
                    .isExactlyInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void null_arg() {
            assertThatThrownBy(() -> MediaType.of(null))
                    .isExactlyInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class Identity {
        @Test
        void ignores_case() {
            var a = parse("TEXT/plain");
            var b = parse("text/PLAIN");
            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);

            var c = parse("text/plain; charset=utf-8");
            var d = parse("text/plain; CHARSET=UTF-8");
            assertThat(c).isEqualTo(d).hasSameHashCodeAs(d);
        }

        @Test
        void ignores_param_order() {
            var a = parse("text/plain; a=1; b=2");
            var b = parse("text/plain;b=2;a=1");
            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        }

        @Test
        void not_equal() {
            assertThat(parse("text/plain")).isNotEqualTo(parse("text/html"));
            assertThat(parse("text/plain")).isNotEqualTo(parse("application/plain"));
            assertThat(parse("text/plain")).isNotEqualTo(TEXT_PLAIN_UTF8);
            assertThat(parse("text/plain; a=1")).isNotEqualTo(parse("text/plain; a=2"));
            assertThat(parse("text/plain; a")).isNotEqualTo(parse("text/plain; a="));
            assertThat(parse("text/plain; a=1; a=1")).isNotEqualTo(parse("text/plain; a=1"));
            assertThat(parse("text/plain; a=1; b=2")).isNotEqualTo(parse("text/plain; a=1; a=1"));
            assertThat(TEXT_PLAIN).isNotEqualTo("text/plain");
        }

        @Test
        void duplicates_sameHashAsEqual() {
            var a = parse("text/plain; a=1; a=1; b=2");
            var b = parse("text/plain; b=2; a=1; A=1");
            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        }

        @Test
        void hashSet() {
            Set<MediaTypeValue> set = Set.of(parse("text/plain"), parse("application/json; charset=utf-8"));
            assertThat(set).contains(MediaType.of("TEXT/PLAIN"));
            assertThat(set).contains(new MutableMediaType("text/plain"));
            assertThat(set).doesNotContain(APPLICATION_JSON);
        }

        @Test
        void toString_roundTrip() {
            var expected = parse(" text/plain ;charset = \"utf-8\";  custom ; x=");
            assertThat(expected).hasToString("text/plain; charset=\"utf-8\"; custom; x=");
            assertThat(parse(expected.toString())).isEqualTo(expected);
        }
    }

    @Nested
    class ReadOnly {
        @Test
        void parameters_unmodifiable() {
            List<Parameter> params = TEXT_PLAIN_UTF8.parameters();
            assertThatThrownBy(() -> params.add(Parameter.of("a")))
                    .isExactlyInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> params.remove(0))
                    .isExactlyInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(params::clear)
                    .isExactlyInstanceOf(UnsupportedOperationException.class);
            assertThat(TEXT_PLAIN_UTF8.isReadOnly()).isTrue();
        }

        @Test
        void copy_isMutable() {
            MutableMediaType copy = TEXT_PLAIN_UTF8.copy();
            assertThat(copy.isReadOnly()).isFalse();
            assertThat(copy).isEqualTo(TEXT_PLAIN_UTF8);
            copy.setCharset("utf-16");
            assertThat(copy.charset()).contains("utf-16");
            assertThat(TEXT_PLAIN_UTF8.charset()).contains("utf-8");
        }

        @Test
        void copyAsReadOnly_isNewInstance() {
            MediaType copy = TEXT_PLAIN_UTF8.copyAsReadOnly();
            assertThat(copy).isNotSameAs(TEXT_PLAIN_UTF8).isEqualTo(TEXT_PLAIN_UTF8);
            assertThat(copy.isReadOnly()).isTrue();
        }

        @Test
        void quality_malformedStoredValue() {
            var mt = new MutableMediaType("text/plain");
            mt.parameters().add(Parameter.of("q", "high"));
            var frozen = mt.copyAsReadOnly();
            assertThatThrownBy(frozen::quality)
                    .isExactlyInstanceOf(NumberFormatException.class);
        }
    }
}
