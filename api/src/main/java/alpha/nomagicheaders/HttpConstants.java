package alpha.nomagicheaders;

import alpha.nomagicheaders.message.MediaType;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * For values to use in a {@link HeaderName#CONTENT_TYPE Content-Type} header,
 * see {@link MediaType}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants
{
    private HttpConstants() {
        // Empty
    }

    /**
     * Header names with a value that is, or holds, media types.<p>
     *
     * Header names are case-insensitive.
     *
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-5.1">RFC 9110 §5.1</a>
     */
    public static final class HeaderName
    {
        private HeaderName() {
            // Private
        }

        /**
         * Used by client when driving content negotiation.<p>
         *
         * Specifies what media type(s) the client accepts in response, and
         * possibly, an ordered preference.<p>
         *
         * Example: {@code Accept: text/html, application/xml;q=0.9, *}{@code /*;q=0.8}<p>
         *
         * The header may be repeated, and each value may hold a
         * comma-separated list of media ranges.
         *
         * @see MediaType#parseList(String...)
         * @see <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-12.5.1">RFC 9110 §12.5.1</a>
         */
        public static final String ACCEPT = "Accept";

        /**
         * Specifies the media type of the message body.<p>
         *
         * Example: {@code Content-Type: text/html; charset=utf-8}<p>
         *
         * If a body is present, but no media type has been specified, then the
         * default is binary; "application/octet-stream".
         *
         * @see MediaType#parse(String)
         * @see <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-8.3">RFC 9110 §8.3</a>
         */
        public static final String CONTENT_TYPE = "Content-Type";
    }
}
