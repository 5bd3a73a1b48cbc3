package alpha.nomagicheaders.message;

import java.io.Serial;

import static java.text.MessageFormat.format;

/**
 * Thrown by {@link MediaType#parse(String)} if a {@code String} can not be
 * parsed into a {@code MediaType}.<p>
 *
 * Also thrown when a media type, a subtype or a parameter is constructed or
 * modified using a value that is not well-formed.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 *
 * @see MediaType#parse(String)
 */
public final class MediaTypeParseException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    private static final String TEMPLATE = "Can not parse \"{0}\". {1}";

    private final String text;
    private final int pos;

    MediaTypeParseException(CharSequence parseText, String appendingMessage) {
        this(parseText, appendingMessage, -1, null);
    }

    MediaTypeParseException(CharSequence parseText, String appendingMessage, int pos) {
        this(parseText, appendingMessage, pos, null);
    }

    MediaTypeParseException(
            CharSequence parseText, String appendingMessage, int pos, Throwable cause)
    {
        super(format(TEMPLATE, String.valueOf(parseText), appendingMessage), cause);
        this.text = parseText == null ? null : parseText.toString();
        this.pos  = pos;
    }

    /**
     * Returns the text that failed to parse.
     *
     * @return the text that failed to parse (may be {@code null})
     */
    public String text() {
        return text;
    }

    /**
     * Returns the char position at which the error was detected.
     *
     * @return the char position, or -1 if not applicable
     */
    public int position() {
        return pos;
    }
}
