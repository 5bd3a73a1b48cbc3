package alpha.nomagicheaders.message;

import java.io.Serial;

/**
 * Thrown by {@link ContentHeaders} if interpreting a header value fails.<p>
 *
 * If the failure was caused by a malformed media type, then the cause is a
 * {@link MediaTypeParseException}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class BadHeaderException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code BadHeaderException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public BadHeaderException(String message) {
        super(message);
    }

    /**
     * Constructs a {@code BadHeaderException}.
     *
     * @param message  passed as-is to {@link Throwable#Throwable(String)}
     * @param cause    passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public BadHeaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
