package alpha.nomagicheaders.testutil;

import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.<p>
 *
 * A logger is identified by the package name of a component; the same name the
 * library code uses when it calls {@code System.getLogger}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging
{
    private Logging() {
        // Empty
    }

    /**
     * Add handler to the logger of the package that the component belongs to.
     *
     * @param component to extract package from
     * @param handler to add
     *
     * @throws NullPointerException
     *             if {@code component} is {@code null}
     *             (should also be the case for {@code handler})
     */
    public static void addHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).addHandler(handler);
    }

    /**
     * Remove handler from the logger of the package that the component belongs to.<p>
     *
     * This method returns silently if the given handler is not found or
     * {@code null}.
     *
     * @param component to extract package from
     * @param handler to remove (may be {@code null})
     *
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).removeHandler(handler);
    }
}
