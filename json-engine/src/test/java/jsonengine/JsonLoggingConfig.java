package jsonengine;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.BeforeAll;

/**
 * Base class for tests: applies {@code -Djava.util.logging.ConsoleHandler.level=FINE} (or any other level) to the
 * {@code jsonengine} loggers and the console handler, so loader diagnostics show up in test output.
 *
 * @author Freeman
 * @since 0.1.0
 */
abstract class JsonLoggingConfig {

    static final String LEVEL_PROPERTY = "java.util.logging.ConsoleHandler.level";

    // strong reference, JUL only keeps loggers weakly
    private static final Logger PACKAGE_LOGGER = Logger.getLogger("jsonengine");

    @BeforeAll
    static void configureLogging() {
        var level = requestedLevel();
        PACKAGE_LOGGER.setLevel(level);
        for (var handler : Logger.getLogger("").getHandlers()) {
            if (handler.getLevel().intValue() > level.intValue()) handler.setLevel(level);
        }
    }

    static Level requestedLevel() {
        var property = System.getProperty(LEVEL_PROPERTY);
        if (property == null || property.isBlank()) return Level.INFO;
        try {
            return Level.parse(property.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            PACKAGE_LOGGER.warning(() -> "Ignoring unknown " + LEVEL_PROPERTY + ": " + property);
            return Level.INFO;
        }
    }
}
