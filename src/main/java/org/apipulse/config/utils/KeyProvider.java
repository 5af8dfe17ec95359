package org.apipulse.config.utils;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * KeyProvider acts as the environment bootstrap.
 *
 * Responsibilities:
 *  1. Loads environment variables (.env or system)
 *  2. Initializes the Logback config for the active environment (dev/prod)
 *  3. Resolves secrets that are kept out of config.xml
 */
public class KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(KeyProvider.class);

    private static final String ENV_ENVIRONMENT = "APP_ENV";
    private static boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;

    private KeyProvider() {}

    private static synchronized void init() {
        if (initialized) return;

        try {
            dotenv = Dotenv.configure().ignoreIfMissing().load();

            String env = System.getenv(ENV_ENVIRONMENT);
            if (env == null || env.isBlank()) {
                env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
            }
            activeEnv = env.toUpperCase();
            System.setProperty(ENV_ENVIRONMENT, activeEnv);

            if ("DEVELOPMENT".equalsIgnoreCase(activeEnv)) {
                loadLogbackFromClasspath("logback-dev.xml");
                logger.info("Environment set to DEVELOPMENT, using logback-dev.xml");
            } else {
                loadLogbackFromClasspath("logback.xml");
                logger.info("Environment set to PRODUCTION, using logback.xml");
            }

            initialized = true;
        } catch (Exception e) {
            logger.error("Failed to initialize KeyProvider environment: {}", e.getMessage(), e);
            throw new IllegalStateException("Environment initialization failed.", e);
        }
    }

    /**
     * Resolves a secret from the process environment first, then from .env.
     * Returns null when neither defines it.
     */
    public static String getSecret(String name) {
        if (!initialized) init();

        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            value = dotenv.get(name);
        }
        if (value == null || value.isBlank()) {
            logger.warn("Secret {} not found in environment or .env", name);
            return null;
        }
        logger.debug("Secret {} resolved ({} chars).", name, value.length());
        return value.trim();
    }

    public static boolean isDev() {
        if (!initialized) init();
        return "DEVELOPMENT".equalsIgnoreCase(activeEnv);
    }

    public static String getEnvironment() {
        if (!initialized) init();
        return activeEnv;
    }

    private static void loadLogbackFromClasspath(String resourceName) {
        try (InputStream in = KeyProvider.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                logger.warn("Logback config {} not found on classpath, keeping defaults", resourceName);
                return;
            }
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(in);
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        } catch (Exception e) {
            System.err.println("Failed to load logback config: " + resourceName + " (" + e.getMessage() + ")");
        }
    }
}
