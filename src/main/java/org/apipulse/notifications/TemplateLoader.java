package org.apipulse.notifications;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads Mustache templates from {@code templates/} on the classpath and renders them.
 * Compiled templates are cached per key. Variables rendered with {@code {{name}}} are HTML-escaped.
 */
public class TemplateLoader {

    private static final Logger logger = LoggerFactory.getLogger(TemplateLoader.class);

    private final MustacheFactory factory = new DefaultMustacheFactory();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    public String render(String key, Map<String, Object> data) {
        Mustache mustache = compiled.computeIfAbsent(key, this::compile);
        StringWriter writer = new StringWriter();
        try {
            mustache.execute(writer, data).flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render template " + key, e);
        }
        return writer.toString();
    }

    private Mustache compile(String key) {
        String path = "templates/" + key;
        InputStream in = getClass().getClassLoader().getResourceAsStream(path);
        if (in == null) {
            throw new IllegalStateException("Template not found on classpath: " + path);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            logger.debug("[TemplateLoader] Compiling classpath template {}", path);
            return factory.compile(reader, key);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template " + path, e);
        }
    }
}
