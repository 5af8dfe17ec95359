package org.apipulse.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.JAXBException;
import jakarta.xml.bind.Unmarshaller;
import jakarta.xml.bind.ValidationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class XmlUtil {

    private static final Logger logger = LoggerFactory.getLogger(XmlUtil.class);
    private static final Map<Class<?>, JAXBContext> CONTEXTS = new ConcurrentHashMap<>();

    private XmlUtil() {}

    /**
     * Binds a parsed document to {@code type}. Unknown or malformed elements are logged
     * with their line so configuration typos show up at startup; fatal errors abort.
     */
    public static <T> T unmarshal(Document xmlDoc, Class<T> type) throws JAXBException {
        Unmarshaller um = context(type).createUnmarshaller();
        um.setEventHandler(event -> {
            int line = event.getLocator() == null ? -1 : event.getLocator().getLineNumber();
            logger.warn("Config {} at line {}: {}", severity(event), line, event.getMessage());
            return event.getSeverity() != ValidationEvent.FATAL_ERROR;
        });
        return um.unmarshal(xmlDoc, type).getValue();
    }

    private static JAXBContext context(Class<?> type) throws JAXBException {
        JAXBContext ctx = CONTEXTS.get(type);
        if (ctx == null) {
            ctx = JAXBContext.newInstance(type);
            CONTEXTS.put(type, ctx);
        }
        return ctx;
    }

    private static String severity(ValidationEvent event) {
        return switch (event.getSeverity()) {
            case ValidationEvent.WARNING -> "warning";
            case ValidationEvent.ERROR -> "error";
            default -> "fatal error";
        };
    }
}
