package org.apipulse.config;

import org.apipulse.config.utils.KeyProvider;
import org.apipulse.config.utils.XmlUtil;
import org.w3c.dom.Document;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigLoader {

    private ConfigLoader() {}

    /**
     * Loads the XML file from disk, falling back to the classpath,
     * fills secrets from the environment and returns a typed XmlConfiguration.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        try (InputStream in = open(xmlPath)) {
            XmlConfiguration cfg = XmlUtil.unmarshal(parse(in), XmlConfiguration.class);
            applyDefaults(cfg);
            applyEnvironmentSecrets(cfg);
            validate(cfg);
            return cfg;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    private static InputStream open(String xmlPath) throws Exception {
        Path path = Path.of(xmlPath);
        if (Files.isRegularFile(path)) {
            return Files.newInputStream(path);
        }
        InputStream cp = ConfigLoader.class.getClassLoader().getResourceAsStream(xmlPath);
        if (cp == null) {
            throw new IllegalStateException("Config file not found on disk or classpath: " + xmlPath);
        }
        return cp;
    }

    private static Document parse(InputStream in) throws Exception {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setNamespaceAware(true);
        return dbf.newDocumentBuilder().parse(in);
    }

    private static void applyDefaults(XmlConfiguration cfg) {
        if (cfg.scheduler == null) cfg.scheduler = new XmlConfiguration.Scheduler();
        if (cfg.execution == null) cfg.execution = new XmlConfiguration.Execution();
        if (cfg.notification == null) cfg.notification = new XmlConfiguration.Notification();
        if (cfg.server != null) {
            if (cfg.server.ioThreads <= 0) cfg.server.ioThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
            if (cfg.server.workerThreads <= 0) cfg.server.workerThreads = cfg.server.ioThreads * 8;
            if (cfg.server.basePath == null) cfg.server.basePath = "";
        }
    }

    private static void applyEnvironmentSecrets(XmlConfiguration cfg) {
        if (cfg.dataSource != null && isBlank(cfg.dataSource.password)) {
            cfg.dataSource.password = KeyProvider.getSecret("APIPULSE_DB_PASSWORD");
        }
        if (cfg.notification.email != null && isBlank(cfg.notification.email.apiKey)) {
            cfg.notification.email.apiKey = KeyProvider.getSecret("APIPULSE_EMAIL_API_KEY");
        }
    }

    private static void validate(XmlConfiguration cfg) {
        if (cfg.server == null) {
            throw new IllegalStateException("Invalid configuration: missing server section.");
        }
        if (usesPostgres(cfg) && (cfg.dataSource == null || cfg.connectionPool == null)) {
            throw new IllegalStateException(
                    "Invalid configuration: store 'postgres' requires dataSource and connectionPool sections.");
        }
        if (cfg.scheduler.workerThreads <= 0 || cfg.scheduler.batchSize <= 0) {
            throw new IllegalStateException("Invalid configuration: scheduler workerThreads and batchSize must be positive.");
        }
        if (cfg.execution.requestTimeoutSeconds <= 0) {
            throw new IllegalStateException("Invalid configuration: execution requestTimeoutSeconds must be positive.");
        }
        if (cfg.scheduler.tickDeadlineSeconds <= 0) {
            throw new IllegalStateException("Invalid configuration: scheduler tickDeadlineSeconds must be positive.");
        }
        // the claiming tick can still be executing until its deadline plus one request timeout
        long longestRun = (long) cfg.scheduler.tickDeadlineSeconds + cfg.execution.requestTimeoutSeconds;
        if (cfg.scheduler.claimLeaseSeconds <= longestRun) {
            throw new IllegalStateException("Invalid configuration: scheduler claimLeaseSeconds ("
                    + cfg.scheduler.claimLeaseSeconds + ") must exceed tickDeadlineSeconds + requestTimeoutSeconds ("
                    + longestRun + ").");
        }
    }

    public static boolean usesPostgres(XmlConfiguration cfg) {
        return cfg.scheduler == null || !"memory".equalsIgnoreCase(cfg.scheduler.store);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
