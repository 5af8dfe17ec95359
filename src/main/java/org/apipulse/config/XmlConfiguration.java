package org.apipulse.config;

import jakarta.xml.bind.annotation.XmlRootElement;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public DataSource dataSource;
    public ConnectionPool connectionPool;
    public Scheduler scheduler;
    public Execution execution;
    public Notification notification;

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host;
        public int port;
        public int ioThreads;
        public int workerThreads;
        public String basePath;
        public String allowedOrigins;
    }

    // --- Data Source ---
    @XmlRootElement(name = "dataSource")
    public static class DataSource {
        public String driverClassName;
        public String jdbcUrl;
        public String username;
        public String password;
        public String sslMode;
    }

    // --- HikariCP Connection Pool ---
    @XmlRootElement(name = "connectionPool")
    public static class ConnectionPool {
        public int maximumPoolSize;
        public int minimumIdle;
        public long idleTimeout;
        public long connectionTimeout;
        public long maxLifetime;
    }

    // --- Scheduler Loop ---
    @XmlRootElement(name = "scheduler")
    public static class Scheduler {
        public boolean enabled = true;
        public int tickIntervalSeconds = 60;
        public int workerThreads = 8;
        public int batchSize = 100;
        public int tickDeadlineSeconds = 50;
        public int claimLeaseSeconds = 300;
        public String timeZone = "UTC";
        public String store = "postgres";
    }

    // --- Outbound task requests ---
    @XmlRootElement(name = "execution")
    public static class Execution {
        public int requestTimeoutSeconds = 30;
        public int connectTimeoutSeconds = 10;
        public boolean followRedirects = true;
        public String redactedHeaders = "set-cookie,authorization,proxy-authorization";
    }

    @XmlRootElement(name = "notification")
    public static class Notification {
        public boolean enabled = true;
        public int workerThreads = 8;
        public int requestTimeoutSeconds = 10;
        public Email email;

        @XmlRootElement(name = "email")
        public static class Email {
            public String apiUrl;
            public String apiKey;
            public String fromAddress;
            public String fromName;
        }
    }
}
