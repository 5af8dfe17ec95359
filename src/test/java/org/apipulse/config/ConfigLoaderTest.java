package org.apipulse.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    void loadsTestConfigurationFromClasspath() {
        XmlConfiguration cfg = ConfigLoader.loadConfig("test-config.xml");

        assertThat(cfg.server.port).isZero();
        assertThat(cfg.server.basePath).isEqualTo("/api/v1");
        assertThat(cfg.server.ioThreads).isGreaterThanOrEqualTo(2);
        assertThat(cfg.server.workerThreads).isEqualTo(cfg.server.ioThreads * 8);

        assertThat(cfg.scheduler.enabled).isFalse();
        assertThat(cfg.scheduler.batchSize).isEqualTo(25);
        assertThat(cfg.scheduler.claimLeaseSeconds).isEqualTo(120);
        assertThat(cfg.scheduler.timeZone).isEqualTo("Europe/Berlin");
        assertThat(ConfigLoader.usesPostgres(cfg)).isFalse();

        assertThat(cfg.execution.followRedirects).isFalse();
        assertThat(cfg.execution.redactedHeaders).isEqualTo("Set-Cookie, X-Api-Key");

        assertThat(cfg.notification.workerThreads).isEqualTo(2);
        assertThat(cfg.notification.email.apiKey).isEqualTo("test-key");
        assertThat(cfg.notification.email.fromName).isEqualTo("API Pulse");
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> ConfigLoader.loadConfig("does-not-exist.xml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does-not-exist.xml");
    }

    private static String write(Path dir, int deadline, int lease, int requestTimeout) throws IOException {
        Path file = dir.resolve("scheduler-config.xml");
        Files.writeString(file, """
                <configuration>
                    <server><host>127.0.0.1</host><port>0</port></server>
                    <scheduler>
                        <store>memory</store>
                        <tickDeadlineSeconds>%d</tickDeadlineSeconds>
                        <claimLeaseSeconds>%d</claimLeaseSeconds>
                    </scheduler>
                    <execution><requestTimeoutSeconds>%d</requestTimeoutSeconds></execution>
                </configuration>
                """.formatted(deadline, lease, requestTimeout));
        return file.toString();
    }

    @Test
    void leaseMustOutlastDeadlinePlusRequestTimeout(@TempDir Path dir) throws IOException {
        String path = write(dir, 50, 80, 30);

        assertThatThrownBy(() -> ConfigLoader.loadConfig(path))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("claimLeaseSeconds (80)")
                .hasMessageContaining("must exceed");
    }

    @Test
    void nonPositiveDeadlineIsRejected(@TempDir Path dir) throws IOException {
        String path = write(dir, 0, 300, 30);

        assertThatThrownBy(() -> ConfigLoader.loadConfig(path))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tickDeadlineSeconds must be positive");
    }

    @Test
    void leaseJustAboveLongestRunIsAccepted(@TempDir Path dir) throws IOException {
        XmlConfiguration cfg = ConfigLoader.loadConfig(write(dir, 50, 81, 30));

        assertThat(cfg.scheduler.claimLeaseSeconds).isEqualTo(81);
    }
}
