package org.apipulse.notifications.format;

import org.apipulse.TestFixtures;
import org.apipulse.model.HttpMethod;
import org.apipulse.model.Task;
import org.apipulse.notifications.TemplateLoader;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EmailFormatterTest {

    private final EmailFormatter formatter = new EmailFormatter(new TemplateLoader());
    private final Task task = TestFixtures.task("https://api.example.com/orders");

    @Test
    void failureEmailShowsErrorAndSubject() {
        EmailContent email = formatter.format("ops@example.com", task,
                TestFixtures.log(task, null, "Request timed out"), false);

        assertThat(email.to()).isEqualTo("ops@example.com");
        assertThat(email.subject()).isEqualTo("❌ API Task Failed: Orders API");
        assertThat(email.html())
                .contains("Orders API")
                .contains("N/A")
                .contains("Request timed out")
                .contains("This is an automated notification from API Pulse.");
    }

    @Test
    void successEmailOmitsErrorSection() {
        EmailContent email = formatter.format("ops@example.com", task, TestFixtures.log(task, 200, null), false);

        assertThat(email.subject()).startsWith("✅");
        assertThat(email.html()).contains("245ms").doesNotContain("Request timed out");
    }

    @Test
    void userSuppliedValuesAreHtmlEscaped() {
        Task hostile = new Task(UUID.randomUUID(), TestFixtures.OWNER, "<script>alert(1)</script>",
                "https://a.example.com", HttpMethod.GET, Map.of(), null, "5m", true, true, null, TestFixtures.NOW);

        EmailContent email = formatter.format("ops@example.com", hostile,
                TestFixtures.logWithBody(hostile, 500, "<b>bold</b>"), true);

        assertThat(email.html())
                .doesNotContain("<script>")
                .contains("&lt;script&gt;")
                .contains("&lt;b&gt;bold");
    }
}
