package org.apipulse.notifications.format;

public record EmailContent(String to, String subject, String html) {
}
