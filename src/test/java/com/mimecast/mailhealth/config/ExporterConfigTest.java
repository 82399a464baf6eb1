package com.mimecast.mailhealth.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExporterConfigTest {

    @TempDir
    Path secrets;

    private Map<String, String> env() {
        Map<String, String> env = new HashMap<>();
        env.put("SECRETS_DIR", secrets.toString());
        env.put("INTERNAL_SMTP_SERVER", "smtp.internal.example.com");
        env.put("INTERNAL_IMAP_SERVER", "imap.internal.example.com");
        env.put("INTERNAL_EMAIL_ADDRESS", "monitor@internal.example.com");
        env.put("INTERNAL_EMAIL_PASSWORD", "internal-secret");
        env.put("EXTERNAL_SMTP_SERVER", "smtp.external.example.net");
        env.put("EXTERNAL_IMAP_SERVER", "imap.external.example.net");
        env.put("EXTERNAL_EMAIL_ADDRESS", "monitor@external.example.net");
        env.put("EXTERNAL_EMAIL_PASSWORD", "external-secret");
        env.put("SPAM_SCORE_TEST_EMAIL_ADDRESS", "test-abc123@srv1.mail-tester.com");
        env.put("SPAM_SCORE_TEST_URL", "https://www.mail-tester.com/test-abc123");
        return env;
    }

    @Test
    void testDefaults() throws ConfigurationException {
        ExporterConfig config = new ExporterConfig(env());
        config.validate();

        assertEquals(Duration.ofSeconds(300), config.getCheckInterval());
        assertEquals(Duration.ofSeconds(60), config.getTimeout());
        assertEquals(Duration.ofSeconds(10), config.getPollInterval());
        assertEquals(Duration.ofSeconds(300), config.getSpamScoreCheckInterval());
        assertEquals(Duration.ofHours(8), config.getSpamScoreMinInterval());
        assertEquals(Duration.ofSeconds(30), config.getSpamScoreFetchTimeout());
        assertEquals(Duration.ofSeconds(20), config.getMailIoTimeout());
        assertEquals(9091, config.getHttpPort());
        assertNull(config.getStatusHtmlFile());
        assertNull(config.getHttpAuthUsername());

        MailAccountConfig internal = config.getInternal();
        assertEquals("monitor@internal.example.com", internal.getAddress());
        assertEquals(465, internal.getSmtpPort());
        assertTrue(internal.isSmtpTls());
        assertEquals(993, internal.getImapPort());
        assertTrue(internal.isImapSsl());
        assertEquals("internal-secret", internal.getPassword());
        assertEquals("external-secret", config.getExternal().getPassword());
    }

    @Test
    void testOverrides() throws ConfigurationException {
        Map<String, String> env = env();
        env.put("CHECK_INTERVAL_SECONDS", "120");
        env.put("TIMEOUT_SECONDS", " 90 ");
        env.put("HTTP_PORT", "8080");
        env.put("EXTERNAL_SMTP_PORT", "587");
        env.put("EXTERNAL_SMTP_USE_TLS", "no");
        env.put("EXTERNAL_IMAP_USE_SSL", "0");
        env.put("INTERNAL_IMAP_USE_SSL", "YES");

        ExporterConfig config = new ExporterConfig(env);
        config.validate();

        assertEquals(Duration.ofSeconds(120), config.getCheckInterval());
        assertEquals(Duration.ofSeconds(90), config.getTimeout());
        assertEquals(8080, config.getHttpPort());
        assertEquals(587, config.getExternal().getSmtpPort());
        assertFalse(config.getExternal().isSmtpTls());
        assertFalse(config.getExternal().isImapSsl());
        assertTrue(config.getInternal().isImapSsl());
    }

    @Test
    void testSecretFileTakesPrecedence() throws IOException {
        Files.writeString(secrets.resolve("internal_email_password"), "from-file\n");

        ExporterConfig config = new ExporterConfig(env());

        assertEquals("from-file", config.getInternal().getPassword());
        assertEquals("external-secret", config.getExternal().getPassword());
    }

    @Test
    void testMissingRequiredKeys() {
        Map<String, String> env = env();
        env.remove("INTERNAL_SMTP_SERVER");
        env.remove("EXTERNAL_EMAIL_PASSWORD");
        env.put("SPAM_SCORE_TEST_URL", "   ");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ExporterConfig(env).validate());

        String explanation = e.getExplanation();
        assertTrue(explanation.contains("Missing INTERNAL_SMTP_SERVER"), explanation);
        assertTrue(explanation.contains("EXTERNAL_EMAIL_PASSWORD"), explanation);
        assertTrue(explanation.contains("Missing SPAM_SCORE_TEST_URL"), explanation);
        assertFalse(explanation.contains("external-secret"));
    }

    @Test
    void testInvalidNumbers() {
        Map<String, String> env = env();
        env.put("CHECK_INTERVAL_SECONDS", "five");
        env.put("TIMEOUT_SECONDS", "0");
        env.put("HTTP_PORT", "70000");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ExporterConfig(env).validate());

        String explanation = e.getExplanation();
        assertTrue(explanation.contains("CHECK_INTERVAL_SECONDS must be an integer"), explanation);
        assertTrue(explanation.contains("TIMEOUT_SECONDS must be positive"), explanation);
        assertTrue(explanation.contains("HTTP_PORT must be between 1 and 65535"), explanation);
    }

    @Test
    void testHalfConfiguredAuth() {
        Map<String, String> env = env();
        env.put("HTTP_AUTH_USERNAME", "prometheus");

        assertThrows(ConfigurationException.class, () -> new ExporterConfig(env).validate());
    }
}
