package com.mimecast.mailhealth.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exporter configuration.
 *
 * <p>Type safe access to the environment driven configuration.
 * <br>Getters apply defaults; {@link #validate()} must pass before any of them is relied upon.
 */
public class ExporterConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(ExporterConfig.class);

    private final MailAccountConfig internal;
    private final MailAccountConfig external;

    /**
     * Constructs a new ExporterConfig instance.
     * <p>Passwords are resolved through a {@link SecretReader} on the configured secrets directory.
     *
     * @param env Environment map.
     */
    public ExporterConfig(Map<String, String> env) {
        super(env);
        SecretReader secrets = new SecretReader(Path.of(getStringProperty("SECRETS_DIR", SecretReader.DEFAULT_SECRETS_DIR)), env);
        this.internal = new MailAccountConfig(env, "INTERNAL_", secrets.read("internal_email_password").orElse(null));
        this.external = new MailAccountConfig(env, "EXTERNAL_", secrets.read("external_email_password").orElse(null));
    }

    /**
     * Validates the configuration.
     *
     * @throws ConfigurationException Listing every missing or invalid key.
     */
    public void validate() throws ConfigurationException {
        List<String> errors = new ArrayList<>();

        for (MailAccountConfig account : List.of(internal, external)) {
            String prefix = account.getPrefix();
            requireString(errors, prefix + "SMTP_SERVER");
            requireString(errors, prefix + "IMAP_SERVER");
            requireString(errors, prefix + "EMAIL_ADDRESS");
            if (account.getPassword() == null) {
                errors.add("Missing password: secret " + prefix.toLowerCase() + "email_password or " + prefix + "EMAIL_PASSWORD");
            }
            checkPort(errors, prefix + "SMTP_PORT", account::getSmtpPort);
            checkPort(errors, prefix + "IMAP_PORT", account::getImapPort);
        }

        requireString(errors, "SPAM_SCORE_TEST_EMAIL_ADDRESS");
        requireString(errors, "SPAM_SCORE_TEST_URL");

        checkPort(errors, "HTTP_PORT", this::getHttpPort);
        for (String key : List.of("CHECK_INTERVAL_SECONDS", "TIMEOUT_SECONDS", "POLL_INTERVAL_SECONDS",
                "SPAM_SCORE_CHECK_INTERVAL_SECONDS", "SPAM_SCORE_MIN_INTERVAL_SECONDS",
                "SPAM_SCORE_FETCH_TIMEOUT_SECONDS", "MAIL_IO_TIMEOUT_SECONDS")) {
            try {
                getSeconds(key, 1L);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (hasProperty("HTTP_AUTH_USERNAME") != hasProperty("HTTP_AUTH_PASSWORD")) {
            errors.add("HTTP_AUTH_USERNAME and HTTP_AUTH_PASSWORD must be set together");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }

        log.info("Configuration valid: internal={}, external={}, checkIntervalSeconds={}, timeoutSeconds={}",
                internal, external, getCheckInterval().toSeconds(), getTimeout().toSeconds());
    }

    private void requireString(List<String> errors, String key) {
        if (!hasProperty(key)) {
            errors.add("Missing " + key);
        }
    }

    private void checkPort(List<String> errors, String key, PortGetter getter) {
        try {
            int port = getter.get();
            if (port < 1 || port > 65535) {
                errors.add(key + " must be between 1 and 65535, got: " + port);
            }
        } catch (IllegalArgumentException | ArithmeticException e) {
            errors.add(key + " is invalid: " + e.getMessage());
        }
    }

    @FunctionalInterface
    private interface PortGetter {
        int get();
    }

    /**
     * Gets a positive duration in seconds.
     *
     * @param key            Property key.
     * @param defaultSeconds Default seconds.
     * @return Duration.
     * @throws IllegalArgumentException Value present but not a positive integer.
     */
    Duration getSeconds(String key, long defaultSeconds) {
        long seconds = getLongProperty(key, defaultSeconds);
        if (seconds <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got: " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    /**
     * Gets internal account configuration.
     *
     * @return MailAccountConfig instance.
     */
    public MailAccountConfig getInternal() {
        return internal;
    }

    /**
     * Gets external account configuration.
     *
     * @return MailAccountConfig instance.
     */
    public MailAccountConfig getExternal() {
        return external;
    }

    /**
     * Gets spam score test address.
     *
     * @return Address string.
     */
    public String getSpamScoreTestAddress() {
        return getStringProperty("SPAM_SCORE_TEST_EMAIL_ADDRESS");
    }

    /**
     * Gets spam score result page URL.
     *
     * @return URL string.
     */
    public String getSpamScoreTestUrl() {
        return getStringProperty("SPAM_SCORE_TEST_URL");
    }

    /**
     * Gets round trip check interval.
     *
     * @return Duration.
     */
    public Duration getCheckInterval() {
        return getSeconds("CHECK_INTERVAL_SECONDS", 300L);
    }

    /**
     * Gets receive and score poll timeout.
     *
     * @return Duration.
     */
    public Duration getTimeout() {
        return getSeconds("TIMEOUT_SECONDS", 60L);
    }

    /**
     * Gets poll interval.
     *
     * @return Duration.
     */
    public Duration getPollInterval() {
        return getSeconds("POLL_INTERVAL_SECONDS", 10L);
    }

    /**
     * Gets spam score check interval.
     *
     * @return Duration.
     */
    public Duration getSpamScoreCheckInterval() {
        return getSeconds("SPAM_SCORE_CHECK_INTERVAL_SECONDS", 300L);
    }

    /**
     * Gets minimum time between two spam score attempts.
     *
     * @return Duration.
     */
    public Duration getSpamScoreMinInterval() {
        return getSeconds("SPAM_SCORE_MIN_INTERVAL_SECONDS", 28800L);
    }

    /**
     * Gets score page fetch timeout.
     *
     * @return Duration.
     */
    public Duration getSpamScoreFetchTimeout() {
        return getSeconds("SPAM_SCORE_FETCH_TIMEOUT_SECONDS", 30L);
    }

    /**
     * Gets SMTP and IMAP socket timeout.
     *
     * @return Duration.
     */
    public Duration getMailIoTimeout() {
        return getSeconds("MAIL_IO_TIMEOUT_SECONDS", 20L);
    }

    /**
     * Gets HTTP port.
     *
     * @return Port number.
     */
    public int getHttpPort() {
        return Math.toIntExact(getLongProperty("HTTP_PORT", 9091L));
    }

    /**
     * Gets status template file path.
     *
     * @return Path string, null to use the bundled template.
     */
    public String getStatusHtmlFile() {
        return getStringProperty("STATUS_HTML_FILE");
    }

    /**
     * Gets HTTP basic auth username.
     *
     * @return Username or null when auth is off.
     */
    public String getHttpAuthUsername() {
        return getStringProperty("HTTP_AUTH_USERNAME");
    }

    /**
     * Gets HTTP basic auth password.
     *
     * @return Password or null when auth is off.
     */
    public String getHttpAuthPassword() {
        return getStringProperty("HTTP_AUTH_PASSWORD");
    }
}
