package com.mimecast.mailhealth.config;

import java.util.Map;

/**
 * Mail account configuration.
 *
 * <p>Reads the SMTP, IMAP and address keys of one account, all sharing a prefix such as <i>INTERNAL_</i>.
 */
public class MailAccountConfig extends ConfigFoundation {
    private final String prefix;
    private final String password;

    /**
     * Constructs a new MailAccountConfig instance.
     *
     * @param map      Configuration map.
     * @param prefix   Key prefix.
     * @param password Resolved password, null if none was found.
     */
    public MailAccountConfig(Map<String, String> map, String prefix, String password) {
        super(map);
        this.prefix = prefix;
        this.password = password;
    }

    /**
     * Gets key prefix.
     *
     * @return Prefix string.
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * Gets email address, also used as login username.
     *
     * @return Address string.
     */
    public String getAddress() {
        return getStringProperty(prefix + "EMAIL_ADDRESS");
    }

    /**
     * Gets SMTP host.
     *
     * @return Host string.
     */
    public String getSmtpServer() {
        return getStringProperty(prefix + "SMTP_SERVER");
    }

    /**
     * Gets SMTP port.
     *
     * @return Port number.
     */
    public int getSmtpPort() {
        return Math.toIntExact(getLongProperty(prefix + "SMTP_PORT", 465L));
    }

    /**
     * Checks if SMTP should use TLS.
     *
     * @return Boolean.
     */
    public boolean isSmtpTls() {
        return getBooleanProperty(prefix + "SMTP_USE_TLS", true);
    }

    /**
     * Gets IMAP host.
     *
     * @return Host string.
     */
    public String getImapServer() {
        return getStringProperty(prefix + "IMAP_SERVER");
    }

    /**
     * Gets IMAP port.
     *
     * @return Port number.
     */
    public int getImapPort() {
        return Math.toIntExact(getLongProperty(prefix + "IMAP_PORT", 993L));
    }

    /**
     * Checks if IMAP should use implicit SSL.
     *
     * @return Boolean.
     */
    public boolean isImapSsl() {
        return getBooleanProperty(prefix + "IMAP_USE_SSL", true);
    }

    /**
     * Gets password.
     *
     * @return Password string or null.
     */
    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return prefix + "{address=" + getAddress() + ", smtp=" + getSmtpServer() + ":" + getSmtpPort() +
                ", imap=" + getImapServer() + ":" + getImapPort() + "}";
    }
}
