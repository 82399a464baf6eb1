package com.mimecast.mailhealth.mail;

import com.mimecast.mailhealth.probe.ProbeException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Properties;

/**
 * SMTP mail sender.
 *
 * <p>Submits probe messages with Jakarta Mail using authenticated SMTP.
 * <br>Port 465 with TLS enabled uses implicit TLS, any other port upgrades with STARTTLS.
 */
public class SmtpMailSender implements MailSender {
    private static final Logger log = LogManager.getLogger(SmtpMailSender.class);

    /**
     * Implicit TLS submission port.
     */
    static final int SMTPS_PORT = 465;

    private final String host;
    private final int port;
    private final boolean tls;
    private final String username;
    private final String password;
    private final Duration ioTimeout;

    /**
     * Constructs a new SmtpMailSender instance.
     *
     * @param host      SMTP host.
     * @param port      SMTP port.
     * @param tls       Use TLS.
     * @param username  Login username.
     * @param password  Login password.
     * @param ioTimeout Connect, read and write timeout.
     */
    public SmtpMailSender(String host, int port, boolean tls, String username, String password, Duration ioTimeout) {
        this.host = host;
        this.port = port;
        this.tls = tls;
        this.username = username;
        this.password = password;
        this.ioTimeout = ioTimeout;
    }

    /**
     * Gets the Jakarta Mail transport protocol.
     *
     * @return Protocol name.
     */
    String getProtocol() {
        return tls && port == SMTPS_PORT ? "smtps" : "smtp";
    }

    /**
     * Builds Jakarta Mail session properties.
     *
     * @return Properties instance.
     */
    @NotNull
    Properties buildProperties() {
        String protocol = getProtocol();
        String timeout = String.valueOf(ioTimeout.toMillis());
        String prefix = "mail." + protocol + ".";

        Properties props = new Properties();
        props.put("mail.transport.protocol", protocol);
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "auth", "true");
        props.put(prefix + "connectiontimeout", timeout);
        props.put(prefix + "timeout", timeout);
        props.put(prefix + "writetimeout", timeout);

        if ("smtps".equals(protocol)) {
            props.put(prefix + "ssl.enable", "true");
        } else if (tls) {
            props.put(prefix + "starttls.enable", "true");
            props.put(prefix + "starttls.required", "true");
        }

        return props;
    }

    @Override
    public void send(ProbeMessage message) throws ProbeException {
        Session session = Session.getInstance(buildProperties());
        try {
            MimeMessage mime = new ProbeMimeMessage(session, message);
            mime.setFrom(new InternetAddress(message.from()));
            mime.setRecipient(Message.RecipientType.TO, new InternetAddress(message.to()));
            mime.setSubject(message.subject(), StandardCharsets.UTF_8.name());
            mime.setSentDate(Date.from(message.createdAt()));
            mime.setHeader("X-Mailer", ProbeMessage.MAILER);
            mime.setText(message.body(), StandardCharsets.UTF_8.name());
            mime.saveChanges();

            log.debug("Connecting to {}:{} over {}", host, port, getProtocol());
            try (Transport transport = session.getTransport(getProtocol())) {
                transport.connect(host, port, username, password);
                transport.sendMessage(mime, mime.getAllRecipients());
            }
            log.debug("Message {} accepted by {}", message.token(), host);

        } catch (MessagingException e) {
            throw MailExceptions.wrap("SMTP send via " + host, e);
        }
    }

    /**
     * MimeMessage with a Message-ID derived from the correlation token.
     */
    private static class ProbeMimeMessage extends MimeMessage {
        private final ProbeMessage message;

        ProbeMimeMessage(Session session, ProbeMessage message) {
            super(session);
            this.message = message;
        }

        @Override
        protected void updateMessageID() throws MessagingException {
            String from = message.from();
            String domain = from.contains("@") ? from.substring(from.lastIndexOf('@') + 1) : "localhost";
            setHeader("Message-ID", "<" + message.token() + "@" + domain + ">");
        }
    }
}
