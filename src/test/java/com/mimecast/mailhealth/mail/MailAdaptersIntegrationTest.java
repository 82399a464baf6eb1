package com.mimecast.mailhealth.mail;

import com.icegreen.greenmail.configuration.GreenMailConfiguration;
import com.icegreen.greenmail.junit5.GreenMailExtension;
import com.icegreen.greenmail.util.ServerSetupTest;
import com.mimecast.mailhealth.probe.CorrelationToken;
import com.mimecast.mailhealth.probe.ProbeException;
import com.mimecast.mailhealth.probe.ProbeFailure;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MailAdaptersIntegrationTest {

    private static final String INTERNAL = "monitor@internal.example.com";
    private static final String EXTERNAL = "monitor@external.example.net";
    private static final String PASSWORD = "secret";
    private static final String HOST = "127.0.0.1";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @RegisterExtension
    static GreenMailExtension greenMail = new GreenMailExtension(ServerSetupTest.SMTP_IMAP)
            .withConfiguration(GreenMailConfiguration.aConfig()
                    .withUser(INTERNAL, INTERNAL, PASSWORD)
                    .withUser(EXTERNAL, EXTERNAL, PASSWORD));

    private SmtpMailSender sender() {
        return new SmtpMailSender(HOST, ServerSetupTest.SMTP.getPort(), false, INTERNAL, PASSWORD, TIMEOUT);
    }

    private ImapMailbox mailbox(String password) {
        return new ImapMailbox(HOST, ServerSetupTest.IMAP.getPort(), false, EXTERNAL, password, TIMEOUT);
    }

    private ProbeMessage message(String token) {
        return new ProbeMessage(INTERNAL, EXTERNAL, token, Instant.now());
    }

    @Test
    void testSendFindAndDelete() throws ProbeException, MessagingException {
        ProbeMessage message = message(CorrelationToken.next());

        sender().send(message);
        assertTrue(greenMail.waitForIncomingEmail(5_000, 1));

        MimeMessage received = greenMail.getReceivedMessages()[0];
        assertEquals(message.subject(), received.getSubject());
        assertEquals("<" + message.token() + "@internal.example.com>", received.getMessageID());
        assertEquals(ProbeMessage.MAILER, received.getHeader("X-Mailer", null));

        ImapMailbox mailbox = mailbox(PASSWORD);
        assertTrue(mailbox.findAndDelete(message));

        // Expunged on close.
        assertEquals(0, greenMail.getReceivedMessages().length);
        assertFalse(mailbox.findAndDelete(message));
    }

    @Test
    void testOlderMessageIsLeftInPlace() throws ProbeException {
        ProbeMessage older = message("k9z-100");
        ProbeMessage current = message("k9z-10");

        sender().send(older);
        assertTrue(greenMail.waitForIncomingEmail(5_000, 1));

        ImapMailbox mailbox = mailbox(PASSWORD);
        assertFalse(mailbox.findAndDelete(current), "Subject search alone would match the older message");
        assertEquals(1, greenMail.getReceivedMessages().length);

        assertTrue(mailbox.findAndDelete(older));
        assertEquals(0, greenMail.getReceivedMessages().length);
    }

    @Test
    void testMessageFromOtherSenderIsNotMatched() throws ProbeException {
        ProbeMessage message = message(CorrelationToken.next());
        sender().send(message);
        assertTrue(greenMail.waitForIncomingEmail(5_000, 1));

        ProbeMessage spoofed = new ProbeMessage("someone@elsewhere.example.org", EXTERNAL, message.token(), Instant.now());

        assertFalse(mailbox(PASSWORD).findAndDelete(spoofed));
        assertEquals(1, greenMail.getReceivedMessages().length);
    }

    @Test
    void testWrongPasswordIsAuthenticationFailure() {
        ProbeException e = assertThrows(ProbeException.class,
                () -> mailbox("wrong").findAndDelete(message(CorrelationToken.next())));

        assertEquals(ProbeFailure.AUTHENTICATION, e.getFailure());
    }

    @Test
    void testUnreachableServerIsConnectionFailure() {
        SmtpMailSender unreachable = new SmtpMailSender(HOST, 1, false, INTERNAL, PASSWORD, Duration.ofSeconds(2));

        ProbeException e = assertThrows(ProbeException.class,
                () -> unreachable.send(message(CorrelationToken.next())));

        assertEquals(ProbeFailure.CONNECTION, e.getFailure());
    }
}
