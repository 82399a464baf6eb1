package com.mimecast.mailhealth.mail;

import com.mimecast.mailhealth.probe.ProbeException;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.SearchTerm;
import jakarta.mail.search.SubjectTerm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Properties;

/**
 * IMAP mailbox.
 *
 * <p>Each call opens a fresh session, searches the folder server side for the probe message and, when found,
 * flags it deleted and expunges it before disconnecting.
 * <br>The server side search narrows candidates by sender and subject; the subject is then matched exactly
 * against the token so a message from an earlier probe is never taken for this one.
 */
public class ImapMailbox implements Mailbox {
    private static final Logger log = LogManager.getLogger(ImapMailbox.class);

    private final String host;
    private final int port;
    private final boolean ssl;
    private final String username;
    private final String password;
    private final String folder;
    private final Duration ioTimeout;

    /**
     * Constructs a new ImapMailbox instance for INBOX.
     *
     * @param host      IMAP host.
     * @param port      IMAP port.
     * @param ssl       Use implicit SSL.
     * @param username  Login username.
     * @param password  Login password.
     * @param ioTimeout Connect and read timeout.
     */
    public ImapMailbox(String host, int port, boolean ssl, String username, String password, Duration ioTimeout) {
        this(host, port, ssl, username, password, "INBOX", ioTimeout);
    }

    /**
     * Constructs a new ImapMailbox instance.
     *
     * @param host      IMAP host.
     * @param port      IMAP port.
     * @param ssl       Use implicit SSL.
     * @param username  Login username.
     * @param password  Login password.
     * @param folder    Folder name.
     * @param ioTimeout Connect and read timeout.
     */
    public ImapMailbox(String host, int port, boolean ssl, String username, String password, String folder, Duration ioTimeout) {
        this.host = host;
        this.port = port;
        this.ssl = ssl;
        this.username = username;
        this.password = password;
        this.folder = folder;
        this.ioTimeout = ioTimeout;
    }

    /**
     * Gets the Jakarta Mail store protocol.
     *
     * @return Protocol name.
     */
    String getProtocol() {
        return ssl ? "imaps" : "imap";
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     *
     * @return Properties instance.
     */
    @NotNull
    Properties buildProperties() {
        String protocol = getProtocol();
        String timeout = String.valueOf(ioTimeout.toMillis());
        String prefix = "mail." + protocol + ".";

        Properties props = new Properties();
        props.put("mail.store.protocol", protocol);
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "ssl.enable", String.valueOf(ssl));
        props.put(prefix + "connectiontimeout", timeout);
        props.put(prefix + "timeout", timeout);
        props.put(prefix + "writetimeout", timeout);

        return props;
    }

    /**
     * Builds the server side search term.
     *
     * @param message ProbeMessage instance.
     * @return SearchTerm instance.
     */
    static SearchTerm searchTerm(ProbeMessage message) {
        return new AndTerm(new FromStringTerm(message.from()), new SubjectTerm(message.subject()));
    }

    @Override
    public boolean findAndDelete(ProbeMessage message) throws ProbeException {
        Session session = Session.getInstance(buildProperties());
        Store store = null;
        Folder inbox = null;
        try {
            store = session.getStore(getProtocol());
            store.connect(host, port, username, password);

            inbox = store.getFolder(folder);
            inbox.open(Folder.READ_WRITE);

            Message[] candidates = inbox.search(searchTerm(message));
            log.debug("IMAP search on {} returned {} candidates for {}", host, candidates.length, message.token());

            boolean found = false;
            for (Message candidate : candidates) {
                if (message.matchesSubject(candidate.getSubject())) {
                    candidate.setFlag(Flags.Flag.DELETED, true);
                    found = true;
                }
            }

            // Expunge on close.
            inbox.close(found);
            inbox = null;
            return found;

        } catch (MessagingException e) {
            throw MailExceptions.wrap("IMAP search on " + host, e);
        } finally {
            close(inbox, store);
        }
    }

    private void close(Folder inbox, Store store) {
        try {
            if (inbox != null && inbox.isOpen()) {
                inbox.close(false);
            }
            if (store != null && store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.warn("Error closing IMAP connection to {}: {}", host, e.getMessage());
        }
    }
}
