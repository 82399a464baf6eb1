package com.mimecast.mailhealth.mail;

import com.mimecast.mailhealth.probe.ProbeException;
import com.mimecast.mailhealth.probe.ProbeFailure;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In memory mail transport for probe tests.
 *
 * <p>Messages sent to an address land in its mailbox after that address's delivery delay, read from the clock.
 * <br>Addresses without a delay never receive anything.
 */
public class InMemoryMailServer {
    private final Clock clock;
    private final Map<String, Duration> deliveryDelays = new HashMap<>();
    private final Map<String, List<Delivery>> mailboxes = new HashMap<>();
    private final Map<String, ProbeFailure> sendFailures = new HashMap<>();
    private final Map<String, ProbeFailure> mailboxFailures = new HashMap<>();
    private final List<ProbeMessage> sent = new ArrayList<>();
    private final Map<String, Integer> searches = new HashMap<>();

    private record Delivery(ProbeMessage message, Instant deliverAt) {
    }

    public InMemoryMailServer(Clock clock) {
        this.clock = clock;
    }

    public synchronized InMemoryMailServer deliverAfter(String address, Duration delay) {
        deliveryDelays.put(address, delay);
        return this;
    }

    public synchronized InMemoryMailServer failSend(String address, ProbeFailure failure) {
        sendFailures.put(address, failure);
        return this;
    }

    public synchronized InMemoryMailServer failMailbox(String address, ProbeFailure failure) {
        mailboxFailures.put(address, failure);
        return this;
    }

    public synchronized InMemoryMailServer healMailbox(String address) {
        mailboxFailures.remove(address);
        return this;
    }

    /**
     * Drops a message straight into a mailbox, bypassing send.
     *
     * @param message ProbeMessage instance.
     */
    public synchronized void place(ProbeMessage message) {
        mailboxes.computeIfAbsent(message.to(), k -> new ArrayList<>()).add(new Delivery(message, clock.instant()));
    }

    public synchronized List<ProbeMessage> getSent() {
        return List.copyOf(sent);
    }

    public synchronized int getPending(String address) {
        return mailboxes.getOrDefault(address, List.of()).size();
    }

    public synchronized int getSearches(String address) {
        return searches.getOrDefault(address, 0);
    }

    public MailSender sender(String address) {
        return message -> {
            synchronized (this) {
                ProbeFailure failure = sendFailures.get(address);
                if (failure != null) {
                    throw new ProbeException(failure, "Send refused for " + address);
                }
                sent.add(message);
                Duration delay = deliveryDelays.get(message.to());
                if (delay != null) {
                    mailboxes.computeIfAbsent(message.to(), k -> new ArrayList<>())
                            .add(new Delivery(message, clock.instant().plus(delay)));
                }
            }
        };
    }

    public Mailbox mailbox(String address) {
        return message -> {
            synchronized (this) {
                searches.merge(address, 1, Integer::sum);
                ProbeFailure failure = mailboxFailures.get(address);
                if (failure != null) {
                    throw new ProbeException(failure, "Mailbox unavailable for " + address);
                }
                List<Delivery> box = mailboxes.getOrDefault(address, new ArrayList<>());
                Instant now = clock.instant();
                return box.removeIf(d -> !d.deliverAt().isAfter(now)
                        && d.message().from().equals(message.from())
                        && message.matchesSubject(d.message().subject()));
            }
        };
    }

    public MailAccount account(String address) {
        return new MailAccount(address, sender(address), mailbox(address));
    }
}
