package com.mimecast.mailhealth.mail;

/**
 * One side of the round trip: an address with its outgoing and incoming capabilities.
 *
 * @param address Email address.
 * @param sender  MailSender for this account.
 * @param mailbox Mailbox for this account.
 */
public record MailAccount(String address, MailSender sender, Mailbox mailbox) {
}
