/**
 * Mail capabilities used by probes.
 *
 * <p>{@link com.mimecast.mailhealth.mail.MailSender} and {@link com.mimecast.mailhealth.mail.Mailbox} are
 * the seams probes depend on.
 * <br>The Jakarta Mail backed implementations open a fresh connection per call and never keep sessions
 * across checks.
 */
package com.mimecast.mailhealth.mail;
