/**
 * Environment configuration.
 *
 * <p>Every setting is an environment variable. Passwords may also come from Docker secret files.
 *
 * <h2>Accounts</h2>
 * <p>Both accounts use the same keys with an <i>INTERNAL_</i> or <i>EXTERNAL_</i> prefix:
 * <ul>
 *     <li><b>SMTP_SERVER</b>, <b>SMTP_PORT</b> (465), <b>SMTP_USE_TLS</b> (true)</li>
 *     <li><b>IMAP_SERVER</b>, <b>IMAP_PORT</b> (993), <b>IMAP_USE_SSL</b> (true)</li>
 *     <li><b>EMAIL_ADDRESS</b>, also the login username</li>
 *     <li><b>EMAIL_PASSWORD</b>, or secret file <i>internal_email_password</i> / <i>external_email_password</i></li>
 * </ul>
 *
 * <h2>Schedule</h2>
 * <ul>
 *     <li><b>CHECK_INTERVAL_SECONDS</b> (300) - Round trip check delay.</li>
 *     <li><b>TIMEOUT_SECONDS</b> (60) - Wait for a message or a score.</li>
 *     <li><b>POLL_INTERVAL_SECONDS</b> (10) - Pause between polls.</li>
 *     <li><b>SPAM_SCORE_CHECK_INTERVAL_SECONDS</b> (300) - Spam check delay.</li>
 *     <li><b>SPAM_SCORE_MIN_INTERVAL_SECONDS</b> (28800) - Minimum time between two spam score attempts.</li>
 * </ul>
 */
package com.mimecast.mailhealth.config;
