/**
 * Mail Health Exporter.
 *
 * <p>Prometheus exporter probing a mail server end to end.
 * <br>It sends tokenised messages between an internal and an external account over SMTP, confirms their arrival
 * over IMAP and periodically asks a third-party service to score a message for spam.
 * <br>Results are exposed as Prometheus metrics and a small HTML status page.
 *
 * <p>This project can be compiled into a runnable JAR and is configured through environment variables only.
 *
 * <h2>Usage:</h2>
 * <pre>
 *      $ INTERNAL_SMTP_SERVER=smtp.example.com ... java -jar mail-health-exporter.jar
 * </pre>
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *     <li><b>/metrics</b> - Prometheus text exposition.</li>
 *     <li><b>/status</b> - Status page.</li>
 *     <li><b>/health</b> - Liveness.</li>
 * </ul>
 */
package com.mimecast.mailhealth;
