package com.mimecast.mailhealth.main;

import com.mimecast.mailhealth.config.ExporterConfig;
import com.mimecast.mailhealth.config.MailAccountConfig;
import com.mimecast.mailhealth.cron.ProbeCron;
import com.mimecast.mailhealth.endpoints.ExporterEndpoint;
import com.mimecast.mailhealth.endpoints.HtmlStatusRenderer;
import com.mimecast.mailhealth.endpoints.StatusRenderer;
import com.mimecast.mailhealth.mail.ImapMailbox;
import com.mimecast.mailhealth.mail.MailAccount;
import com.mimecast.mailhealth.mail.SmtpMailSender;
import com.mimecast.mailhealth.metrics.HealthMetrics;
import com.mimecast.mailhealth.probe.Poller;
import com.mimecast.mailhealth.probe.RoundTripProbe;
import com.mimecast.mailhealth.probe.Sleeper;
import com.mimecast.mailhealth.probe.SpamScoreProbe;
import com.mimecast.mailhealth.scanners.MailTesterClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Mail health exporter service.
 *
 * <p>Wires configuration, probes, metrics, the scheduler and the HTTP endpoint together and owns their
 * lifecycle.
 * <br>Configuration is validated before anything is scheduled or bound.
 *
 * <p>The service is started by calling the static {@link #run(Map)} method with the process environment.
 */
public class Exporter {
    private static final Logger log = LogManager.getLogger(Exporter.class);

    /**
     * Extra time given to in flight checks on shutdown on top of the poll timeout.
     */
    static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(30);

    private final ExporterConfig config;
    private final Clock clock;
    private final HealthMetrics metrics;

    private ProbeCron cron;
    private ExporterEndpoint endpoint;

    /**
     * Constructs a new Exporter instance.
     *
     * @param config ExporterConfig instance, already validated.
     * @param clock  Clock instance.
     */
    public Exporter(ExporterConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.metrics = new HealthMetrics(clock.instant());
    }

    /**
     * Validates configuration, starts the service and registers a shutdown hook.
     *
     * @param env Environment map.
     * @return Exporter instance.
     * @throws ConfigurationException If configuration is missing or invalid.
     * @throws IOException            If the HTTP port cannot be bound.
     */
    public static Exporter run(Map<String, String> env) throws ConfigurationException, IOException {
        ExporterConfig config = new ExporterConfig(env);
        config.validate();

        Exporter exporter = new Exporter(config, Clock.systemUTC());
        exporter.start();
        exporter.registerShutdownHook();
        return exporter;
    }

    /**
     * Starts the endpoint then the scheduler.
     *
     * @throws ConfigurationException If the status template cannot be loaded.
     * @throws IOException            If the HTTP port cannot be bound.
     */
    public void start() throws ConfigurationException, IOException {
        StatusRenderer renderer;
        try {
            renderer = HtmlStatusRenderer.load(config.getStatusHtmlFile());
        } catch (IOException e) {
            throw configurationException("Unable to load status HTML template: " + e.getMessage(), e);
        }

        endpoint = new ExporterEndpoint(metrics, renderer, config.getSpamScoreTestUrl());
        endpoint.start(config.getHttpPort(), config.getHttpAuthUsername(), config.getHttpAuthPassword());

        Poller poller = new Poller(clock, Sleeper.SYSTEM, config.getPollInterval(), config.getTimeout());
        MailAccount internal = account(config.getInternal());
        MailAccount external = account(config.getExternal());

        RoundTripProbe roundTripProbe = new RoundTripProbe(internal, external, poller, clock);
        SpamScoreProbe spamScoreProbe = new SpamScoreProbe(
                internal.sender(),
                internal.address(),
                config.getSpamScoreTestAddress(),
                new MailTesterClient(config.getSpamScoreTestUrl(), config.getSpamScoreFetchTimeout()),
                config.getSpamScoreTestUrl(),
                config.getSpamScoreMinInterval(),
                poller,
                clock);

        cron = new ProbeCron(roundTripProbe, spamScoreProbe, metrics, clock,
                config.getCheckInterval(),
                config.getSpamScoreCheckInterval(),
                config.getTimeout().plus(SHUTDOWN_MARGIN));
        cron.start();

        log.info("Mail health exporter started");
    }

    /**
     * Stops the scheduler then the endpoint.
     */
    public void stop() {
        log.info("Service is shutting down.");
        if (cron != null) cron.stop();
        if (endpoint != null) endpoint.stop();
        log.info("Shutdown complete.");
    }

    /**
     * Gets metrics.
     *
     * @return HealthMetrics instance.
     */
    public HealthMetrics getMetrics() {
        return metrics;
    }

    /**
     * Builds a mail account from its configuration.
     *
     * @param account MailAccountConfig instance.
     * @return MailAccount instance.
     */
    private MailAccount account(MailAccountConfig account) {
        Duration ioTimeout = config.getMailIoTimeout();
        return new MailAccount(
                account.getAddress(),
                new SmtpMailSender(account.getSmtpServer(), account.getSmtpPort(), account.isSmtpTls(),
                        account.getAddress(), account.getPassword(), ioTimeout),
                new ImapMailbox(account.getImapServer(), account.getImapPort(), account.isImapSsl(),
                        account.getAddress(), account.getPassword(), ioTimeout));
    }

    /**
     * Registers a shutdown hook to ensure graceful termination.
     */
    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "exporter-shutdown"));
    }

    private static ConfigurationException configurationException(String message, Throwable cause) {
        ConfigurationException e = new ConfigurationException(message);
        e.setRootCause(cause);
        return e;
    }
}
