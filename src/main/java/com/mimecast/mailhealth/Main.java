package com.mimecast.mailhealth;

import com.mimecast.mailhealth.main.Exporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;

/**
 * Main runnable.
 *
 * <p>Configuration comes from the environment only, there are no command line options.
 *
 * @see Exporter
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    @SuppressWarnings("squid:S106")
    public static void main(String[] args) {
        try {
            Exporter.run(System.getenv());
        } catch (ConfigurationException e) {
            log.fatal("Configuration error: {}", e.getExplanation());
            System.exit(1);
        } catch (IOException e) {
            log.fatal("Unable to start exporter endpoint: {}", e.getMessage());
            System.exit(1);
        }
    }
}
