package com.mimecast.mailhealth.config;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Docker style secret reader.
 *
 * <p>A secret is read from a file named after it in the secrets directory.
 * <br>When no such file exists the upper case name is looked up in the environment instead.
 */
public class SecretReader {
    private static final Logger log = LogManager.getLogger(SecretReader.class);

    /**
     * Default secrets directory.
     */
    public static final String DEFAULT_SECRETS_DIR = "/run/secrets";

    private final Path directory;
    private final Map<String, String> env;

    /**
     * Constructs a new SecretReader instance.
     *
     * @param directory Secrets directory.
     * @param env       Environment map used as fallback.
     */
    public SecretReader(Path directory, Map<String, String> env) {
        this.directory = directory;
        this.env = env;
    }

    /**
     * Reads a secret.
     *
     * @param name Secret file name, lower case by convention.
     * @return Optional of trimmed secret value.
     */
    public Optional<String> read(String name) {
        Path file = directory.resolve(name);
        if (Files.isRegularFile(file)) {
            try {
                String value = Files.readString(file, StandardCharsets.UTF_8).trim();
                if (StringUtils.isNotEmpty(value)) {
                    log.debug("Secret {} read from {}", name, directory);
                    return Optional.of(value);
                }
            } catch (IOException e) {
                log.warn("Unable to read secret file {}: {}", file, e.getMessage());
            }
        }

        String value = env.get(name.toUpperCase());
        if (StringUtils.isNotBlank(value)) {
            log.debug("Secret {} read from environment", name);
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }
}
