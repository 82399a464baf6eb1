package com.mimecast.mailhealth.endpoints;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTML status page renderer.
 *
 * <p>The template carries a {@code let mailServerData = {...};} script object which is swapped for the
 * current snapshot on every render. Everything else in the template is served as is.
 */
public class HtmlStatusRenderer implements StatusRenderer {
    private static final Logger log = LogManager.getLogger(HtmlStatusRenderer.class);

    /**
     * Bundled template resource.
     */
    public static final String DEFAULT_TEMPLATE = "status.html";

    // Object with at most one level of nested braces.
    private static final Pattern DATA_OBJECT = Pattern.compile(
            "let\\s+mailServerData\\s*=\\s*\\{(?:[^{}]*(?:\\{[^{}]*\\})*)*\\};", Pattern.DOTALL);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();
    private final String template;

    /**
     * Constructs a new HtmlStatusRenderer instance.
     *
     * @param template Template HTML.
     */
    public HtmlStatusRenderer(String template) {
        this.template = template;
        if (!DATA_OBJECT.matcher(template).find()) {
            log.warn("Status template has no mailServerData object, page will be static");
        }
    }

    /**
     * Loads a template from a file, or the bundled resource when path is null.
     *
     * @param path Template file path, may be null.
     * @return HtmlStatusRenderer instance.
     * @throws IOException Template not readable.
     */
    public static HtmlStatusRenderer load(String path) throws IOException {
        if (path != null) {
            log.info("Loading status HTML template from {}", path);
            return new HtmlStatusRenderer(Files.readString(Path.of(path), StandardCharsets.UTF_8));
        }

        try (InputStream is = HtmlStatusRenderer.class.getClassLoader().getResourceAsStream(DEFAULT_TEMPLATE)) {
            if (is == null) {
                throw new IOException("Resource not found: " + DEFAULT_TEMPLATE);
            }
            log.info("Loading bundled status HTML template");
            return new HtmlStatusRenderer(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Override
    public String render(StatusSnapshot snapshot) {
        String replacement = "let mailServerData = " + gson.toJson(toJson(snapshot)) + ";";
        return DATA_OBJECT.matcher(template).replaceAll(Matcher.quoteReplacement(replacement));
    }

    /**
     * Builds the script object.
     *
     * @param snapshot StatusSnapshot instance.
     * @return JsonObject instance.
     */
    @NotNull
    JsonObject toJson(StatusSnapshot snapshot) {
        JsonObject lastUpdated = new JsonObject();
        lastUpdated.addProperty("sending", snapshot.sendingUpdated());
        lastUpdated.addProperty("receiving", snapshot.receivingUpdated());
        lastUpdated.addProperty("spam", snapshot.spamUpdated());

        JsonObject data = new JsonObject();
        data.addProperty("sendingWorks", snapshot.sendingWorks());
        data.addProperty("receivingWorks", snapshot.receivingWorks());
        data.addProperty("spamScore", snapshot.spamScore());
        data.addProperty("spamTestUrl", snapshot.spamTestUrl());
        data.add("lastUpdated", lastUpdated);
        return data;
    }
}
