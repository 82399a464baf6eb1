package com.mimecast.mailhealth.scanners;

import com.mimecast.mailhealth.probe.ProbeException;
import com.mimecast.mailhealth.probe.ProbeFailure;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mail tester score page client.
 *
 * <p>Fetches the result page of a mail-tester style scoring service and scrapes the total score from it.
 * <br>The page only carries a score once the service has received the test message, so an empty result is
 * expected while the message is in flight.
 */
public class MailTesterClient implements SpamScoreFetcher {
    private static final Logger log = LogManager.getLogger(MailTesterClient.class);

    private static final String USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 " +
            "(KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private static final Pattern SCORE = Pattern.compile("Your lovely total:\\s*(\\d+(?:\\.\\d+)?)\\s*/\\s*\\d+",
            Pattern.CASE_INSENSITIVE);

    private final String url;
    private final OkHttpClient httpClient;

    /**
     * Constructs a new MailTesterClient instance.
     *
     * @param url     Result page URL.
     * @param timeout Whole call timeout.
     */
    public MailTesterClient(String url, Duration timeout) {
        this.url = url;
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
        log.debug("Mail tester client initialized with {}", url);
    }

    @Override
    public OptionalDouble fetchScore() throws ProbeException {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ProbeException(ProbeFailure.CONNECTION, "Score page returned HTTP " + response.code());
            }

            ResponseBody body = response.body();
            String html = body != null ? body.string() : "";
            log.trace("Score page returned {} bytes", html.length());

            OptionalDouble score = parseScore(html);
            if (score.isEmpty()) {
                log.debug("No score on page {} yet", url);
            }
            return score;

        } catch (IOException e) {
            throw new ProbeException(ProbeFailure.CONNECTION, "Score page fetch failed: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the total score from a result page.
     * <p>The score is read from the rendered page text, not the markup.
     *
     * @param html Page HTML.
     * @return OptionalDouble, empty if the page carries no score.
     */
    public static OptionalDouble parseScore(String html) {
        if (html == null || html.isEmpty()) {
            return OptionalDouble.empty();
        }

        // Visible text only, whitespace normalised; scripts, styles and comments are dropped.
        String text = Jsoup.parse(html).text().replace('\u00a0', ' ');
        Matcher matcher = SCORE.matcher(text);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }

        try {
            return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
            log.warn("Unparsable score value: {}", matcher.group(1));
            return OptionalDouble.empty();
        }
    }
}
