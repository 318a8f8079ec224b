package com.ryuqq.fetcher.testkit.contract;

import com.ryuqq.fetcher.core.spi.HttpRequestSpec;
import com.ryuqq.fetcher.core.spi.RawResponse;
import com.ryuqq.fetcher.core.spi.TransportException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory HTTP endpoint scripted per URL, for testing purposes.
 *
 * <p>Each URL owns a sequence of steps. Every request consumes the head of the sequence;
 * the last step is sticky and answers all further requests. URLs without a script answer
 * {@code 404 Not Found}.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Scripted responses and transport failures per URL</li>
 *   <li>Optional real-time delay per URL (to exercise ordering under concurrency)</li>
 *   <li>Request log and per-URL attempt counters</li>
 * </ul>
 *
 * <p>All operations are thread-safe.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public class ScriptedHttpServer {

    private final ConcurrentHashMap<String, ConcurrentLinkedDeque<Step>> scripts;
    private final ConcurrentHashMap<String, Duration> delays;
    private final ConcurrentHashMap<String, AtomicInteger> attempts;
    private final List<HttpRequestSpec> requests;

    /**
     * Creates a server with no scripted URLs.
     */
    public ScriptedHttpServer() {
        this.scripts = new ConcurrentHashMap<>();
        this.delays = new ConcurrentHashMap<>();
        this.attempts = new ConcurrentHashMap<>();
        this.requests = new CopyOnWriteArrayList<>();
    }

    /**
     * Answers every request to the URL with the given response.
     *
     * @param url request URL
     * @param statusCode HTTP status
     * @param contentType Content-Type header value
     * @param body UTF-8 body
     * @return this server
     */
    public ScriptedHttpServer respond(String url, int statusCode, String contentType, String body) {
        return script(url, Step.response(statusCode, contentType, body));
    }

    /**
     * Fails every request to the URL with the given transport failure.
     *
     * @param url request URL
     * @param reason failure reason
     * @return this server
     */
    public ScriptedHttpServer fail(String url, TransportException.Reason reason) {
        return script(url, Step.failure(reason, reason.name().toLowerCase(Locale.ROOT) + " for " + url));
    }

    /**
     * Replaces the script of the URL with the given steps, consumed in order.
     *
     * @param url request URL
     * @param steps steps, the last one sticky
     * @return this server
     */
    public ScriptedHttpServer script(String url, Step... steps) {
        if (url == null) {
            throw new IllegalArgumentException("url cannot be null");
        }
        if (steps == null || steps.length == 0) {
            throw new IllegalArgumentException("steps cannot be empty");
        }
        scripts.put(url, new ConcurrentLinkedDeque<>(Arrays.asList(steps)));
        return this;
    }

    /**
     * Delays every answer for the URL by a real wall-clock duration.
     *
     * @param url request URL
     * @param delay delay before answering
     * @return this server
     */
    public ScriptedHttpServer delay(String url, Duration delay) {
        if (url == null || delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("url and a non-negative delay are required");
        }
        delays.put(url, delay);
        return this;
    }

    /**
     * Handles one request according to the script.
     *
     * @param request request spec
     * @return scripted response
     * @throws TransportException when the script says so, or when interrupted during a delay
     */
    public RawResponse handle(HttpRequestSpec request) throws TransportException {
        String url = request.url();
        requests.add(request);
        attempts.computeIfAbsent(url, key -> new AtomicInteger()).incrementAndGet();

        Duration delay = delays.get(url);
        if (delay != null && !delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(TransportException.Reason.CONNECTION, "interrupted: " + url, e);
            }
        }

        return nextStep(url).apply();
    }

    /**
     * Number of requests received for the URL.
     *
     * @param url request URL
     * @return attempt count
     */
    public int attempts(String url) {
        AtomicInteger count = attempts.get(url);
        return count == null ? 0 : count.get();
    }

    /**
     * Number of requests received for all URLs.
     *
     * @return total request count
     */
    public int totalAttempts() {
        return requests.size();
    }

    /**
     * Returns the request log in arrival order.
     *
     * @return snapshot of received requests
     */
    public List<HttpRequestSpec> requests() {
        return new ArrayList<>(requests);
    }

    /**
     * Clears all scripts, delays and records.
     */
    public void clear() {
        scripts.clear();
        delays.clear();
        attempts.clear();
        requests.clear();
    }

    private Step nextStep(String url) {
        ConcurrentLinkedDeque<Step> steps = scripts.get(url);
        if (steps == null) {
            return Step.response(404, "text/plain", "Not Found");
        }
        synchronized (steps) {
            return steps.size() > 1 ? steps.pollFirst() : steps.peekFirst();
        }
    }

    /**
     * One scripted answer: a response or a transport failure.
     */
    public static final class Step {

        private final RawResponse response;
        private final TransportException.Reason failure;
        private final String message;

        private Step(RawResponse response, TransportException.Reason failure, String message) {
            this.response = response;
            this.failure = failure;
            this.message = message;
        }

        /**
         * Response step with a UTF-8 body.
         *
         * @param statusCode HTTP status
         * @param contentType Content-Type header value (null for none)
         * @param body body text
         * @return step
         */
        public static Step response(int statusCode, String contentType, String body) {
            Map<String, String> headers = contentType == null ? Map.of() : Map.of("Content-Type", contentType);
            String text = body == null ? "" : body;
            return new Step(new RawResponse(statusCode, headers, text.getBytes(StandardCharsets.UTF_8), text), null, null);
        }

        /**
         * Response step with a prepared response.
         *
         * @param response response
         * @return step
         */
        public static Step response(RawResponse response) {
            if (response == null) {
                throw new IllegalArgumentException("response cannot be null");
            }
            return new Step(response, null, null);
        }

        /**
         * Transport failure step.
         *
         * @param reason failure reason
         * @param message failure message
         * @return step
         */
        public static Step failure(TransportException.Reason reason, String message) {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
            return new Step(null, reason, message);
        }

        RawResponse apply() throws TransportException {
            if (failure != null) {
                throw new TransportException(failure, message);
            }
            return response;
        }
    }
}
