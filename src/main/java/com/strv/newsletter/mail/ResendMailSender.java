package com.strv.newsletter.mail;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import okhttp3.*;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Mail sender using the Resend HTTP API.
 *
 * <p>Posts <code>{from, to, subject, html}</code> to <code>/emails</code> with a bearer API key.
 * <br>A non 2xx response or a response without an <code>id</code> is treated as a failure.
 */
public class ResendMailSender implements MailSender {
    private static final Logger log = LogManager.getLogger(ResendMailSender.class);

    private static final MediaType APPLICATION_JSON = MediaType.parse("application/json; charset=utf-8");
    private static final String EMAILS_ENDPOINT = "/emails";

    private final String baseUrl;
    private final String apiKey;
    private final String from;
    private final OkHttpClient httpClient;
    private final Gson gson = new Gson();

    /**
     * Constructs a new ResendMailSender instance.
     *
     * @param baseUrl API base URL.
     * @param apiKey  API key.
     * @param from    Sender address.
     * @throws IllegalArgumentException If the API key or sender is missing.
     */
    public ResendMailSender(String baseUrl, String apiKey, String from) {
        if (StringUtils.isBlank(apiKey)) {
            throw new IllegalArgumentException("Resend API key is required");
        }
        if (StringUtils.isBlank(from)) {
            throw new IllegalArgumentException("email from address is required");
        }
        this.baseUrl = StringUtils.removeEnd(StringUtils.defaultIfBlank(baseUrl, "https://api.resend.com"), "/");
        this.apiKey = apiKey;
        this.from = from;
        this.httpClient = new OkHttpClient.Builder().build();
        log.debug("Resend mail sender initialized with {}", this.baseUrl);
    }

    @Override
    public void send(Duration timeout, String to, String subject, String body) throws MailSendException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("from", from);
        payload.put("to", List.of(to));
        payload.put("subject", subject);
        payload.put("html", body);

        Request request = new Request.Builder()
                .url(baseUrl + EMAILS_ENDPOINT)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(gson.toJson(payload), APPLICATION_JSON))
                .build();

        Call call = httpClient.newCall(request);
        call.timeout().timeout(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);

        try (Response response = call.execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new MailSendException("Resend returned HTTP " + response.code() + " for " + to + ": " + responseBody);
            }

            String id = parseId(responseBody);
            if (StringUtils.isBlank(id)) {
                throw new MailSendException("Resend accepted email to " + to + " but returned no id");
            }
            log.debug("Resend accepted email: to={}, id={}", to, id);
        } catch (IOException e) {
            throw new MailSendException("Resend request for " + to + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the message id from a response body.
     *
     * @param responseBody JSON string.
     * @return Id or null.
     */
    private String parseId(String responseBody) {
        try {
            JsonObject json = gson.fromJson(responseBody, JsonObject.class);
            if (json != null && json.has("id") && !json.get("id").isJsonNull()) {
                return json.get("id").getAsString();
            }
        } catch (JsonParseException | IllegalStateException e) {
            log.warn("Unparsable Resend response: {}", e.getMessage());
        }
        return null;
    }
}
