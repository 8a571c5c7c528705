package im.arun.polytex.polygon;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.polytex.config.PolytexConfig;
import lombok.Value;
import okhttp3.Call;
import okhttp3.FormBody;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Client for the Polygon API.
 * <p>
 * Every call carries {@code apiKey}, {@code time} and {@code apiSig}. The signature is
 * {@code rand + sha512hex(rand + "/" + method + "?" + sortedParams + "#" + secret)} where
 * {@code rand} is six random lowercase letters and the parameters, uploaded file contents
 * included, are sorted by name and then by value.
 */
public class PolygonClient {
    private static final Logger logger = LoggerFactory.getLogger(PolygonClient.class);
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final int PREFIX_LENGTH = 6;

    private final String apiKey;
    private final String secret;
    private final String baseUrl;
    private final Call.Factory httpClient;
    private final Random random;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PolygonClient(PolytexConfig.Polygon polygon, int connectTimeoutSeconds, int readTimeoutSeconds) {
        this(polygon.getKey(), polygon.getSecret(), polygon.getBaseUrl(),
                new OkHttpClient.Builder()
                        .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                        .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                        .writeTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                        .build(),
                new SecureRandom(),
                Clock.systemUTC());
    }

    public PolygonClient(String apiKey, String secret, String baseUrl,
                         Call.Factory httpClient, Random random, Clock clock) {
        if (apiKey == null || apiKey.isBlank() || secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Polygon API key and secret must be provided");
        }
        this.apiKey = apiKey;
        this.secret = secret;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.random = random;
        this.clock = clock;
    }

    public JsonNode call(String method) {
        return call(method, Map.of(), Map.of());
    }

    public JsonNode call(String method, Map<String, String> params) {
        return call(method, params, Map.of());
    }

    /**
     * Invoke an API method.
     *
     * @param files multipart file parameters by name; empty for a plain form post
     * @return the {@code result} member of the response, an empty object when absent
     * @throws PolygonException on transport failure, a non-JSON body or a status other than OK
     */
    public JsonNode call(String method, Map<String, String> params, Map<String, FilePart> files) {
        Map<String, String> fullParams = new LinkedHashMap<>(params);
        fullParams.put("apiKey", apiKey);
        fullParams.put("time", String.valueOf(clock.instant().getEpochSecond()));

        // Uploaded content takes part in the signature exactly as posted
        Map<String, byte[]> signParams = new LinkedHashMap<>();
        fullParams.forEach((key, value) -> signParams.put(key, value.getBytes(StandardCharsets.UTF_8)));
        files.forEach((key, file) -> signParams.put(key, file.getContent()));
        fullParams.put("apiSig", generateSignature(method, signParams));

        Request request = new Request.Builder()
                .url(baseUrl + "/" + method)
                .post(buildBody(fullParams, files))
                .build();

        logger.info("Calling {}", method);
        logger.debug("Parameters of {}: {}", method, params.keySet());

        String responseText;
        int statusCode;
        try (Response response = httpClient.newCall(request).execute()) {
            statusCode = response.code();
            ResponseBody body = response.body();
            responseText = body != null ? body.string() : "";
        } catch (IOException e) {
            throw new PolygonException("Polygon API request to " + method + " failed: " + e.getMessage(), e);
        }
        logger.debug("Response status of {}: {}", method, statusCode);

        JsonNode payload;
        try {
            payload = objectMapper.readTree(responseText);
        } catch (IOException e) {
            if (statusCode < 200 || statusCode >= 300) {
                throw new PolygonException("Polygon API request to " + method + " failed with HTTP "
                        + statusCode + ": " + responseText, e);
            }
            throw new PolygonException("Polygon API returned non-JSON response for " + method + ": " + responseText, e);
        }
        if (payload == null || !payload.isObject()) {
            throw new PolygonException("Polygon API returned unexpected response for " + method + ": " + responseText);
        }

        if (!"OK".equals(payload.path("status").asText())) {
            String comment = payload.path("comment").asText("");
            throw new PolygonException(comment.isEmpty() ? "Unknown API error in " + method : comment);
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw new PolygonException("Polygon API request to " + method + " failed with HTTP " + statusCode);
        }
        return payload.has("result") ? payload.get("result") : objectMapper.createObjectNode();
    }

    private static RequestBody buildBody(Map<String, String> params, Map<String, FilePart> files) {
        if (files.isEmpty()) {
            FormBody.Builder form = new FormBody.Builder(StandardCharsets.UTF_8);
            params.forEach(form::add);
            return form.build();
        }
        MultipartBody.Builder multipart = new MultipartBody.Builder().setType(MultipartBody.FORM);
        params.forEach(multipart::addFormDataPart);
        files.forEach((key, file) -> multipart.addFormDataPart(
                key, file.getName(), RequestBody.create(file.getContent(), OCTET_STREAM)));
        return multipart.build();
    }

    String generateSignature(String method, Map<String, byte[]> params) {
        StringBuilder prefix = new StringBuilder(PREFIX_LENGTH);
        for (int i = 0; i < PREFIX_LENGTH; i++) {
            prefix.append((char) ('a' + random.nextInt(26)));
        }
        return prefix + signatureHash(prefix.toString(), method, params);
    }

    String signatureHash(String prefix, String method, Map<String, byte[]> params) {
        List<byte[][]> ordered = new ArrayList<>();
        params.forEach((key, value) -> ordered.add(new byte[][] {key.getBytes(StandardCharsets.UTF_8), value}));
        ordered.sort((a, b) -> {
            int byKey = Arrays.compareUnsigned(a[0], b[0]);
            return byKey != 0 ? byKey : Arrays.compareUnsigned(a[1], b[1]);
        });

        ByteArrayOutputStream source = new ByteArrayOutputStream();
        source.writeBytes((prefix + "/" + method + "?").getBytes(StandardCharsets.UTF_8));
        for (int i = 0; i < ordered.size(); i++) {
            if (i > 0) {
                source.write('&');
            }
            source.writeBytes(ordered.get(i)[0]);
            source.write('=');
            source.writeBytes(ordered.get(i)[1]);
        }
        source.writeBytes(("#" + secret).getBytes(StandardCharsets.UTF_8));

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(source.toByteArray()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 is not available", e);
        }
    }

    /**
     * A file sent as a multipart part.
     */
    @Value
    public static class FilePart {
        String name;
        byte[] content;
    }
}
