package im.arun.polytex.resource;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Blocking single-attempt image download over OkHttp.
 */
public class OkHttpImageFetcher implements ImageFetcher {
    private static final Logger logger = LoggerFactory.getLogger(OkHttpImageFetcher.class);

    private final OkHttpClient httpClient;

    public OkHttpImageFetcher(int connectTimeoutSeconds, int readTimeoutSeconds) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .build());
    }

    public OkHttpImageFetcher(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public byte[] fetch(HttpUrl url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        logger.debug("Downloading image {}", url);

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " for " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response body for " + url);
            }
            return body.bytes();
        }
    }
}
