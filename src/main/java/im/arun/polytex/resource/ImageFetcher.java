package im.arun.polytex.resource;

import okhttp3.HttpUrl;

import java.io.IOException;

/**
 * Downloads remote images referenced from a statement.
 */
public interface ImageFetcher {

    byte[] fetch(HttpUrl url) throws IOException;
}
