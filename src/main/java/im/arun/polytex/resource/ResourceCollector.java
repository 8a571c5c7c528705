package im.arun.polytex.resource;

import im.arun.polytex.model.StatementResource;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the images of one document and hands out {@code \includegraphics} directives for them.
 * <p>
 * Resources are keyed by file name and the first registration of a name wins: a later image with
 * the same name is referenced but its bytes are not stored. Every failure (missing file, failed
 * download, undecodable bytes) is logged and degrades the output instead of aborting conversion.
 * A collector belongs to exactly one document and is not thread-safe.
 */
public class ResourceCollector {
    private static final Logger logger = LoggerFactory.getLogger(ResourceCollector.class);

    private final Path baseDir;
    private final ImageFetcher imageFetcher;
    private final Map<String, StatementResource> resources = new LinkedHashMap<>();

    public ResourceCollector(Path baseDir, ImageFetcher imageFetcher) {
        this.baseDir = baseDir;
        this.imageFetcher = imageFetcher;
    }

    /**
     * Register the image behind {@code src} and build the directive that includes it.
     *
     * @param src    local path relative to the base directory, or an http(s) URL
     * @param inline true for a bare inclusion usable inside a formula, false for a centered block
     * @return the directive, or empty when the image could not be obtained
     */
    public Optional<String> addImage(String src, boolean inline) {
        if (src == null || src.isBlank()) {
            return Optional.empty();
        }

        String name;
        byte[] content;
        if (isRemote(src)) {
            HttpUrl url = HttpUrl.parse(src.strip());
            if (url == null) {
                logger.warn("Skipping image with malformed URL '{}'", src);
                return Optional.empty();
            }
            name = remoteName(url);
            try {
                content = imageFetcher.fetch(url);
            } catch (IOException e) {
                logger.warn("Failed to download image '{}': {}", src, e.getMessage());
                return Optional.empty();
            }
        } else {
            Path imagePath = resolveLocal(src);
            if (imagePath == null || !Files.isRegularFile(imagePath)) {
                logger.warn("Image '{}' not found on disk", src);
                return Optional.empty();
            }
            name = imagePath.getFileName().toString();
            try {
                content = Files.readAllBytes(imagePath);
            } catch (IOException e) {
                logger.warn("Failed to read image '{}': {}", imagePath, e.getMessage());
                return Optional.empty();
            }
        }

        int[] dimensions = readDimensions(name, content);
        if (!resources.containsKey(name)) {
            resources.put(name, dimensions != null
                    ? new StatementResource(name, content, dimensions[0], dimensions[1])
                    : new StatementResource(name, content));
        } else {
            logger.debug("Resource {} already registered, keeping the first copy", name);
        }

        return Optional.of(directive(name, dimensions, inline));
    }

    /**
     * Resources registered so far, in registration order.
     */
    public List<StatementResource> resources() {
        return new ArrayList<>(resources.values());
    }

    private static boolean isRemote(String src) {
        String lower = src.strip().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private String remoteName(HttpUrl url) {
        List<String> segments = url.pathSegments();
        String last = segments.isEmpty() ? "" : segments.get(segments.size() - 1);
        if (last.isEmpty()) {
            return "image_" + (resources.size() + 1) + ".png";
        }
        return last;
    }

    private Path resolveLocal(String src) {
        try {
            return baseDir.resolve(src.strip()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            logger.debug("Unusable image path '{}': {}", src, e.getMessage());
            return null;
        }
    }

    /**
     * Pixel width and height read from the image header, or null when no reader accepts the bytes.
     */
    private int[] readDimensions(String name, byte[] content) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            Iterator<ImageReader> readers = input != null ? ImageIO.getImageReaders(input) : null;
            if (readers == null || !readers.hasNext()) {
                logger.warn("Failed to read image size of {}: unsupported format", name);
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new int[] {reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to read image size of {}: {}", name, e.getMessage());
            return null;
        }
    }

    private static String directive(String name, int[] dimensions, boolean inline) {
        String options = dimensions != null
                ? String.format("[bb=0 0 %d %d]", dimensions[0], dimensions[1])
                : "";
        String include = "\\includegraphics" + options + "{" + name + "}";
        if (inline) {
            return include;
        }
        return "\n\\begin{center}\n  " + include + "\n\\end{center}\n";
    }
}
