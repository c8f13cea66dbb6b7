package technology.tabulabridge.io;

import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;

/**
 * 抽取的输入：本地文件、远程 URL 或内存中的流。
 */
public final class InputSource {

    public enum Kind {
        PATH, URL, STREAM
    }

    private final Kind kind;
    private final Path path;
    private final URL url;
    private final InputStream stream;

    private InputSource(Kind kind, Path path, URL url, InputStream stream) {
        this.kind = kind;
        this.path = path;
        this.url = url;
        this.stream = stream;
    }

    public static InputSource of(Path path) {
        return new InputSource(Kind.PATH, Objects.requireNonNull(path, "path"), null, null);
    }

    public static InputSource of(URL url) {
        return new InputSource(Kind.URL, null, Objects.requireNonNull(url, "url"), null);
    }

    /**
     * 调用方负责关闭流。
     */
    public static InputSource of(InputStream stream) {
        return new InputSource(Kind.STREAM, null, null, Objects.requireNonNull(stream, "stream"));
    }

    /**
     * 以 {@code http://}、{@code https://} 或 {@code ftp://} 开头时视为 URL，否则视为本地路径；
     * 路径开头的 {@code ~} 展开为用户主目录。
     */
    public static InputSource of(String pathOrUrl) {
        Objects.requireNonNull(pathOrUrl, "pathOrUrl");
        if (isUrl(pathOrUrl)) {
            try {
                return of(new URL(pathOrUrl));
            } catch (MalformedURLException e) {
                throw new IllegalArgumentException("invalid url: " + pathOrUrl, e);
            }
        }
        return of(Paths.get(expandUser(pathOrUrl)));
    }

    static boolean isUrl(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("ftp://");
    }

    static String expandUser(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    public Kind getKind() {
        return kind;
    }

    public Path getPath() {
        return path;
    }

    public URL getUrl() {
        return url;
    }

    public InputStream getStream() {
        return stream;
    }

    @Override
    public String toString() {
        switch (kind) {
        case PATH:
            return path.toString();
        case URL:
            return url.toString();
        default:
            return "<stream>";
        }
    }
}
