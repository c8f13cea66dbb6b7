package technology.tabulabridge.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * 将 {@link InputSource} 转换为本地文件。
 *
 * <p>
 * 本地路径原样返回；URL 用 OkHttp 下载到临时文件；流复制到临时文件。
 * 临时文件由返回的 {@link LocalizedFile} 在关闭时删除，应配合 try-with-resources 使用。
 * 下载或复制失败时已创建的临时文件会被立即删除。
 * </p>
 */
public class InputLocalizer {

    private static final Logger logger = LoggerFactory.getLogger(InputLocalizer.class);

    public static final String PDF_SUFFIX = ".pdf";
    public static final String JSON_SUFFIX = ".json";

    private final OkHttpClient client;

    public InputLocalizer() {
        this(new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(300, TimeUnit.SECONDS)
                .followRedirects(true)
                .build());
    }

    public InputLocalizer(OkHttpClient client) {
        this.client = client;
    }

    /**
     * @param source    输入
     * @param userAgent 下载时使用的 User-Agent，可以为 null
     * @param suffix    临时文件的扩展名
     * @return 本地文件
     * @throws IOException 下载失败（包括非 2xx 响应）或写临时文件失败
     */
    public LocalizedFile localize(InputSource source, String userAgent, String suffix) throws IOException {
        switch (source.getKind()) {
        case URL:
            return download(source, userAgent, suffix);
        case STREAM:
            return copy(source.getStream(), suffix);
        default:
            return new LocalizedFile(source.getPath(), false);
        }
    }

    private LocalizedFile download(InputSource source, String userAgent, String suffix) throws IOException {
        Request.Builder request = new Request.Builder().url(source.getUrl());
        if (userAgent != null && !userAgent.isEmpty()) {
            request.header("User-Agent", userAgent);
        }
        logger.debug("downloading {}", source);
        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("failed to download " + source + ": HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("failed to download " + source + ": empty response body");
            }
            try (InputStream in = body.byteStream()) {
                return copy(in, suffix);
            }
        }
    }

    private LocalizedFile copy(InputStream in, String suffix) throws IOException {
        Path tmp = Files.createTempFile("tabula-", suffix);
        try {
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return new LocalizedFile(tmp, true);
    }
}
