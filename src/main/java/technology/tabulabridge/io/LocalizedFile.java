package technology.tabulabridge.io;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 本地可读的输入文件。临时文件在 {@link #close()} 时删除。
 */
public class LocalizedFile implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LocalizedFile.class);

    private final Path path;
    private final boolean temporary;

    public LocalizedFile(Path path, boolean temporary) {
        this.path = path;
        this.temporary = temporary;
    }

    public Path getPath() {
        return path;
    }

    public boolean isTemporary() {
        return temporary;
    }

    @Override
    public void close() throws IOException {
        if (temporary) {
            Files.deleteIfExists(path);
            logger.debug("deleted temporary file {}", path);
        }
    }
}
