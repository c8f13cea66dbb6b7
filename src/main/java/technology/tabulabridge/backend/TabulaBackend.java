package technology.tabulabridge.backend;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

import technology.tabulabridge.ExtractionOption;

/**
 * 调用 tabula-java 引擎的一种方式。
 *
 * @see EmbeddedTabula
 * @see SubprocessTabula
 */
public interface TabulaBackend extends Closeable {

    /**
     * 以给定参数运行一次引擎。
     *
     * @param option 抽取参数
     * @param input  输入 PDF；batch 模式下为 null
     * @return 引擎的文本输出（CSV、TSV 或 JSON）
     * @throws IOException 引擎无法启动或执行失败
     */
    String call(ExtractionOption option, Path input) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
