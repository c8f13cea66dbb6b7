package technology.tabulabridge.backend;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.tabulabridge.ExtractionOption;
import technology.tabulabridge.errors.EngineUnavailableException;

/**
 * 选择并持有引擎的调用方式。
 *
 * <p>
 * 状态机：
 * </p>
 * <ul>
 * <li>UNINITIALIZED：首次调用时先尝试进程内加载（{@link EmbeddedTabula}），失败则记录警告并改用子进程；</li>
 * <li>EMBEDDED：之后的调用复用同一个引擎。进程内的 JVM 参数无法更改，传入不同的参数只会得到警告；</li>
 * <li>SUBPROCESS：之后的调用复用同一个 {@link SubprocessTabula}，编码、JVM 参数和 silent 设置原地更新。</li>
 * </ul>
 * <p>
 * {@link EngineConfig#isForceSubprocess()} 为 true 时直接进入 SUBPROCESS。
 * </p>
 *
 * <p>
 * 实例由调用方创建并在多次抽取之间共享。状态的选择与进程内引擎的调用由同一把锁保护；
 * 子进程之间互不共享状态，锁外并发运行。
 * </p>
 */
public class BackendDispatcher implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(BackendDispatcher.class);

    public enum State {
        UNINITIALIZED, EMBEDDED, SUBPROCESS
    }

    private final BackendFactory factory;
    private State state = State.UNINITIALIZED;
    private TabulaBackend backend;
    private Set<String> embeddedJavaOptions;

    public BackendDispatcher() {
        this(BackendFactory.DEFAULT);
    }

    public BackendDispatcher(BackendFactory factory) {
        this.factory = factory;
    }

    /**
     * 运行一次引擎。
     *
     * @param option 抽取参数
     * @param input  输入 PDF；batch 模式下为 null
     * @param config 引擎配置
     * @return 引擎的文本输出
     * @throws IOException 引擎无法启动或执行失败
     */
    public String invoke(ExtractionOption option, Path input, EngineConfig config) throws IOException {
        TabulaBackend selected;
        synchronized (this) {
            selected = select(option, config);
            if (state == State.EMBEDDED) {
                return selected.call(option, input);
            }
        }
        return selected.call(option, input);
    }

    private TabulaBackend select(ExtractionOption option, EngineConfig config) throws IOException {
        List<String> javaOptions = config.buildJavaOptions();
        boolean silent = config.isSilent() || option.isSilent();

        if (config.isForceSubprocess()) {
            useSubprocess(config, javaOptions, silent);
        } else if (state == State.UNINITIALIZED) {
            try {
                backend = factory.createEmbedded(config, javaOptions, silent);
                embeddedJavaOptions = EngineConfig.withoutIgnored(javaOptions);
                state = State.EMBEDDED;
            } catch (EngineUnavailableException e) {
                logger.warn("Error loading tabula-java in-process. Fallback to subprocess.", e);
                useSubprocess(config, javaOptions, silent);
            }
        } else if (state == State.SUBPROCESS) {
            ((SubprocessTabula) backend).update(config.getEncoding(), javaOptions, silent);
        } else if (!EngineConfig.withoutIgnored(javaOptions).equals(embeddedJavaOptions)) {
            logger.warn("java options {} are ignored because tabula-java is already loaded in-process.",
                    config.getJavaOptions());
        }
        return backend;
    }

    private void useSubprocess(EngineConfig config, List<String> javaOptions, boolean silent) throws IOException {
        if (state == State.SUBPROCESS) {
            ((SubprocessTabula) backend).update(config.getEncoding(), javaOptions, silent);
            return;
        }
        if (backend != null) {
            backend.close();
        }
        backend = factory.createSubprocess(config, javaOptions, silent);
        embeddedJavaOptions = null;
        state = State.SUBPROCESS;
    }

    public synchronized State getState() {
        return state;
    }

    @Override
    public synchronized void close() throws IOException {
        if (backend != null) {
            backend.close();
            backend = null;
        }
        state = State.UNINITIALIZED;
    }
}
