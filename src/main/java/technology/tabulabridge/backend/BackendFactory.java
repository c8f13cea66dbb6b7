package technology.tabulabridge.backend;

import java.util.List;

import technology.tabulabridge.errors.EngineUnavailableException;

/**
 * 创建 backend 实例，{@link BackendDispatcher} 通过它选择调用方式。
 */
public interface BackendFactory {

    BackendFactory DEFAULT = new BackendFactory() {

        @Override
        public TabulaBackend createEmbedded(EngineConfig config, List<String> javaOptions, boolean silent)
                throws EngineUnavailableException {
            return new EmbeddedTabula(config, javaOptions, silent);
        }

        @Override
        public SubprocessTabula createSubprocess(EngineConfig config, List<String> javaOptions, boolean silent) {
            return new SubprocessTabula(config, javaOptions, silent);
        }
    };

    /**
     * @throws EngineUnavailableException 无法在进程内加载引擎
     */
    TabulaBackend createEmbedded(EngineConfig config, List<String> javaOptions, boolean silent)
            throws EngineUnavailableException;

    SubprocessTabula createSubprocess(EngineConfig config, List<String> javaOptions, boolean silent);
}
