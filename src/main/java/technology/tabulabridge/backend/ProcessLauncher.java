package technology.tabulabridge.backend;

import java.io.IOException;
import java.util.List;

/**
 * 启动子进程并等待其结束。
 */
public interface ProcessLauncher {

    /**
     * @param command 完整命令行，第一个元素为可执行文件
     * @return 退出码及捕获的标准输出、标准错误
     * @throws technology.tabulabridge.errors.EngineNotFoundException 可执行文件不存在
     * @throws IOException                                            读写进程输出失败
     */
    ProcessResult launch(List<String> command) throws IOException;
}
