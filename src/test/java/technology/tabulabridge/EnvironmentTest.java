package technology.tabulabridge;

import java.nio.charset.Charset;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import technology.tabulabridge.backend.EngineConfig;
import technology.tabulabridge.backend.ProcessLauncher;
import technology.tabulabridge.backend.ProcessResult;
import technology.tabulabridge.errors.EngineNotFoundException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class EnvironmentTest {

    @Mock
    private ProcessLauncher launcher;

    private final EngineConfig config = EngineConfig.builder().jarPath("tabula.jar").build();

    @Test
    public void testInfo_IncludesJavaVersionOutput() throws Exception {
        when(launcher.launch(Arrays.asList("java", "-version"))).thenReturn(new ProcessResult(0, new byte[0],
                "openjdk version \"17.0.2\"".getBytes(Charset.defaultCharset())));

        String info = Environment.info(config, launcher);

        assertTrue(info.contains("openjdk version \"17.0.2\""));
        assertTrue(info.contains("tabula-java version: " + EngineConfig.TABULA_JAVA_VERSION));
        assertTrue(info.contains(System.getProperty("os.name")));
    }

    @Test
    public void testInfo_JavaNotFound() throws Exception {
        when(launcher.launch(Arrays.asList("java", "-version"))).thenThrow(new EngineNotFoundException("missing"));

        String info = Environment.info(config, launcher);

        assertTrue(info.contains("command is not found"));
    }
}
