package technology.tabulabridge.backend;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

import org.apache.commons.cli.Options;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import technology.tabulabridge.ExtractionOption;
import technology.tabulabridge.errors.EngineExecutionException;
import technology.tabulabridge.errors.EngineUnavailableException;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class EmbeddedTabulaTest {

    private static final String PROPERTY = "tabulabridge.test.property";

    /* 与引擎入口同名的最小实现：输出位置参数与页码，页码为 fail 时抛出异常 */
    private static final String ENGINE_SOURCE = String.join("\n",
            "package technology.tabula;",
            "import org.apache.commons.cli.CommandLine;",
            "import org.apache.commons.cli.Options;",
            "public class CommandLineApp {",
            "    private final Appendable out;",
            "    public CommandLineApp(Appendable out, CommandLine line) { this.out = out; }",
            "    public static Options buildOptions() {",
            "        Options o = new Options();",
            "        o.addOption(\"p\", \"pages\", true, \"\");",
            "        o.addOption(\"a\", \"area\", true, \"\");",
            "        o.addOption(\"g\", \"guess\", false, \"\");",
            "        o.addOption(\"l\", \"lattice\", false, \"\");",
            "        o.addOption(\"t\", \"stream\", false, \"\");",
            "        o.addOption(\"f\", \"format\", true, \"\");",
            "        o.addOption(\"o\", \"outfile\", true, \"\");",
            "        o.addOption(\"i\", \"silent\", false, \"\");",
            "        return o;",
            "    }",
            "    public void extractTables(CommandLine line) throws Exception {",
            "        if (\"fail\".equals(line.getOptionValue('p'))) {",
            "            throw new IllegalStateException(\"engine broke\");",
            "        }",
            "        out.append(\"args=\").append(String.join(\"|\", line.getArgList()))",
            "            .append(\";pages=\").append(line.getOptionValue('p'))",
            "            .append(\";guess=\").append(String.valueOf(line.hasOption('g')));",
            "    }",
            "}");

    @TempDir
    Path dir;

    @AfterEach
    public void tearDown() {
        System.clearProperty(PROPERTY);
    }

    @Test
    public void testConstruct_MissingJar() {
        EngineConfig config = EngineConfig.builder().jarPath(dir.resolve("missing.jar")).build();

        assertThrows(EngineUnavailableException.class,
                () -> new EmbeddedTabula(config, Collections.emptyList(), false));
    }

    @Test
    public void testConstruct_JarWithoutEngineClasses() throws Exception {
        Path jar = Files.write(dir.resolve("empty.jar"), new byte[] { 1, 2, 3 });
        EngineConfig config = EngineConfig.builder().jarPath(jar).build();

        EngineUnavailableException e = assertThrows(EngineUnavailableException.class,
                () -> new EmbeddedTabula(config, Collections.emptyList(), false));
        assertNotNull(e.getCause());
    }

    @Test
    public void testApplySystemProperties_SetsDefines() {
        EmbeddedTabula.applySystemProperties(Arrays.asList("-D" + PROPERTY + "=a=b", "-Xmx256m"));

        assertEquals("a=b", System.getProperty(PROPERTY));
    }

    @Test
    public void testApplySystemProperties_DefineWithoutValue() {
        EmbeddedTabula.applySystemProperties(Collections.singletonList("-D" + PROPERTY));

        assertEquals("", System.getProperty(PROPERTY));
    }

    @Test
    public void testCall_PassesInputAsFirstArgument() throws Exception {
        EngineConfig config = EngineConfig.builder().jarPath(buildEngineJar()).build();
        Path input = dir.resolve("in.pdf");

        try (EmbeddedTabula tabula = new EmbeddedTabula(config, Collections.emptyList(), false)) {
            String output = tabula.call(ExtractionOption.builder().pages(2).build(), input);

            assertEquals("args=" + input + ";pages=2;guess=true", output);
        }
    }

    @Test
    public void testCall_OutputBufferIsFreshPerCall() throws Exception {
        EngineConfig config = EngineConfig.builder().jarPath(buildEngineJar()).build();

        try (EmbeddedTabula tabula = new EmbeddedTabula(config, Collections.emptyList(), false)) {
            tabula.call(ExtractionOption.builder().pages(1).build(), dir.resolve("a.pdf"));
            String output = tabula.call(ExtractionOption.builder().pages("all").build(), dir.resolve("b.pdf"));

            assertEquals("args=" + dir.resolve("b.pdf") + ";pages=all;guess=true", output);
        }
    }

    @Test
    public void testCall_EngineFailureIsExecutionException() throws Exception {
        EngineConfig config = EngineConfig.builder().jarPath(buildEngineJar()).build();

        try (EmbeddedTabula tabula = new EmbeddedTabula(config, Collections.emptyList(), false)) {
            EngineExecutionException e = assertThrows(EngineExecutionException.class,
                    () -> tabula.call(ExtractionOption.builder().pages("fail").build(), dir.resolve("in.pdf")));

            assertEquals("java.lang.IllegalStateException", e.getCause().getClass().getName());
            assertEquals("engine broke", e.getCause().getMessage());
        }
    }

    /**
     * 编译 {@link #ENGINE_SOURCE}，与 commons-cli 一起打成 jar。
     */
    private Path buildEngineJar() throws Exception {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assumeTrue(compiler != null, "a JDK is required to compile the engine stub");

        Path cli = Paths.get(Options.class.getProtectionDomain().getCodeSource().getLocation().toURI());
        Path src = Files.createDirectories(dir.resolve("src/technology/tabula"));
        Path source = Files.write(src.resolve("CommandLineApp.java"), ENGINE_SOURCE.getBytes(StandardCharsets.UTF_8));
        Path classes = Files.createDirectories(dir.resolve("classes"));
        int status = compiler.run(null, null, null, "-d", classes.toString(), "-cp", cli.toString(),
                source.toString());
        assertEquals(0, status);

        Path jar = dir.resolve("tabula-stub.jar");
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            addDirectory(out, classes);
            if (Files.isDirectory(cli)) {
                addDirectory(out, cli);
            } else {
                addJar(out, cli);
            }
        }
        return jar;
    }

    private static void addDirectory(JarOutputStream out, Path root) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        }
        for (Path file : files) {
            String name = root.relativize(file).toString().replace('\\', '/');
            if (name.startsWith("META-INF/")) {
                continue;
            }
            out.putNextEntry(new JarEntry(name));
            Files.copy(file, out);
            out.closeEntry();
        }
    }

    private static void addJar(JarOutputStream out, Path jar) throws IOException {
        try (ZipFile zip = new ZipFile(jar.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || entry.getName().startsWith("META-INF/")) {
                    continue;
                }
                out.putNextEntry(new JarEntry(entry.getName()));
                try (InputStream in = zip.getInputStream(entry)) {
                    in.transferTo(out);
                }
                out.closeEntry();
            }
        }
    }
}
