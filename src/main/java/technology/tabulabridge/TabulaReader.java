package technology.tabulabridge;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.tabulabridge.backend.BackendDispatcher;
import technology.tabulabridge.backend.EngineConfig;
import technology.tabulabridge.io.InputLocalizer;
import technology.tabulabridge.io.InputSource;
import technology.tabulabridge.io.LocalizedFile;
import technology.tabulabridge.table.CSVTableReader;
import technology.tabulabridge.table.JSONTableReader;
import technology.tabulabridge.table.ResultMaterializer;
import technology.tabulabridge.table.Table;
import technology.tabulabridge.table.TypedTable;
import technology.tabulabridge.template.TemplateLoader;
import technology.tabulabridge.template.TemplateMerger;

/**
 * 从 PDF 中读取表格的入口。
 *
 * <pre>
 * try (BackendDispatcher dispatcher = new BackendDispatcher()) {
 *     TabulaReader reader = new TabulaReader(dispatcher, EngineConfig.defaults());
 *     List&lt;TypedTable&gt; tables = reader.readPdf(InputSource.of("data.pdf"),
 *             ExtractionOption.builder().allPages().build(), ReadOptions.defaults());
 * }
 * </pre>
 *
 * 所有参数校验都在调用引擎之前完成。dispatcher 由调用方创建并共享，本类不持有其生命周期。
 */
public class TabulaReader {

    private static final Logger logger = LoggerFactory.getLogger(TabulaReader.class);

    private final BackendDispatcher dispatcher;
    private final EngineConfig config;
    private final InputLocalizer localizer;

    public TabulaReader(BackendDispatcher dispatcher, EngineConfig config) {
        this(dispatcher, config, new InputLocalizer());
    }

    public TabulaReader(BackendDispatcher dispatcher, EngineConfig config, InputLocalizer localizer) {
        this.dispatcher = dispatcher;
        this.config = config;
        this.localizer = localizer;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * 读取表格并整理为 {@link TypedTable}。
     *
     * <p>
     * multipleTables 为 true，或输出格式为 JSON 时，引擎以 JSON 输出，每张表格单独整理；
     * 否则以 CSV（或指定的 TSV）输出，整个输出整理为一张表格。
     * 引擎输出为空时记录警告并返回空列表。
     * </p>
     *
     * @throws NoSuchFileException             输入文件不存在
     * @throws IllegalArgumentException        输入文件为空
     * @throws technology.tabulabridge.errors.TableParseException 输出无法整理为表格
     * @throws IOException                     引擎无法启动或执行失败
     */
    public List<TypedTable> readPdf(InputSource input, ExtractionOption option, ReadOptions readOptions)
            throws IOException {
        try (LocalizedFile file = localize(input, readOptions.getUserAgent())) {
            return read(file.getPath(), option, readOptions);
        }
    }

    private List<TypedTable> read(Path path, ExtractionOption option, ReadOptions readOptions) throws IOException {
        boolean json = option.isMultipleTables() || option.getFormat() == OutputFormat.JSON;
        ExtractionOption effective = json ? option.toBuilder().format(OutputFormat.JSON).build() : option;

        String output = dispatcher.invoke(effective, path, config);
        if (output.isEmpty()) {
            logger.warn("The output file is empty.");
            return new ArrayList<>();
        }

        List<Table> tables;
        if (json) {
            tables = new JSONTableReader().read(output);
        } else {
            OutputFormat format = effective.getFormat() == null ? OutputFormat.CSV : effective.getFormat();
            tables = CSVTableReader.forFormat(format).read(output);
        }
        return new ResultMaterializer(readOptions.isCoerceNumbers())
                .materialize(tables, readOptions.getHeader(), readOptions.getColumns());
    }

    public List<TypedTable> readPdf(InputSource input, ExtractionOption option) throws IOException {
        return readPdf(input, option, ReadOptions.defaults());
    }

    /**
     * 以 JSON 格式运行引擎，返回未经整理的表格（保留空单元格、页码与抽取方法）。
     */
    public List<Table> readPdfJson(InputSource input, ExtractionOption option) throws IOException {
        ExtractionOption effective = option.toBuilder().format(OutputFormat.JSON).build();
        String output = run(input, effective, null);
        if (output.isEmpty()) {
            logger.warn("The output file is empty.");
            return new ArrayList<>();
        }
        return new JSONTableReader().read(output);
    }

    /**
     * 使用 Tabula 应用导出的模板读取表格。
     *
     * <p>
     * 模板按（页码，抽取方法）分组，每组运行一次引擎，结果按组的顺序拼接。
     * override 中设置的值优先于模板中的值；任一次运行失败即中止。
     * 输入只本地化一次，各组共用同一个文件。
     * </p>
     *
     * @param template 模板文件，可以是本地路径或 URL
     * @param override 覆盖模板的参数，可以为 null
     */
    public List<TypedTable> readPdfWithTemplate(InputSource input, InputSource template, ExtractionOption override,
            ReadOptions readOptions) throws IOException {
        List<ExtractionOption> planned;
        try (LocalizedFile file = localizer.localize(template, readOptions.getUserAgent(),
                InputLocalizer.JSON_SUFFIX)) {
            planned = TemplateMerger.expand(TemplateLoader.load(file.getPath()));
        }

        ExtractionOption base = override == null ? ExtractionOption.builder().build() : override;
        List<TypedTable> rv = new ArrayList<>();
        try (LocalizedFile file = localize(input, readOptions.getUserAgent())) {
            for (ExtractionOption option : planned) {
                rv.addAll(read(file.getPath(), base.merge(option), readOptions));
            }
        }
        return rv;
    }

    /**
     * 由引擎直接写出文件。
     *
     * @throws IllegalArgumentException outputPath 为空
     */
    public void convertInto(InputSource input, String outputPath, OutputFormat format, ExtractionOption option)
            throws IOException {
        if (outputPath == null || outputPath.isEmpty()) {
            throw new IllegalArgumentException("'outputPath' should not be null or empty.");
        }
        ExtractionOption effective = option.toBuilder()
                .outputPath(outputPath)
                .format(format == null ? OutputFormat.CSV : format)
                .build();
        run(input, effective, null);
    }

    /**
     * 转换目录下的所有 PDF，输出文件与 PDF 位于同一目录。
     *
     * @throws IllegalArgumentException inputDir 不是目录
     */
    public void convertIntoByBatch(Path inputDir, OutputFormat format, ExtractionOption option) throws IOException {
        if (inputDir == null || !Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("'inputDir' should be directory path: " + inputDir);
        }
        ExtractionOption effective = option.toBuilder()
                .batch(inputDir.toString())
                .format(format == null ? OutputFormat.CSV : format)
                .build();
        dispatcher.invoke(effective, null, config);
    }

    private String run(InputSource input, ExtractionOption option, String userAgent) throws IOException {
        try (LocalizedFile file = localize(input, userAgent)) {
            return dispatcher.invoke(option, file.getPath(), config);
        }
    }

    /* 本地化输入并检查文件；检查失败时临时文件随即删除 */
    private LocalizedFile localize(InputSource input, String userAgent) throws IOException {
        LocalizedFile file = localizer.localize(input, userAgent, InputLocalizer.PDF_SUFFIX);
        try {
            Path path = file.getPath();
            if (!Files.exists(path)) {
                throw new NoSuchFileException(path.toString());
            }
            if (Files.size(path) == 0) {
                throw new IllegalArgumentException(path + " is empty. Check the file, or download it manually");
            }
            return file;
        } catch (IOException | RuntimeException e) {
            try {
                file.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }
}
