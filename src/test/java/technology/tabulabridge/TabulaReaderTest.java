package technology.tabulabridge;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import technology.tabulabridge.backend.BackendDispatcher;
import technology.tabulabridge.backend.EngineConfig;
import technology.tabulabridge.errors.EngineExecutionException;
import technology.tabulabridge.errors.TableParseException;
import technology.tabulabridge.io.InputSource;
import technology.tabulabridge.table.HeaderPolicy;
import technology.tabulabridge.table.Table;
import technology.tabulabridge.table.TypedTable;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class TabulaReaderTest {

    private static final String JSON_OUTPUT = "[{\"extraction_method\":\"lattice\",\"page_number\":1,\"data\":["
            + "[{\"text\":\"Name\"},{\"text\":\"Age\"}],[{\"text\":\"Ann\"},{\"text\":\"31\"}]]},"
            + "{\"extraction_method\":\"lattice\",\"page_number\":2,\"data\":["
            + "[{\"text\":\"Bob\"},{\"text\":\"40\"}]]}]";

    @Mock
    private BackendDispatcher dispatcher;

    @TempDir
    Path dir;

    private Path pdf;
    private TabulaReader reader;
    private final EngineConfig config = EngineConfig.builder().jarPath("tabula.jar").build();

    @BeforeEach
    public void setUp() throws IOException {
        pdf = Files.write(dir.resolve("sample.pdf"), "%PDF-1.4".getBytes(StandardCharsets.US_ASCII));
        reader = new TabulaReader(dispatcher, config);
    }

    @Test
    public void testReadPdf_MultipleTablesUsesJson() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenReturn(JSON_OUTPUT);

        List<TypedTable> tables = reader.readPdf(InputSource.of(pdf), ExtractionOption.builder().pages("all").build());

        ArgumentCaptor<ExtractionOption> captor = ArgumentCaptor.forClass(ExtractionOption.class);
        verify(dispatcher).invoke(captor.capture(), eq(pdf), eq(config));
        assertEquals(OutputFormat.JSON, captor.getValue().getFormat());

        assertEquals(2, tables.size());
        assertEquals(Arrays.asList("Name", "Age"), tables.get(0).getColumns());
        assertEquals(31L, tables.get(0).get(0, "Age"));
        assertEquals(Arrays.asList("0", "1"), tables.get(1).getColumns());
    }

    @Test
    public void testReadPdf_SingleTableUsesCsv() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenReturn("Name,Age\nAnn,31\nBob,40\n");
        ExtractionOption option = ExtractionOption.builder().pages(1).multipleTables(false).build();

        List<TypedTable> tables = reader.readPdf(InputSource.of(pdf), option);

        assertEquals(1, tables.size());
        assertEquals(2, tables.get(0).getRowCount());
        assertEquals(Arrays.asList(31L, 40L), tables.get(0).getColumn("Age"));
    }

    @Test
    public void testReadPdf_SingleTableWithRaggedRows() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenReturn("Name,Age\nAnn,31,x\n");
        ExtractionOption option = ExtractionOption.builder().pages(1).multipleTables(false).build();

        assertThrows(TableParseException.class, () -> reader.readPdf(InputSource.of(pdf), option));
    }

    @Test
    public void testReadPdf_EmptyOutputIsEmptyList() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenReturn("");

        List<TypedTable> tables = reader.readPdf(InputSource.of(pdf), ExtractionOption.builder().pages(1).build());

        assertTrue(tables.isEmpty());
    }

    @Test
    public void testReadPdf_ExplicitColumns() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenReturn(JSON_OUTPUT);
        ReadOptions readOptions = ReadOptions.builder().columns("name", "age").build();

        List<TypedTable> tables = reader.readPdf(InputSource.of(pdf), ExtractionOption.builder().pages("all").build(),
                readOptions);

        assertEquals(2, tables.get(0).getRowCount());
        assertEquals("Bob", tables.get(1).get(0, "name"));
    }

    @Test
    public void testReadPdf_MissingFile() {
        Path missing = dir.resolve("missing.pdf");

        assertThrows(NoSuchFileException.class,
                () -> reader.readPdf(InputSource.of(missing), ExtractionOption.builder().pages(1).build()));
        verifyNoInteractions(dispatcher);
    }

    @Test
    public void testReadPdf_EmptyFile() throws Exception {
        Path empty = Files.createFile(dir.resolve("empty.pdf"));

        assertThrows(IllegalArgumentException.class,
                () -> reader.readPdf(InputSource.of(empty), ExtractionOption.builder().pages(1).build()));
        verifyNoInteractions(dispatcher);
    }

    @Test
    public void testReadPdf_EngineFailurePropagates() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenThrow(new EngineExecutionException(1, "boom"));

        assertThrows(EngineExecutionException.class,
                () -> reader.readPdf(InputSource.of(pdf), ExtractionOption.builder().pages(1).build()));
    }

    @Test
    public void testReadPdfJson_ReturnsRawTables() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenReturn(JSON_OUTPUT);

        List<Table> tables = reader.readPdfJson(InputSource.of(pdf), ExtractionOption.builder().pages("all").build());

        assertEquals(2, tables.size());
        assertEquals(2, tables.get(1).getPageNumber());
    }

    @Test
    public void testReadPdfWithTemplate_ReadsEachGroup() throws Exception {
        Path template = Files.write(dir.resolve("template.json"), ("["
                + "{\"page\":1,\"extraction_method\":\"lattice\",\"x1\":10,\"y1\":20,\"x2\":110,\"y2\":220},"
                + "{\"page\":1,\"extraction_method\":\"lattice\",\"x1\":10,\"y1\":300,\"x2\":110,\"y2\":500},"
                + "{\"page\":2,\"extraction_method\":\"stream\",\"x1\":0,\"y1\":0,\"x2\":100,\"y2\":50}"
                + "]").getBytes(StandardCharsets.UTF_8));
        when(dispatcher.invoke(any(), eq(pdf), eq(config)))
                .thenReturn("[{\"data\":[[{\"text\":\"a\"}],[{\"text\":\"1\"}]]}]");
        ExtractionOption override = ExtractionOption.builder().password("pw").build();

        List<TypedTable> tables = reader.readPdfWithTemplate(InputSource.of(pdf), InputSource.of(template),
                override, ReadOptions.builder().header(HeaderPolicy.none()).build());

        assertEquals(2, tables.size());
        ArgumentCaptor<ExtractionOption> captor = ArgumentCaptor.forClass(ExtractionOption.class);
        verify(dispatcher, times(2)).invoke(captor.capture(), eq(pdf), eq(config));
        ExtractionOption first = captor.getAllValues().get(0);
        assertEquals("1", first.getPages().toOptionValue());
        assertEquals(2, first.getAreas().size());
        assertEquals("pw", first.getPassword());
        assertTrue(captor.getAllValues().get(1).isStream());
    }

    @Test
    public void testReadPdfWithTemplate_StreamInputLocalizedOnce() throws Exception {
        Path template = Files.write(dir.resolve("template.json"), ("["
                + "{\"page\":1,\"extraction_method\":\"lattice\",\"x1\":10,\"y1\":20,\"x2\":110,\"y2\":220},"
                + "{\"page\":2,\"extraction_method\":\"stream\",\"x1\":0,\"y1\":0,\"x2\":100,\"y2\":50}"
                + "]").getBytes(StandardCharsets.UTF_8));
        when(dispatcher.invoke(any(), any(), eq(config)))
                .thenReturn("[{\"data\":[[{\"text\":\"a\"}],[{\"text\":\"1\"}]]}]");
        InputSource input = InputSource.of(new ByteArrayInputStream("%PDF-1.4".getBytes(StandardCharsets.US_ASCII)));

        List<TypedTable> tables = reader.readPdfWithTemplate(input, InputSource.of(template), null,
                ReadOptions.builder().header(HeaderPolicy.none()).build());

        assertEquals(2, tables.size());
        ArgumentCaptor<Path> paths = ArgumentCaptor.forClass(Path.class);
        verify(dispatcher, times(2)).invoke(any(), paths.capture(), eq(config));
        Path localized = paths.getAllValues().get(0);
        assertEquals(localized, paths.getAllValues().get(1));
        assertFalse(Files.exists(localized));
    }

    @Test
    public void testReadPdfWithTemplate_TemporaryInputDeletedOnFailure() throws Exception {
        Path template = Files.write(dir.resolve("template.json"),
                "[{\"page\":1,\"extraction_method\":\"guess\",\"x1\":10,\"y1\":20,\"x2\":110,\"y2\":220}]"
                        .getBytes(StandardCharsets.UTF_8));
        when(dispatcher.invoke(any(), any(), eq(config))).thenThrow(new EngineExecutionException(1, "boom"));
        InputSource input = InputSource.of(new ByteArrayInputStream("%PDF-1.4".getBytes(StandardCharsets.US_ASCII)));

        assertThrows(EngineExecutionException.class, () -> reader.readPdfWithTemplate(input,
                InputSource.of(template), null, ReadOptions.defaults()));

        ArgumentCaptor<Path> paths = ArgumentCaptor.forClass(Path.class);
        verify(dispatcher).invoke(any(), paths.capture(), eq(config));
        assertFalse(Files.exists(paths.getValue()));
    }

    @Test
    public void testConvertInto_SetsOutputPathAndFormat() throws Exception {
        when(dispatcher.invoke(any(), eq(pdf), eq(config))).thenReturn("");

        reader.convertInto(InputSource.of(pdf), "out.tsv", OutputFormat.TSV, ExtractionOption.builder().pages(1).build());

        ArgumentCaptor<ExtractionOption> captor = ArgumentCaptor.forClass(ExtractionOption.class);
        verify(dispatcher).invoke(captor.capture(), eq(pdf), eq(config));
        assertEquals("out.tsv", captor.getValue().getOutputPath());
        assertEquals(OutputFormat.TSV, captor.getValue().getFormat());
    }

    @Test
    public void testConvertInto_EmptyOutputPath() {
        assertThrows(IllegalArgumentException.class, () -> reader.convertInto(InputSource.of(pdf), "",
                OutputFormat.CSV, ExtractionOption.builder().pages(1).build()));
        verifyNoInteractions(dispatcher);
    }

    @Test
    public void testConvertIntoByBatch_PassesNoInputFile() throws Exception {
        reader.convertIntoByBatch(dir, OutputFormat.JSON, ExtractionOption.builder().pages("all").build());

        ArgumentCaptor<ExtractionOption> captor = ArgumentCaptor.forClass(ExtractionOption.class);
        verify(dispatcher).invoke(captor.capture(), isNull(), eq(config));
        assertEquals(dir.toString(), captor.getValue().getBatch());
        assertEquals(OutputFormat.JSON, captor.getValue().getFormat());
    }

    @Test
    public void testConvertIntoByBatch_NotADirectory() {
        assertThrows(IllegalArgumentException.class,
                () -> reader.convertIntoByBatch(pdf, OutputFormat.CSV, ExtractionOption.builder().build()));
        verifyNoInteractions(dispatcher);
    }
}
