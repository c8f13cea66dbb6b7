package technology.tabulabridge.table;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import technology.tabulabridge.OutputFormat;
import technology.tabulabridge.errors.TableParseException;

/**
 * 解析 {@code --format CSV} / {@code --format TSV} 的输出。
 *
 * 引擎把所有表格依次写成连续的记录，因此整个输出解析为一张表格；空行被跳过。
 */
public class CSVTableReader implements TableReader {

    public static final CSVFormat CSV_FORMAT = CSVFormat.EXCEL.builder()
            .setIgnoreEmptyLines(true)
            .build();

    public static final CSVFormat TSV_FORMAT = CSVFormat.TDF.builder()
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(false)
            .build();

    private final CSVFormat format;

    public CSVTableReader() {
        this(CSV_FORMAT);
    }

    public CSVTableReader(CSVFormat format) {
        this.format = format;
    }

    /**
     * @param format CSV 或 TSV
     * @throws IllegalArgumentException 传入 JSON
     */
    public static CSVTableReader forFormat(OutputFormat format) {
        switch (format) {
            case CSV:
                return new CSVTableReader(CSV_FORMAT);
            case TSV:
                return new CSVTableReader(TSV_FORMAT);
            default:
                throw new IllegalArgumentException("Not a delimited format: " + format);
        }
    }

    public CSVFormat getFormat() {
        return format;
    }

    @Override
    public List<Table> read(String output) throws TableParseException {
        Table table = new Table("");
        try (CSVParser parser = CSVParser.parse(output, format)) {
            for (CSVRecord record : parser) {
                List<Cell> row = new ArrayList<>(record.size());
                for (String value : record) {
                    row.add(Cell.of(value));
                }
                table.addRow(row);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new TableParseException("Failed to parse " + (format == TSV_FORMAT ? "TSV" : "CSV")
                    + " output of tabula-java", e);
        }
        List<Table> tables = new ArrayList<>();
        tables.add(table);
        return tables;
    }
}
