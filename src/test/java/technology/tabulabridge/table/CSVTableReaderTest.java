package technology.tabulabridge.table;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import technology.tabulabridge.OutputFormat;

import static org.junit.jupiter.api.Assertions.*;

public class CSVTableReaderTest {

    @Test
    public void testRead_CsvIsOneTable() throws Exception {
        String output = "Name,,Age\r\n\"Smith, J\",x,31\r\n\r\nAnn,,\r\n";

        List<Table> tables = CSVTableReader.forFormat(OutputFormat.CSV).read(output);

        assertEquals(1, tables.size());
        Table table = tables.get(0);
        assertEquals(3, table.getRowCount());
        assertEquals(Arrays.asList(Cell.of("Smith, J"), Cell.of("x"), Cell.of("31")), table.getRows().get(1));
        assertEquals(Arrays.asList(Cell.of("Ann"), Cell.EMPTY, Cell.EMPTY), table.getRows().get(2));
    }

    @Test
    public void testRead_Tsv() throws Exception {
        List<Table> tables = CSVTableReader.forFormat(OutputFormat.TSV).read("a\tb\n1\t2\n");

        assertEquals(Arrays.asList(Cell.of("1"), Cell.of("2")), tables.get(0).getRows().get(1));
    }

    @Test
    public void testRead_RaggedRowsKeepTheirWidth() throws Exception {
        Table table = new CSVTableReader().read("a,b\n1,2,3\n").get(0);

        assertEquals(3, table.getColCount());
        assertEquals(2, table.getRowWidth(0));
        assertEquals(3, table.getRowWidth(1));
        assertTrue(table.isRagged());
    }

    @Test
    public void testForFormat_JsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CSVTableReader.forFormat(OutputFormat.JSON));
    }
}
