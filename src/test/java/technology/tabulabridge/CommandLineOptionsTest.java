package technology.tabulabridge;

import java.util.Arrays;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CommandLineOptionsTest {

    @Test
    public void testParse_RoundTrip() throws Exception {
        ExtractionOption option = ExtractionOption.builder()
                .pages("1-2,3")
                .addArea(new Area(12.1f, 20.5f, 30.1f, 50.2f))
                .addArea(new Area(1.0f, 3.2f, 10.5f, 40.2f))
                .lattice(true)
                .format(OutputFormat.TSV)
                .outputPath("out.tsv")
                .columns(10.1f, 20.2f, 30.3f)
                .password("pw")
                .silent(true)
                .build();

        assertEquals(option, CommandLineOptions.parse(option.buildOptionList()));
    }

    @Test
    public void testParse_RoundTripWithGuessAndRelativeColumns() throws Exception {
        ExtractionOption option = ExtractionOption.builder()
                .allPages()
                .stream(true)
                .columns(10f, 50f, 90f)
                .relativeColumns(true)
                .build();

        ExtractionOption parsed = CommandLineOptions.parse(option.buildOptionList());

        assertEquals(option, parsed);
        assertTrue(parsed.isGuess());
        assertTrue(parsed.isRelativeColumns());
    }

    @Test
    public void testParse_RelativeArea() throws Exception {
        ExtractionOption parsed = CommandLineOptions.parse(Arrays.asList("--area", "%0,0,100,50", "-p", "2"));

        assertTrue(parsed.isRelativeArea());
        assertEquals(new Area(0, 0, 100, 50), parsed.getAreas().get(0));
        assertEquals("2", parsed.getPages().toOptionValue());
    }

    @Test
    public void testParse_DeprecatedSpreadsheetFlagMeansLattice() throws Exception {
        ExtractionOption parsed = CommandLineOptions.parse(Arrays.asList("-r"));
        assertTrue(parsed.isLattice());
        assertFalse(parsed.isStream());
    }

    @Test
    public void testParse_InvalidArea() {
        assertThrows(ParseException.class,
                () -> CommandLineOptions.parse(Arrays.asList("--area", "10,10,5,50")));
    }

    @Test
    public void testParse_UnknownFormat() {
        assertThrows(ParseException.class,
                () -> CommandLineOptions.parse(Arrays.asList("--format", "XLSX")));
    }
}
