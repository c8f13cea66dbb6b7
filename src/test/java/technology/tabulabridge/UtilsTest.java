package technology.tabulabridge;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    public void testFormatNumber_ShortestForm() {
        assertEquals("10", Utils.formatNumber(10f));
        assertEquals("12.1", Utils.formatNumber(12.1f));
        assertEquals("0", Utils.formatNumber(0f));
        assertEquals("561", Utils.formatNumber(561f));
    }

    @Test
    public void testRound_HalfUp() {
        assertEquals(1.235f, Utils.round(1.2345, 3));
        assertEquals(2.0f, Utils.round(1.9996, 3));
    }

    @Test
    public void testSplitArguments_Quotes() {
        assertEquals(Arrays.asList("-Xmx256m", "-Dname=a b"), Utils.splitArguments("-Xmx256m \"-Dname=a b\""));
        assertTrue(Utils.splitArguments("  ").isEmpty());
        assertTrue(Utils.splitArguments(null).isEmpty());
    }

    @Test
    public void testPageSelection() {
        assertEquals("1,2,3", PageSelection.of(1, 2, 3).toOptionValue());
        assertTrue(PageSelection.parse("ALL").isAll());
        assertEquals(PageSelection.parse("1-2,3"), PageSelection.parse(" 1-2,3 "));
    }

    @Test
    public void testOutputFormat_Parse() {
        assertEquals(OutputFormat.JSON, OutputFormat.parse("json"));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.parse("xlsx"));
    }
}
