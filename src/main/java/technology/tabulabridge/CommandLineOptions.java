package technology.tabulabridge;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import technology.tabulabridge.errors.InvalidAreaException;

/**
 * tabula-java 的命令行语法，以及从参数列表还原 {@link ExtractionOption} 的解析器。
 *
 * <p>
 * 选项定义与引擎的 {@code CommandLineApp.buildOptions()} 保持一致，
 * 因此 {@link ExtractionOption#buildOptionList()} 的输出可以被原样解析回来。
 * 原始参数字符串（{@code options}）与 {@code multipleTables} 不出现在参数列表中，无法还原。
 * </p>
 */
public final class CommandLineOptions {

    private CommandLineOptions() {
    }

    public static Options buildOptions() {
        Options o = new Options();

        o.addOption("v", "version", false, "Print version and exit.");
        o.addOption("h", "help", false, "Print this help text.");
        o.addOption("g", "guess", false, "Guess the portion of the page to analyze per page.");
        o.addOption("r", "spreadsheet", false, "[Deprecated in favor of -l/--lattice] Force PDF to be extracted using spreadsheet-style extraction (if there are ruling lines separating each cell, as in a PDF of an Excel spreadsheet)");
        o.addOption("n", "no-spreadsheet", false, "[Deprecated in favor of -t/--stream] Force PDF not to be extracted using spreadsheet-style extraction (if there are no ruling lines separating each cell)");
        o.addOption("l", "lattice", false, "Force PDF to be extracted using lattice-mode extraction (if there are ruling lines separating each cell, as in a PDF of an Excel spreadsheet)");
        o.addOption("t", "stream", false, "Force PDF to be extracted using stream-mode extraction (if there are no ruling lines separating each cell)");
        o.addOption("i", "silent", false, "Suppress all stderr output.");
        o.addOption("u", "use-line-returns", false, "Use embedded line returns in cells. (Only in spreadsheet mode.)");
        o.addOption(Option.builder("b")
                .longOpt("batch")
                .desc("Convert all .pdfs in the provided directory.")
                .hasArg()
                .argName("DIRECTORY")
                .build());
        o.addOption(Option.builder("o")
                .longOpt("outfile")
                .desc("Write output to <file> instead of STDOUT. Default: -")
                .hasArg()
                .argName("OUTFILE")
                .build());
        o.addOption(Option.builder("f")
                .longOpt("format")
                .desc("Output format: (CSV,TSV,JSON). Default: CSV")
                .hasArg()
                .argName("FORMAT")
                .build());
        o.addOption(Option.builder("s")
                .longOpt("password")
                .desc("Password to decrypt document. Default is empty")
                .hasArg()
                .argName("PASSWORD")
                .build());
        o.addOption(Option.builder("c")
                .longOpt("columns")
                .desc("X coordinates of column boundaries. Example --columns 10.1,20.2,30.3. "
                        + "If all values are between 0-100 (inclusive) and preceded by '%', input will be taken as % of actual width of the page.")
                .hasArg()
                .argName("COLUMNS")
                .build());
        o.addOption(Option.builder("a")
                .longOpt("area")
                .desc("-a/--area = Portion of the page to analyze. Example: --area 269.875,12.75,790.5,561. "
                        + "If all values are between 0-100 (inclusive) and preceded by '%', input will be taken as % of actual height or width of the page. "
                        + "Example: --area %0,0,100,50. To specify multiple areas, -a option should be repeated.")
                .hasArg()
                .argName("AREA")
                .build());
        o.addOption(Option.builder("p")
                .longOpt("pages")
                .desc("Comma separated list of ranges, or all. Examples: --pages 1-3,5-7, --pages 3 or --pages all. Default is --pages 1")
                .hasArg()
                .argName("PAGES")
                .build());

        return o;
    }

    /**
     * 解析参数列表。
     *
     * @param args 参数列表，可以包含引擎接受的其他选项以及输入文件路径
     * @return 等价的 {@link ExtractionOption}
     * @throws ParseException 参数不符合引擎的语法，或区域/列的数值无法解析
     */
    public static ExtractionOption parse(List<String> args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine line = parser.parse(buildOptions(), args.toArray(new String[0]));
        return toExtractionOption(line);
    }

    static ExtractionOption toExtractionOption(CommandLine line) throws ParseException {
        ExtractionOption.Builder b = ExtractionOption.builder();

        if (line.hasOption('p')) {
            b.pages(PageSelection.parse(line.getOptionValue('p')));
        }

        boolean relativeArea = false;
        List<Area> areas = new ArrayList<>();
        if (line.hasOption('a')) {
            for (String value : line.getOptionValues('a')) {
                if (value.startsWith("%")) {
                    relativeArea = true;
                    value = value.substring(1);
                }
                try {
                    areas.add(Area.of(parseFloatList(value)));
                } catch (InvalidAreaException e) {
                    throw new ParseException(e.getMessage());
                }
            }
        }
        b.areas(areas);
        b.relativeArea(relativeArea);

        b.lattice(line.hasOption('l') || line.hasOption('r'));
        b.stream(line.hasOption('t') || line.hasOption('n'));
        b.guess(line.hasOption('g'));

        if (line.hasOption('f')) {
            try {
                b.format(OutputFormat.parse(line.getOptionValue('f')));
            } catch (IllegalArgumentException e) {
                throw new ParseException(e.getMessage());
            }
        }
        if (line.hasOption('o')) {
            b.outputPath(line.getOptionValue('o'));
        }
        if (line.hasOption('c')) {
            String value = line.getOptionValue('c');
            if (value.startsWith("%")) {
                b.relativeColumns(true);
                value = value.substring(1);
            }
            b.columns(parseFloatList(value));
        }
        if (line.hasOption('s')) {
            b.password(line.getOptionValue('s'));
        }
        if (line.hasOption('b')) {
            b.batch(line.getOptionValue('b'));
        }
        b.silent(line.hasOption('i'));

        return b.build();
    }

    private static List<Float> parseFloatList(String option) throws ParseException {
        try {
            return Utils.parseFloatList(option);
        } catch (NumberFormatException e) {
            throw new ParseException("Wrong number syntax: " + option);
        }
    }

}
