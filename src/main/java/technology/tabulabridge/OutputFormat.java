package technology.tabulabridge;

import java.util.Locale;

/**
 * 引擎的输出格式（{@code --format}）。
 */
public enum OutputFormat {
    CSV,
    TSV,
    JSON;

    /**
     * 不区分大小写地解析格式名。
     *
     * @throws IllegalArgumentException 未知格式
     */
    public static OutputFormat parse(String name) {
        if (name != null) {
            for (OutputFormat format : values()) {
                if (format.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + name);
    }
}
