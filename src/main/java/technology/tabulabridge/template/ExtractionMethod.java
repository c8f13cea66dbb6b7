package technology.tabulabridge.template;

import java.util.Locale;

import technology.tabulabridge.ExtractionOption;

/**
 * 模板中每个选区使用的抽取方法，对应 Tabula 应用导出的 {@code extraction_method} 字段。
 */
public enum ExtractionMethod {
    GUESS("guess"),
    LATTICE("lattice"),
    STREAM("stream");

    private final String templateName;

    ExtractionMethod(String templateName) {
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }

    /**
     * 将方法对应的开关写入 builder：guess / lattice / stream 三者之一。
     */
    void apply(ExtractionOption.Builder builder) {
        switch (this) {
            case GUESS:
                builder.guess(true);
                break;
            case LATTICE:
                builder.guess(false).lattice(true);
                break;
            case STREAM:
                builder.guess(false).stream(true);
                break;
        }
    }

    /**
     * @return 对应的方法；名称未知时返回 null
     */
    public static ExtractionMethod fromTemplateName(String name) {
        if (name == null) {
            return null;
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (ExtractionMethod m : values()) {
            if (m.templateName.equals(n)) {
                return m;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return templateName;
    }
}
