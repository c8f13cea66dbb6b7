package technology.tabulabridge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import technology.tabulabridge.table.HeaderPolicy;

/**
 * 结果整理的参数：表头来源、显式列名、是否转换数值，以及下载远程输入时的 User-Agent。
 */
public final class ReadOptions {

    private static final ReadOptions DEFAULTS = builder().build();

    private final HeaderPolicy header;
    private final List<String> columns;
    private final boolean coerceNumbers;
    private final String userAgent;

    private ReadOptions(Builder builder) {
        this.header = builder.header;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.coerceNumbers = builder.coerceNumbers;
        this.userAgent = builder.userAgent;
    }

    public static ReadOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public HeaderPolicy getHeader() {
        return header;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isCoerceNumbers() {
        return coerceNumbers;
    }

    public String getUserAgent() {
        return userAgent;
    }

    @Override
    public String toString() {
        return "ReadOptions[header=" + header + ",columns=" + columns + ",coerceNumbers=" + coerceNumbers
                + ",userAgent=" + userAgent + "]";
    }

    public static final class Builder {

        private HeaderPolicy header = HeaderPolicy.infer();
        private List<String> columns = new ArrayList<>();
        private boolean coerceNumbers = true;
        private String userAgent;

        private Builder() {
        }

        public Builder header(HeaderPolicy header) {
            this.header = header == null ? HeaderPolicy.infer() : header;
            return this;
        }

        public Builder columns(List<String> columns) {
            this.columns = columns == null ? new ArrayList<>() : new ArrayList<>(columns);
            return this;
        }

        public Builder columns(String... columns) {
            return columns(Arrays.asList(columns));
        }

        public Builder coerceNumbers(boolean coerceNumbers) {
            this.coerceNumbers = coerceNumbers;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public ReadOptions build() {
            return new ReadOptions(this);
        }
    }
}
