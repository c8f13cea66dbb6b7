package technology.tabulabridge;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.text.StringTokenizer;
import org.apache.commons.text.matcher.StringMatcherFactory;

/**
 * 参数渲染与解析用到的小工具。
 */
public final class Utils {

    private Utils() {
    }

    /**
     * 四舍五入到指定的小数位数（half-up）。
     *
     * @param d           原始值
     * @param decimalPlace 保留的小数位数
     * @return 舍入后的 float
     */
    public static float round(double d, int decimalPlace) {
        BigDecimal bd = new BigDecimal(Double.toString(d));
        bd = bd.setScale(decimalPlace, RoundingMode.HALF_UP);
        return bd.floatValue();
    }

    /**
     * 以最短的十进制形式输出数值：{@code 10.0f -> "10"}，{@code 12.1f -> "12.1"}。
     */
    public static String formatNumber(float value) {
        if (Float.isNaN(value) || Float.isInfinite(value)) {
            return Float.toString(value);
        }
        BigDecimal bd = new BigDecimal(Float.toString(value)).stripTrailingZeros();
        return bd.toPlainString();
    }

    /**
     * 逗号连接一组数值；relative 为 true 时加上 {@code %} 前缀。
     */
    public static String formatNumbers(float[] values, boolean relative) {
        StringBuilder sb = new StringBuilder();
        if (relative) {
            sb.append('%');
        }
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(formatNumber(values[i]));
        }
        return sb.toString();
    }

    public static String formatNumbers(List<Float> values, boolean relative) {
        float[] f = new float[values.size()];
        for (int i = 0; i < f.length; i++) {
            f[i] = values.get(i);
        }
        return formatNumbers(f, relative);
    }

    /**
     * 解析逗号分隔的数值列表，如 {@code "10.1,20.2,30.3"}。
     *
     * @throws NumberFormatException 当某一项不是数值时
     */
    public static List<Float> parseFloatList(String option) {
        String[] f = option.split(",");
        List<Float> rv = new ArrayList<>(f.length);
        for (String s : f) {
            rv.add(Float.parseFloat(s.trim()));
        }
        return rv;
    }

    /**
     * 按 shell 规则切分参数字符串：以空白分隔，单双引号内的空白保留。
     *
     * @param arguments 形如 {@code "--pages 1 --password 'a b'"} 的字符串，可以为 null
     * @return 参数列表，输入为空时返回空列表
     */
    public static List<String> splitArguments(String arguments) {
        if (arguments == null || arguments.trim().isEmpty()) {
            return new ArrayList<>();
        }
        StringTokenizer tokenizer = new StringTokenizer(arguments);
        tokenizer.setQuoteMatcher(StringMatcherFactory.INSTANCE.quoteMatcher());
        tokenizer.setIgnoreEmptyTokens(true);
        return new ArrayList<>(tokenizer.getTokenList());
    }

}
