package technology.tabulabridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 页码选择，对应 tabula 的 {@code --pages} 参数。
 *
 * <p>
 * 支持四种形式：全部页面（{@code all}）、单页、逗号/区间字符串（如 {@code "1-2,3"}，原样传递给引擎）
 * 以及显式页码列表（渲染为 {@code "1,2,5"}）。
 * </p>
 */
public final class PageSelection {

    private static final String ALL_PAGES = "all";

    private final String value;
    private final List<Integer> pages;

    private PageSelection(String value, List<Integer> pages) {
        this.value = value;
        this.pages = pages;
    }

    public static PageSelection all() {
        return new PageSelection(ALL_PAGES, null);
    }

    /**
     * 单页选择。页码 0 视为未设置，返回空选择。
     */
    public static PageSelection of(int page) {
        if (page == 0) {
            return new PageSelection("", Collections.<Integer>emptyList());
        }
        return new PageSelection(Integer.toString(page), Collections.singletonList(page));
    }

    public static PageSelection of(Integer... pages) {
        List<Integer> list = new ArrayList<>(pages.length);
        Collections.addAll(list, pages);
        return of(list);
    }

    public static PageSelection of(List<Integer> pages) {
        StringBuilder sb = new StringBuilder();
        for (Integer page : pages) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(page);
        }
        return new PageSelection(sb.toString(), Collections.unmodifiableList(new ArrayList<>(pages)));
    }

    /**
     * 由原始字符串构造，例如 {@code "all"}、{@code "3"}、{@code "1-2,3"}。
     */
    public static PageSelection parse(String value) {
        Objects.requireNonNull(value, "value");
        String trimmed = value.trim();
        if (ALL_PAGES.equalsIgnoreCase(trimmed)) {
            return all();
        }
        return new PageSelection(trimmed, null);
    }

    public boolean isAll() {
        return ALL_PAGES.equals(value);
    }

    /**
     * 空选择（空字符串或空列表）在合并与渲染时等同于未设置。
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * @return 显式页码列表；字符串形式的选择返回 null
     */
    public List<Integer> getPages() {
        return pages;
    }

    /**
     * @return {@code --pages} 的参数值
     */
    public String toOptionValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageSelection)) return false;
        return value.equals(((PageSelection) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
