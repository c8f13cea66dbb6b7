package technology.tabulabridge.template;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import technology.tabulabridge.Area;
import technology.tabulabridge.ExtractionOption;

/**
 * 把模板选区归并为最少的抽取调用。
 *
 * <p>
 * 按 (页码, 抽取方法) 分组：同一页同一方法的多个选区合并为一次多区域调用（多个 {@code --area}），
 * 并标记为多区域请求；单个选区对应一次普通调用。输出顺序先按页码、再按方法名排序，与输入顺序无关。
 * </p>
 */
public final class TemplateMerger {

    /**
     * 先按页码，再按方法名排序；排序是稳定的，同组内保持输入顺序。
     */
    static final Comparator<TemplateRegion> PAGE_THEN_METHOD = Comparator
            .comparingInt(TemplateRegion::getPage)
            .thenComparing(r -> r.getMethod().getTemplateName());

    private TemplateMerger() {
    }

    public static List<ExtractionOption> expand(List<TemplateRegion> regions) {
        List<TemplateRegion> sorted = new ArrayList<>(regions);
        sorted.sort(PAGE_THEN_METHOD);

        Map<String, List<TemplateRegion>> groups = new LinkedHashMap<>();
        for (TemplateRegion r : sorted) {
            groups.computeIfAbsent(r.getPage() + "/" + r.getMethod(), k -> new ArrayList<>()).add(r);
        }

        List<ExtractionOption> options = new ArrayList<>(groups.size());
        for (List<TemplateRegion> group : groups.values()) {
            options.add(toOption(group));
        }
        return options;
    }

    private static ExtractionOption toOption(List<TemplateRegion> group) {
        TemplateRegion first = group.get(0);
        ExtractionOption.Builder builder = ExtractionOption.builder().pages(first.getPage());
        first.getMethod().apply(builder);

        List<Area> areas = new ArrayList<>(group.size());
        for (TemplateRegion r : group) {
            areas.add(r.toArea());
        }
        builder.areas(areas);
        if (group.size() > 1) {
            // 多个矩形合在一起视为一张逻辑表格
            builder.multipleAreas(true).multipleTables(true);
        }
        return builder.build();
    }
}
