package com.fundfeed.provider.normalize;

import com.fundfeed.domain.enums.FlowPeriod;
import com.fundfeed.domain.model.SectorFlowItem;
import com.fundfeed.exception.SchemaException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a vendor sector fund-flow table into a ranked list of {@link SectorFlowItem}.
 *
 * <p>Columns are located by alias, with the period-prefixed header tried first
 * (e.g. {@code 5日主力净流入-净额} before {@code 主力净流入-净额}). When the net inflow column
 * is missing it is derived as inflow minus outflow; when inflow and outflow are both missing
 * they are derived from the sign of the net figure. Rows without a name are dropped. The
 * result is sorted by net inflow, largest first, and ranked from 1.
 */
public final class SectorFlowNormalizer {

    private static final Comparator<SectorFlowItem> BY_NET_INFLOW_DESC = Comparator.comparing(
            SectorFlowItem::getMainNetInflow, Comparator.nullsFirst(Comparator.<BigDecimal>naturalOrder()))
            .reversed();

    private SectorFlowNormalizer() {}

    public static List<SectorFlowItem> normalize(VendorTable table, FlowPeriod period, AmountUnit assumedUnit) {
        List<String> columns = table.getColumns();
        String p = period.getLabel();

        String nameCol = ColumnResolver.require(
                columns, ColumnSpec.of("name", "板块名称", "行业名称", "概念名称", "名称", "行业", "概念", "板块"));
        Optional<String> codeCol =
                ColumnResolver.resolve(columns, ColumnSpec.of("code", "板块代码", "代码").exclude("最大股"));
        Optional<String> changeCol = ColumnResolver.resolve(
                columns, ColumnSpec.of("changePct", p + "涨跌幅", "阶段涨跌幅", "涨跌幅").exclude("主力"));
        Optional<String> netCol = ColumnResolver.resolve(
                columns,
                ColumnSpec.of("mainNetInflow", p + "主力净流入-净额", "主力净流入-净额", "主力净流入", "净流入", "净额")
                        .requireAll("主力")
                        .exclude("占比", "%"));
        Optional<String> netPctCol = ColumnResolver.resolve(
                columns,
                ColumnSpec.of("mainNetInflowPct", p + "主力净流入-净占比", "主力净流入-净占比", "净占比", "占比")
                        .requireAll("主力"));
        Optional<String> inflowCol = ColumnResolver.resolve(
                columns,
                ColumnSpec.of("mainInflow", "主力流入", "主力资金流入", "流入").exclude("净", "占比", "%"));
        Optional<String> outflowCol = ColumnResolver.resolve(
                columns,
                ColumnSpec.of("mainOutflow", "主力流出", "主力资金流出", "流出").exclude("净", "占比", "%"));

        if (netCol.isEmpty() && (inflowCol.isEmpty() || outflowCol.isEmpty())) {
            throw new SchemaException("Sector flow table has neither a main net inflow column nor inflow/outflow "
                    + "columns: " + columns);
        }

        List<SectorFlowItem> items = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            Object rawName = row.get(nameCol);
            if (NumericText.isMissing(rawName)) {
                continue;
            }
            BigDecimal net = netCol.map(c -> AmountParser.parse(row.get(c), assumedUnit)).orElse(null);
            BigDecimal inflow = inflowCol.map(c -> AmountParser.parse(row.get(c), assumedUnit)).orElse(null);
            BigDecimal outflow = outflowCol.map(c -> AmountParser.parse(row.get(c), assumedUnit)).orElse(null);

            if (net == null && inflow != null && outflow != null) {
                net = inflow.subtract(outflow);
            }
            if (inflow == null && outflow == null && net != null) {
                inflow = net.signum() > 0 ? net : BigDecimal.ZERO;
                outflow = net.signum() < 0 ? net.negate() : BigDecimal.ZERO;
            }

            items.add(SectorFlowItem.builder()
                    .code(codeCol.map(c -> textOrNull(row.get(c))).orElse(null))
                    .name(rawName.toString().trim())
                    .changePct(changeCol.map(c -> PercentParser.parse(row.get(c))).orElse(null))
                    .mainNetInflow(net)
                    .mainInflow(inflow)
                    .mainOutflow(outflow)
                    .mainNetInflowPct(netPctCol.map(c -> PercentParser.parse(row.get(c))).orElse(null))
                    .build());
        }

        items.sort(BY_NET_INFLOW_DESC);
        List<SectorFlowItem> ranked = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            ranked.add(items.get(i).toBuilder().rank(i + 1).build());
        }
        return ranked;
    }

    private static String textOrNull(Object raw) {
        if (NumericText.isMissing(raw)) {
            return null;
        }
        return raw.toString().trim();
    }
}
