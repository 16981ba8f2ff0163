package com.fundfeed.unit.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fundfeed.domain.enums.FlowPeriod;
import com.fundfeed.domain.model.SectorFlowItem;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.provider.normalize.AmountUnit;
import com.fundfeed.provider.normalize.SectorFlowNormalizer;
import com.fundfeed.provider.normalize.VendorTable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SectorFlowNormalizer: header drift, amount units, derived columns and ranking.
 */
class SectorFlowNormalizerTest {

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @Test
        @DisplayName("Items are sorted by main net inflow descending and ranked from 1")
        void sortsAndRanks() {
            VendorTable table = VendorTable.fromRows(List.of(
                    row("名称", "银行", "今日涨跌幅", "0.50", "今日主力净流入-净额", "3.2亿"),
                    row("名称", "半导体", "今日涨跌幅", "2.10%", "今日主力净流入-净额", "12.98亿"),
                    row("名称", "煤炭", "今日涨跌幅", "-1.2", "今日主力净流入-净额", "-5000万")));

            List<SectorFlowItem> items = SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN);

            assertThat(items).extracting(SectorFlowItem::getName).containsExactly("半导体", "银行", "煤炭");
            assertThat(items).extracting(SectorFlowItem::getRank).containsExactly(1, 2, 3);
            assertThat(items.get(0).getMainNetInflow()).isEqualByComparingTo("1298000000");
            assertThat(items.get(0).getChangePct()).isEqualByComparingTo("2.10");
            assertThat(items.get(2).getMainNetInflow()).isEqualByComparingTo("-50000000");
            assertThat(items.get(0).getUnit()).isEqualTo("CNY");
        }

        @Test
        @DisplayName("Rows with unknown net inflow rank last")
        void missingNetRanksLast() {
            VendorTable table = VendorTable.fromRows(List.of(
                    row("名称", "未知", "主力净流入-净额", "--"),
                    row("名称", "银行", "主力净流入-净额", "-1亿")));

            List<SectorFlowItem> items = SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN);

            assertThat(items).extracting(SectorFlowItem::getName).containsExactly("银行", "未知");
            assertThat(items.get(1).getMainNetInflow()).isNull();
        }

        @Test
        @DisplayName("Rows without a name are dropped")
        void namelessRowsDropped() {
            VendorTable table = VendorTable.fromRows(List.of(
                    row("名称", "--", "主力净流入-净额", "1亿"),
                    row("名称", "银行", "主力净流入-净额", "2亿")));

            assertThat(SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Column Resolution")
    class ColumnResolution {

        @Test
        @DisplayName("Period-prefixed columns win over unprefixed ones")
        void periodPrefixPreferred() {
            VendorTable table = VendorTable.fromRows(List.of(row(
                    "行业", "医药",
                    "主力净流入-净额", "1亿",
                    "5日主力净流入-净额", "4亿",
                    "5日涨跌幅", "3.3",
                    "5日主力净流入-净占比", "1.1%")));

            SectorFlowItem item = SectorFlowNormalizer.normalize(table, FlowPeriod.FIVE_DAY, AmountUnit.YUAN).get(0);

            assertThat(item.getMainNetInflow()).isEqualByComparingTo("400000000");
            assertThat(item.getChangePct()).isEqualByComparingTo("3.3");
            assertThat(item.getMainNetInflowPct()).isEqualByComparingTo("1.1");
        }

        @Test
        @DisplayName("Code column ignores the biggest-inflow-stock column")
        void codeColumn() {
            VendorTable table = VendorTable.fromRows(List.of(row(
                    "代码", "BK0475", "名称", "银行", "今日主力净流入最大股", "600036", "今日主力净流入-净额", "1亿")));

            SectorFlowItem item = SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN).get(0);

            assertThat(item.getCode()).isEqualTo("BK0475");
        }

        @Test
        @DisplayName("Small bare amounts are scaled by the assumed unit")
        void assumedUnit() {
            VendorTable table = VendorTable.fromRows(List.of(row("板块名称", "银行", "主力净流入-净额", "2.5")));

            SectorFlowItem item = SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YI).get(0);

            assertThat(item.getMainNetInflow()).isEqualByComparingTo("250000000");
        }
    }

    @Nested
    @DisplayName("Derived Amounts")
    class DerivedAmounts {

        @Test
        @DisplayName("Net is inflow minus outflow when no net column exists")
        void netFromFlows() {
            VendorTable table = VendorTable.fromRows(List.of(row("名称", "银行", "主力流入", "5亿", "主力流出", "3亿")));

            SectorFlowItem item = SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN).get(0);

            assertThat(item.getMainNetInflow()).isEqualByComparingTo("200000000");
            assertThat(item.getMainInflow()).isEqualByComparingTo("500000000");
            assertThat(item.getMainOutflow()).isEqualByComparingTo("300000000");
        }

        @Test
        @DisplayName("Inflow and outflow are derived from the sign of net when absent")
        void flowsFromNet() {
            VendorTable table = VendorTable.fromRows(List.of(
                    row("名称", "银行", "主力净流入-净额", "2亿"),
                    row("名称", "煤炭", "主力净流入-净额", "-1亿")));

            List<SectorFlowItem> items = SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN);

            assertThat(items.get(0).getMainInflow()).isEqualByComparingTo("200000000");
            assertThat(items.get(0).getMainOutflow()).isEqualByComparingTo("0");
            assertThat(items.get(1).getMainInflow()).isEqualByComparingTo("0");
            assertThat(items.get(1).getMainOutflow()).isEqualByComparingTo("100000000");
        }

        @Test
        @DisplayName("Table with no net and no flow columns is a schema failure")
        void noAmountColumns() {
            VendorTable table = VendorTable.fromRows(List.of(row("名称", "银行", "涨跌幅", "1.0")));

            assertThatThrownBy(() -> SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN))
                    .isInstanceOf(SchemaException.class);
        }

        @Test
        @DisplayName("Table without a name column is a schema failure")
        void noNameColumn() {
            VendorTable table = VendorTable.fromRows(List.of(row("主力净流入-净额", "1亿")));

            assertThatThrownBy(() -> SectorFlowNormalizer.normalize(table, FlowPeriod.TODAY, AmountUnit.YUAN))
                    .isInstanceOf(SchemaException.class);
        }
    }
}
