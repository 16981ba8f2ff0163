package com.fundfeed.provider.eastmoney;

import com.fasterxml.jackson.databind.JsonNode;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.FlowPeriod;
import com.fundfeed.domain.enums.SectorKind;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.SectorFlowItem;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.exception.UpstreamRejectedException;
import com.fundfeed.mapper.JsonHelper;
import com.fundfeed.provider.AbstractProviderAdapter;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.VendorUris;
import com.fundfeed.provider.normalize.AmountUnit;
import com.fundfeed.provider.normalize.SectorFlowNormalizer;
import com.fundfeed.provider.normalize.VendorTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Sector fund-flow ranking from the push2 quote-list endpoint.
 *
 * <p>The endpoint answers with numbered fields ({@code f14} name, {@code f62} today's main net
 * inflow, ...) whose meaning depends on the period's sort field. They are renamed to the
 * vendor's own table headers before normalization, so the same column aliases serve this
 * source and the table-based ones. Amounts are plain yuan.
 */
@Component
public class Push2SectorFlowAdapter extends AbstractProviderAdapter<String, List<SectorFlowItem>> {

    public static final String SOURCE_NAME = "eastmoney_push2";

    static final String URL = "https://push2.eastmoney.com/api/qt/clist/get";
    static final String REFERER = "https://data.eastmoney.com/bkzj/hy.html";
    static final String UT = "b2884a393a59ad64002292a3e90d46a5";

    public Push2SectorFlowAdapter(VendorHttpClient vendorHttpClient, RetryPolicy retryPolicy) {
        super(vendorHttpClient, retryPolicy);
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public DataType dataType() {
        return DataType.SECTOR_FLOW;
    }

    @Override
    public int defaultPriority() {
        return 100;
    }

    @Override
    protected String fetchRaw(FetchRequest request) {
        SectorKind kind = SectorKind.valueOf(request.require("kind"));
        FlowPeriod period = FlowPeriod.valueOf(request.require("period"));
        Map<String, String> headers = headersFor(period);

        Map<String, Object> query = new LinkedHashMap<>();
        query.put("pn", 1);
        query.put("pz", 500);
        query.put("po", 1);
        query.put("np", 1);
        query.put("ut", UT);
        query.put("fltt", 2);
        query.put("invt", 2);
        query.put("fid", sortField(period));
        query.put("fs", boardFilter(kind));
        query.put("fields", String.join(",", headers.keySet()));
        return vendorHttpClient.get(VendorUris.build(URL, query), REFERER);
    }

    @Override
    protected List<SectorFlowItem> normalize(String raw, FetchRequest request) {
        FlowPeriod period = FlowPeriod.valueOf(request.require("period"));
        JsonNode root;
        try {
            root = JsonHelper.readTree(raw);
        } catch (IllegalArgumentException e) {
            throw new SchemaException("push2 response is not JSON: " + e.getMessage(), e);
        }
        int rc = root.path("rc").asInt(0);
        if (rc != 0) {
            throw new UpstreamRejectedException("push2 rejected request: rc " + rc);
        }
        JsonNode diff = root.path("data").path("diff");
        if (!diff.isArray()) {
            throw new SchemaException("push2 response has no data.diff array");
        }

        Map<String, String> headers = headersFor(period);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode item : diff) {
            Map<String, Object> row = new LinkedHashMap<>();
            headers.forEach((field, header) -> {
                JsonNode value = item.get(field);
                row.put(header, value == null || value.isNull() ? null : value.asText());
            });
            rows.add(row);
        }
        return SectorFlowNormalizer.normalize(VendorTable.fromRows(rows), period, AmountUnit.YUAN);
    }

    static String boardFilter(SectorKind kind) {
        switch (kind) {
            case CONCEPT:
                return "m:90+t:3";
            case REGION:
                return "m:90+t:1";
            case INDUSTRY:
            default:
                return "m:90+t:2";
        }
    }

    static String sortField(FlowPeriod period) {
        switch (period) {
            case FIVE_DAY:
                return "f164";
            case TEN_DAY:
                return "f174";
            case TODAY:
            default:
                return "f62";
        }
    }

    /** Field code to header, in request order. */
    static Map<String, String> headersFor(FlowPeriod period) {
        String p = period.getLabel();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("f12", "代码");
        headers.put("f14", "名称");
        headers.put("f2", "最新价");
        switch (period) {
            case FIVE_DAY:
                headers.put("f109", p + "涨跌幅");
                headers.put("f164", p + "主力净流入-净额");
                headers.put("f165", p + "主力净流入-净占比");
                headers.put("f166", p + "超大单净流入-净额");
                headers.put("f167", p + "超大单净流入-净占比");
                headers.put("f168", p + "大单净流入-净额");
                headers.put("f169", p + "大单净流入-净占比");
                headers.put("f257", p + "主力净流入最大股");
                break;
            case TEN_DAY:
                headers.put("f160", p + "涨跌幅");
                headers.put("f174", p + "主力净流入-净额");
                headers.put("f175", p + "主力净流入-净占比");
                headers.put("f176", p + "超大单净流入-净额");
                headers.put("f177", p + "超大单净流入-净占比");
                headers.put("f178", p + "大单净流入-净额");
                headers.put("f179", p + "大单净流入-净占比");
                headers.put("f260", p + "主力净流入最大股");
                break;
            case TODAY:
            default:
                headers.put("f3", p + "涨跌幅");
                headers.put("f62", p + "主力净流入-净额");
                headers.put("f184", p + "主力净流入-净占比");
                headers.put("f66", p + "超大单净流入-净额");
                headers.put("f69", p + "超大单净流入-净占比");
                headers.put("f72", p + "大单净流入-净额");
                headers.put("f75", p + "大单净流入-净占比");
                headers.put("f204", p + "主力净流入最大股");
                break;
        }
        return headers;
    }
}
