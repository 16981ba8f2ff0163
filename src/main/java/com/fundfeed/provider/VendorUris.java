package com.fundfeed.provider;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.util.UriComponentsBuilder;

/** Builds vendor URLs with strictly encoded query values ({@code +} in a filter becomes {@code %2B}). */
public final class VendorUris {

    private VendorUris() {}

    public static URI build(String base, Map<String, ?> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(base);
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : query.entrySet()) {
            builder.queryParam(entry.getKey(), "{" + entry.getKey() + "}");
            values.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
        }
        return builder.encode().buildAndExpand(values).toUri();
    }

    public static URI build(String base, Map<String, ?> pathVariables, Map<String, ?> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(base);
        Map<String, Object> values = new LinkedHashMap<>(pathVariables);
        for (Map.Entry<String, ?> entry : query.entrySet()) {
            builder.queryParam(entry.getKey(), "{" + entry.getKey() + "}");
            values.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
        }
        return builder.encode().buildAndExpand(values).toUri();
    }
}
