package com.fundfeed.provider;

import com.fundfeed.domain.enums.DataType;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** All provider adapter beans, looked up by the data type they serve. */
@Component
public class ProviderCatalog {

    private final List<ProviderAdapter<?>> adapters;

    public ProviderCatalog(List<ProviderAdapter<?>> adapters) {
        this.adapters = List.copyOf(adapters);
    }

    public List<ProviderAdapter<?>> all() {
        return adapters;
    }

    /**
     * Adapters for one data type. The caller names the value type the data type carries;
     * every adapter reporting that data type produces it.
     */
    @SuppressWarnings("unchecked")
    public <T> List<ProviderAdapter<T>> forDataType(DataType dataType) {
        return adapters.stream()
                .filter(adapter -> adapter.dataType() == dataType)
                .map(adapter -> (ProviderAdapter<T>) adapter)
                .collect(Collectors.toList());
    }
}
