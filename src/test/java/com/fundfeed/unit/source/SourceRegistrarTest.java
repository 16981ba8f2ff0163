package com.fundfeed.unit.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fundfeed.config.SourceConfig;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.provider.ProviderAdapter;
import com.fundfeed.provider.ProviderCatalog;
import com.fundfeed.source.SourceRegistrar;
import com.fundfeed.source.SourceRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/** Unit tests for SourceRegistrar: provider modes, priority overrides and unconfigured adapters. */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SourceRegistrarTest {

    @Mock
    private SourceRegistry sourceRegistry;

    private SourceConfig sourceConfig;
    private ProviderAdapter<?> push2;
    private ProviderAdapter<?> tushare;
    private ProviderAdapter<?> fundgz;

    @BeforeEach
    void setUp() {
        sourceConfig = new SourceConfig();
        push2 = adapter("eastmoney_push2", DataType.SECTOR_FLOW, 100, true);
        tushare = adapter("tushare", DataType.SECTOR_FLOW, 90, true);
        fundgz = adapter("eastmoney_fundgz", DataType.FUND_REALTIME, 100, true);
    }

    private static ProviderAdapter<?> adapter(String name, DataType dataType, int priority, boolean configured) {
        ProviderAdapter<?> adapter = mock(ProviderAdapter.class);
        when(adapter.sourceName()).thenReturn(name);
        when(adapter.dataType()).thenReturn(dataType);
        when(adapter.defaultPriority()).thenReturn(priority);
        when(adapter.isConfigured()).thenReturn(configured);
        return adapter;
    }

    private SourceRegistrar registrar(ProviderAdapter<?>... adapters) {
        return new SourceRegistrar(sourceRegistry, new ProviderCatalog(List.of(adapters)), sourceConfig);
    }

    @Test
    @DisplayName("Auto mode registers every configured adapter with its default priority")
    void autoRegistersAll() {
        int registered = registrar(push2, tushare, fundgz).registerAll();

        assertThat(registered).isEqualTo(3);
        verify(sourceRegistry).register(DataType.SECTOR_FLOW, "eastmoney_push2", 100);
        verify(sourceRegistry).register(DataType.SECTOR_FLOW, "tushare", 90);
        verify(sourceRegistry).register(DataType.FUND_REALTIME, "eastmoney_fundgz", 100);
    }

    @Test
    @DisplayName("Adapter missing its credential is never registered")
    void unconfiguredSkipped() {
        ProviderAdapter<?> noToken = adapter("tushare", DataType.SECTOR_FLOW, 90, false);

        int registered = registrar(push2, noToken).registerAll();

        assertThat(registered).isEqualTo(1);
        verify(sourceRegistry, never()).register(eq(DataType.SECTOR_FLOW), eq("tushare"), anyInt());
    }

    @Test
    @DisplayName("Named provider mode registers only that source for its data type")
    void namedModeRestricts() {
        sourceConfig.getProviders().put("sector-flow", "tushare");

        registrar(push2, tushare, fundgz).registerAll();

        verify(sourceRegistry).register(DataType.SECTOR_FLOW, "tushare", 90);
        verify(sourceRegistry, never()).register(eq(DataType.SECTOR_FLOW), eq("eastmoney_push2"), anyInt());
        verify(sourceRegistry).register(DataType.FUND_REALTIME, "eastmoney_fundgz", 100);
    }

    @Test
    @DisplayName("Mode naming no known source registers nothing for that data type")
    void unknownModeRegistersNothing() {
        sourceConfig.getProviders().put("sector_flow", "akshare");

        int registered = registrar(push2, tushare).registerAll();

        assertThat(registered).isZero();
        verify(sourceRegistry, never()).register(eq(DataType.SECTOR_FLOW), anyString(), anyInt());
    }

    @Test
    @DisplayName("Configured priority overrides the adapter default")
    void priorityOverride() {
        sourceConfig.getPriorities().put("tushare", 120);

        registrar(push2, tushare).registerAll();

        verify(sourceRegistry).register(DataType.SECTOR_FLOW, "tushare", 120);
    }
}
