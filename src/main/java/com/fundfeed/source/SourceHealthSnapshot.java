package com.fundfeed.source;

import com.fundfeed.domain.enums.CircuitState;
import com.fundfeed.domain.enums.DataType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Point-in-time copy of a {@link SourceHealth}, safe to hand out of the registry. */
@Value
@Builder
public class SourceHealthSnapshot {

    DataType dataType;
    String name;
    int priority;
    int failCount;
    Instant lastFailAt;
    CircuitState state;
    boolean available;
}
