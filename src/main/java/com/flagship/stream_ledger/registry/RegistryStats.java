package com.flagship.stream_ledger.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of the registry counters and the known categories.
 */
@Value
public class RegistryStats {

    @JsonProperty("total_streams")
    long totalStreams;

    @JsonProperty("active_streams")
    long activeStreams;

    @JsonProperty("categories")
    List<String> categories;
}
