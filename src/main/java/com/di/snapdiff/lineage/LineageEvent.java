package com.di.snapdiff.lineage;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * {@code discover} once per entity per discovery run; {@code transform_run} once per gate
 * evaluation.
 */
@Value
@Builder
@Jacksonized
public class LineageEvent {

    public static final String DISCOVER = "discover";
    public static final String TRANSFORM_RUN = "transform_run";

    @JsonProperty("event_id")
    String eventId;
    @JsonProperty("event_time")
    Instant eventTime;
    @JsonProperty("event_type")
    String eventType;
    String layer;
    String entity;
    String grain;
    @JsonProperty("partition_key")
    String partitionKey;
    @JsonProperty("run_id")
    String runId;
    @JsonProperty("snapshot_version")
    String snapshotVersion;
    @Singular
    List<LineageInput> inputs;
    @Singular
    Map<String, Object> metrics;
    @JsonProperty("dq_status")
    String dqStatus;
}
