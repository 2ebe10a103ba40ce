package com.di.snapdiff.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One record of a {@code _dq_summary.json} sidecar written by the snapshot writer.
 * Unknown fields are ignored so newer writers stay readable.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnapshotSummary {

    private String source;

    @JsonProperty("snapshot_version")
    private String snapshotVersion;

    @JsonProperty("cutoff_year")
    private Integer cutoffYear;

    @JsonProperty("start_year")
    private Integer startYear;

    /** Partition file, by basename or path. */
    private String file;

    private Long records;
    private Long bytes;
    private String hash;

    @JsonProperty("duration_sec")
    private Double durationSec;

    @JsonProperty("dq_passed")
    private Boolean dqPassed;

    /** INFO/WARNING/CRITICAL, or legacy MINOR/MAJOR. */
    @JsonProperty("dq_level")
    private String dqLevel;

    @JsonProperty("dq_metrics")
    private Map<String, Object> dqMetrics;

    @JsonProperty("run_id")
    private String runId;

    private String error;
    private String note;
}
