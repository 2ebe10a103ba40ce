package com.di.snapdiff.config;

import com.di.snapdiff.manifest.Layer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for all engine configuration.
 *
 * <pre>
 * snapdiff:
 *   raw-root: ./data/raw
 *   routing-file: classpath:routing.yml
 *   dq-rules-file: classpath:dq-rules.yml
 *   dq-summary-dir: ./data/dq
 *   discovery:
 *     max-workers: 8
 *     verify-declared-hashes: false
 *   hashing:
 *     row-order-insensitive-extensions: csv,jsonl,ndjson
 *   manifest:
 *     store: jdbc
 *     max-conflict-retries: 3
 *     datasource:
 *       url: jdbc:h2:file:./warehouse/snapdiff
 *   promotion:
 *     gated-layers: SILVER,GOLD
 * </pre>
 *
 * <p>Bound values are validated at startup; an invalid value fails the context.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "snapdiff")
public class SnapDiffProperties {

    /** Root directory of raw snapshots: {@code {raw-root}/{source}/date={version}/...}. */
    @NotBlank
    private String rawRoot = "./data/raw";

    @NotBlank
    private String routingFile = "classpath:routing.yml";

    private String dqRulesFile = "classpath:dq-rules.yml";

    /** Where per-partition DQ summary JSON files are written. Blank disables the artifact. */
    private String dqSummaryDir = "./data/dq";

    @Valid
    private Discovery discovery = new Discovery();
    @Valid
    private Hashing hashing = new Hashing();
    @Valid
    private Manifest manifest = new Manifest();
    @Valid
    private Promotion promotion = new Promotion();
    private Lineage lineage = new Lineage();

    @Data
    public static class Discovery {
        /** Thread pool size for hashing and manifest writes. */
        @Min(1)
        private int maxWorkers = 8;

        /** Recompute hashes even when the sidecar declares one, and flag disagreements. */
        private boolean verifyDeclaredHashes = false;

        /** Layer whose manifest entries discovery maintains. */
        @NotNull
        private Layer discoveryLayer = Layer.BRONZE;
    }

    @Data
    public static class Hashing {
        /** Line-delimited formats hashed as an unordered set of lines. */
        @NotNull
        private List<String> rowOrderInsensitiveExtensions = new ArrayList<>(List.of("csv", "jsonl", "ndjson"));
    }

    @Data
    public static class Manifest {
        /** {@code memory} or {@code jdbc}. */
        private String store = "jdbc";

        /** Re-read and retry attempts after the first conflicting write. */
        @Min(0)
        private int maxConflictRetries = 3;

        @Valid
        private Datasource datasource = new Datasource();
    }

    @Data
    public static class Datasource {
        @NotBlank
        private String url = "jdbc:h2:file:./warehouse/snapdiff;AUTO_SERVER=TRUE";
        private String username = "sa";
        private String password = "";
        private String driverClassName = "org.h2.Driver";
        @Min(1)
        private int maximumPoolSize = 8;
    }

    @Data
    public static class Promotion {
        /** Layers where a CRITICAL result blocks promotion. Others always promote. */
        @NotNull
        private List<Layer> gatedLayers = new ArrayList<>(List.of(Layer.SILVER, Layer.GOLD));
    }

    @Data
    public static class Lineage {
        private boolean jdbcEnabled = true;
    }
}
