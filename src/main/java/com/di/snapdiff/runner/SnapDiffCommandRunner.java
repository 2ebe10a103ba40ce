package com.di.snapdiff.runner;

import com.di.snapdiff.config.SnapDiffProperties;
import com.di.snapdiff.discovery.DirtyPartition;
import com.di.snapdiff.discovery.DiscoveryReport;
import com.di.snapdiff.discovery.DiscoveryService;
import com.di.snapdiff.discovery.PartitionPlan;
import com.di.snapdiff.discovery.PartitionPlanner;
import com.di.snapdiff.exception.ErrorCategory;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestRegistry;
import com.di.snapdiff.manifest.ManifestStatus;
import com.di.snapdiff.manifest.PartitionKey;
import com.di.snapdiff.promotion.PromotionOutcome;
import com.di.snapdiff.promotion.PromotionService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line surface. The first non-option argument is the command:
 * <pre>
 * discover --snapshot-version=V
 * evaluate --layer=L --snapshot-version=V --source=S --entity=E --partition=P --input=rows.jsonl [--reference=name=file.txt ...]
 * plan     [--layer=L]
 * list     --layer=L --status=S
 * </pre>
 * Exit codes: 0 success (partial promotion included), 2 configuration or usage error, 3 manifest
 * conflict, 4 every evaluated partition rejected, 1 anything else.
 */
@Slf4j
@Component
public class SnapDiffCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFLICT = 3;
    public static final int EXIT_ALL_REJECTED = 4;

    private static final ObjectMapper JSON = new ObjectMapper().registerModule(new JavaTimeModule());
    private static final TypeReference<LinkedHashMap<String, Object>> ROW = new TypeReference<>() {
    };

    private final DiscoveryService discovery;
    private final PromotionService promotion;
    private final PartitionPlanner planner;
    private final ManifestRegistry registry;
    private final Layer defaultLayer;

    private PrintStream out = System.out;
    private int exitCode = EXIT_OK;

    public SnapDiffCommandRunner(DiscoveryService discovery, PromotionService promotion, PartitionPlanner planner,
                                 ManifestRegistry registry, SnapDiffProperties properties) {
        this.discovery = discovery;
        this.promotion = promotion;
        this.planner = planner;
        this.registry = registry;
        this.defaultLayer = properties.getDiscovery().getDiscoveryLayer();
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    int execute(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            out.println(usage());
            return ErrorCategory.USAGE_ERROR.getExitCode();
        }
        String command = commands.get(0);
        try {
            return switch (command) {
                case "discover" -> discover(args);
                case "evaluate" -> evaluate(args);
                case "plan" -> plan(args);
                case "list" -> list(args);
                default -> throw new IllegalArgumentException("Unknown command '" + command + "'\n" + usage());
            };
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            log.error("[CLI] {} failed [{}]: {}", command, category.getName(), e.getMessage());
            log.debug("[CLI] {} stack trace", command, e);
            return category.getExitCode();
        }
    }

    private int discover(ApplicationArguments args) {
        String version = required(args, "snapshot-version");
        DiscoveryReport report = discovery.run(version);
        for (DirtyPartition p : report.getDirtySet().getPartitions()) {
            out.println(p.key());
        }
        out.printf("snapshot=%s dirty=%d new=%d changed=%d clean=%d deleted=%d conflicts=%d integrity=%d%n",
                version, report.getDirtySet().size(), report.getNewCount(), report.getDirtyCount(),
                report.getCleanCount(), report.getDeleted().size(), report.getConflicts().size(),
                report.getIntegrityFlagged().size());
        if (report.hasConflicts()) {
            report.getConflicts().forEach((k, why) -> log.error("[CLI] conflict on {}: {}", k, why));
            return EXIT_CONFLICT;
        }
        return EXIT_OK;
    }

    private int evaluate(ApplicationArguments args) {
        Layer layer = Layer.parse(required(args, "layer"));
        String version = required(args, "snapshot-version");
        PartitionKey key = PartitionKey.of(required(args, "source"), required(args, "entity"), required(args, "partition"));
        List<Map<String, Object>> rows = readRows(Paths.get(required(args, "input")));
        Map<String, Set<String>> references = readReferences(args.getOptionValues("reference"));

        PromotionOutcome o = promotion.evaluate(layer, version, key, rows, references);
        out.printf("%s layer=%s state=%s dq_level=%s rows_in=%d rows_out=%d quarantined=%d%n",
                o.getKey(), o.getLayer(), o.getState(), o.getDqLevel(), o.getRowsIn(), o.getRowsOut(), o.getQuarantined());
        return o.isPromoted() ? EXIT_OK : EXIT_ALL_REJECTED;
    }

    private int plan(ApplicationArguments args) {
        Layer layer = args.containsOption("layer") ? Layer.parse(required(args, "layer")) : defaultLayer;
        List<PartitionPlan> plans = planner.plan(layer);
        for (PartitionPlan p : plans) {
            out.printf("%s %s%n", p.getEntry().getKey(), p.getEntry().getStatus());
            p.inputFiles().forEach(f -> out.println("  " + f));
        }
        out.printf("layer=%s dirty=%d%n", layer, plans.size());
        return EXIT_OK;
    }

    private int list(ApplicationArguments args) {
        Layer layer = Layer.parse(required(args, "layer"));
        ManifestStatus status = parseStatus(required(args, "status"));
        List<PartitionKey> keys = registry.listByStatus(layer, status);
        keys.forEach(out::println);
        out.printf("layer=%s status=%s count=%d%n", layer, status, keys.size());
        return EXIT_OK;
    }

    private static ManifestStatus parseStatus(String value) {
        try {
            return ManifestStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown status '" + value + "'", e);
        }
    }

    private static String required(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0) == null || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Missing required option --" + option);
        }
        return values.get(0).trim();
    }

    static List<Map<String, Object>> readRows(Path file) {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    rows.add(JSON.readValue(line, ROW));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rows from " + file, e);
        }
        return rows;
    }

    /** {@code name=path} pairs; each file holds one value per line. */
    static Map<String, Set<String>> readReferences(List<String> specs) {
        Map<String, Set<String>> refs = new LinkedHashMap<>();
        if (specs == null) {
            return refs;
        }
        for (String spec : specs) {
            int eq = spec.indexOf('=');
            if (eq <= 0 || eq == spec.length() - 1) {
                throw new IllegalArgumentException("Expected --reference=name=file but got '" + spec + "'");
            }
            Path file = Paths.get(spec.substring(eq + 1));
            Set<String> values = new LinkedHashSet<>();
            try {
                for (String v : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                    if (!v.isBlank()) values.add(v.trim());
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read reference file " + file, e);
            }
            refs.put(spec.substring(0, eq), values);
        }
        return refs;
    }

    static String usage() {
        return String.join("\n",
                "usage:",
                "  discover --snapshot-version=V",
                "  evaluate --layer=L --snapshot-version=V --source=S --entity=E --partition=P --input=rows.jsonl [--reference=name=file.txt ...]",
                "  plan [--layer=L]",
                "  list --layer=L --status=S");
    }
}
