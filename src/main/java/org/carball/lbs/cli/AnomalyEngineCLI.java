package org.carball.lbs.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.EngineContext;
import org.carball.lbs.cache.CacheStats;
import org.carball.lbs.cache.ResultCache;
import org.carball.lbs.config.ConfigurationLoader;
import org.carball.lbs.config.EngineConfig;
import org.carball.lbs.config.SensitivityProfile;
import org.carball.lbs.embedding.QueryExampleIndex;
import org.carball.lbs.embedding.SeedExamples;
import org.carball.lbs.exception.UpstreamFailureException;
import org.carball.lbs.model.anomaly.AnomalyFinding;
import org.carball.lbs.model.anomaly.ComparisonType;
import org.carball.lbs.model.anomaly.CompositeDetectionResult;
import org.carball.lbs.model.anomaly.DetectionMethod;
import org.carball.lbs.model.anomaly.DetectionRequest;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.Granularity;
import org.carball.lbs.model.example.ExampleMatch;
import org.carball.lbs.model.example.IndexStats;
import org.carball.lbs.model.example.QueryExample;
import org.carball.lbs.model.query.QueryResult;
import org.carball.lbs.output.DetectionReport;
import org.carball.lbs.output.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class AnomalyEngineCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            LBS Anomaly Detection & Query Engine v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final List<String> CONFIG_PREFIXES = List.of("--detection.", "--cache.", "--llm.", "--warehouse.", "--index.");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            CommandLine command = CommandLine.parse(args);
            ConfigurationLoader loader = new ConfigurationLoader();
            EngineConfig config = command.profile() != null
                    ? loader.loadConfigurationWithProfile(command.profile(), command.configFile(), args)
                    : loader.loadConfiguration(command.configFile(), args);

            try (EngineContext context = EngineContext.create(config)) {
                return dispatch(command, context);
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IllegalStateException e) {
            System.err.println("\n❌ " + e.getMessage());
            log.debug("State error details", e);
            return 1;
        } catch (UpstreamFailureException e) {
            System.err.println("\n❌ Upstream failure: " + e.getMessage());
            log.debug("Upstream failure details", e);
            return 2;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private static int dispatch(CommandLine command, EngineContext context) throws IOException {
        switch (command.name()) {
            case "detect":
                return detect(command, context);
            case "detect-all":
                return detectAll(command, context);
            case "ask":
                return ask(command, context);
            case "examples":
                return examples(command, context.getExampleIndex());
            case "cache":
                return cache(command, context.getResultCache());
            case "profiles":
                System.out.println(SensitivityProfile.getProfileHelp());
                return 0;
            default:
                throw new IllegalArgumentException("Unknown command: " + command.name());
        }
    }

    private static int detect(CommandLine command, EngineContext context) throws IOException {
        DetectionMethod method = DetectionMethod.fromName(command.argument(0, "detection method"));
        DetectionRequest request = buildRequest(method, command.options());

        System.out.println("\n🔍 Running " + method.getDescription().toLowerCase() + " detection...");
        DetectionResult result = context.getDetectionService().detect(request);
        System.out.println("   ✓ " + result.getStatus().getLabel() + (result.isCached() ? " (cached)" : ""));

        printDetectionSummary(result);
        writeReport(new DetectionReport(result), command);
        return 0;
    }

    private static int detectAll(CommandLine command, EngineContext context) throws IOException {
        System.out.println("\n🔍 Running all detectors...");
        CompositeDetectionResult composite = context.getDetectionService().detectAll();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 DETECTION SUMMARY");
        System.out.println("=".repeat(60));
        System.out.println("Status: " + composite.getStatus());
        System.out.println("Detectors run: " + composite.getDetectionMethods());
        System.out.println("Total anomalies: " + composite.getTotalAnomalies());
        composite.getResults().forEach((name, result) ->
                System.out.printf("  %-30s %4d  (%s)%n", name, result.getAnomalyCount(), result.getStatus().getLabel()));
        composite.getErrors().forEach((name, error) ->
                System.out.printf("  %-30s ❌ %s%n", name, error));

        writeReport(new DetectionReport(composite), command);
        return CompositeDetectionResult.FAILED.equals(composite.getStatus()) ? 2 : 0;
    }

    private static int ask(CommandLine command, EngineContext context) throws IOException {
        String question = command.argument(0, "question");
        boolean execute = !command.flag("--no-execute");
        int limit = command.intOption("--limit", context.getConfig().getLlm().getRowLimit());

        System.out.println("\n🤖 Generating SQL...");
        QueryResult result = context.getSqlEngine().query(question, execute, limit);

        System.out.println("\nIntent: " + result.getIntent());
        System.out.println(result.getExplanation());
        System.out.println("\n" + result.getSql());
        if (result.isExecuted()) {
            if (result.isSuccess()) {
                System.out.printf("%n✅ %d rows (retries: %d%s)%n", result.getRowCount(), result.getRetries(),
                        result.isCached() ? ", cached" : "");
            } else {
                System.out.println("\n❌ Query failed after " + result.getRetries() + " retries: " + result.getError());
            }
        }
        writeJson(result, command);
        return result.isSuccess() ? 0 : 2;
    }

    private static int examples(CommandLine command, QueryExampleIndex index) throws IOException {
        String action = command.argument(0, "examples action");
        switch (action) {
            case "add": {
                String id = index.add(command.requiredOption("--question"), command.requiredOption("--sql"),
                        command.options().get("--intent"), Map.of("source", QueryExample.SOURCE_USER));
                System.out.println("✅ Added example " + id);
                return 0;
            }
            case "search": {
                List<ExampleMatch> matches = index.search(command.argument(1, "question"),
                        command.intOption("--k", 5), command.options().get("--intent"));
                if (matches.isEmpty()) {
                    System.out.println("💡 No examples stored.");
                }
                for (ExampleMatch match : matches) {
                    System.out.printf("%.4f  [%s] %s%n", match.distance(), match.example().getIntent(),
                            match.example().getQuestion());
                }
                writeJson(matches, command);
                return 0;
            }
            case "list": {
                for (QueryExample example : index.list()) {
                    System.out.printf("%s  [%s/%s] %s%n", example.getId(), example.getIntent(), example.getSource(),
                            example.getQuestion());
                }
                return 0;
            }
            case "delete": {
                String id = command.argument(1, "example id");
                boolean deleted = index.delete(id);
                System.out.println(deleted ? "✅ Deleted " + id : "💡 No example with id " + id);
                return deleted ? 0 : 1;
            }
            case "clear": {
                index.clear();
                System.out.println("✅ Example index cleared");
                return 0;
            }
            case "seed": {
                int added = SeedExamples.seed(index);
                System.out.println(added > 0 ? "✅ Seeded " + added + " examples" : "💡 Index is not empty, nothing seeded");
                return 0;
            }
            case "stats": {
                IndexStats stats = index.stats();
                System.out.println("Examples: " + stats.totalExamples());
                System.out.println("Embedding model: " + stats.embeddingModel() + " (" + stats.embeddingDimension() + " dimensions)");
                System.out.println("Storage: " + stats.storage());
                stats.intents().forEach((intent, count) -> System.out.printf("  %-20s %d%n", intent, count));
                return 0;
            }
            default:
                throw new IllegalArgumentException("Unknown examples action: " + action
                        + ". Use add, search, list, delete, clear, seed or stats");
        }
    }

    private static int cache(CommandLine command, ResultCache cache) {
        String action = command.argument(0, "cache action");
        switch (action) {
            case "stats": {
                CacheStats stats = cache.stats();
                System.out.println("Backend: " + stats.backend());
                System.out.printf("Hits: %d  Misses: %d  Sets: %d  Hit rate: %.1f%%%n",
                        stats.hits(), stats.misses(), stats.sets(), stats.hitRatePct());
                if (stats.keys() != null) {
                    System.out.println("Keys: " + stats.keys());
                }
                return 0;
            }
            case "clear": {
                String family = command.arguments().size() > 1 ? command.arguments().get(1) : "all";
                long removed = switch (family) {
                    case "anomalies" -> cache.clearAnomalies();
                    case "queries" -> cache.clearQueries();
                    case "all" -> cache.clearAll();
                    default -> throw new IllegalArgumentException("Unknown cache family: " + family
                            + ". Use anomalies, queries or all");
                };
                System.out.println("✅ Removed " + removed + " cache entries");
                return 0;
            }
            default:
                throw new IllegalArgumentException("Unknown cache action: " + action + ". Use stats or clear");
        }
    }

    static DetectionRequest buildRequest(DetectionMethod method, Map<String, String> options) {
        DetectionRequest.DetectionRequestBuilder request = DetectionRequest.builder().method(method);
        for (Map.Entry<String, String> option : options.entrySet()) {
            String value = option.getValue();
            switch (option.getKey()) {
                case "--metric" -> request.metric(value);
                case "--dimension" -> request.dimension(value);
                case "--threshold" -> request.threshold(parseDouble(option.getKey(), value));
                case "--granularity" -> request.granularity(Granularity.fromName(value));
                case "--lookback" -> request.lookbackDays(parseInt(option.getKey(), value));
                case "--comparison" -> request.comparisonType(ComparisonType.fromName(value));
                case "--top-n" -> request.topN(parseInt(option.getKey(), value));
                case "--forecast-days" -> request.forecastDays(parseInt(option.getKey(), value));
                default -> {
                    // output and configuration options are handled elsewhere
                }
            }
        }
        return request.build();
    }

    private static void printDetectionSummary(DetectionResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 " + result.getMethod().getDescription().toUpperCase());
        System.out.println("=".repeat(60));
        if (result.getReason() != null) {
            System.out.println("\n💡 " + result.getReason());
        }
        System.out.println("\nAnomalies: " + result.getAnomalyCount());
        result.getFindings().stream()
                .limit(5)
                .forEach(finding -> System.out.printf("  %s %-8s %s%n", icon(finding), finding.getSeverity().getDisplayText(),
                        finding.getDescription() != null ? finding.getDescription() : finding.getRule().describe()));
        if (result.getAnomalyCount() > 5) {
            System.out.println("  ... " + (result.getAnomalyCount() - 5) + " more in the report");
        }
    }

    private static String icon(AnomalyFinding finding) {
        return switch (finding.getSeverity()) {
            case CRITICAL, HIGH -> "🔴";
            case MEDIUM -> "🟡";
            case LOW -> "🟢";
        };
    }

    private static void writeReport(DetectionReport report, CommandLine command) throws IOException {
        String format = command.options().getOrDefault("--format", "json");
        String content = switch (format) {
            case "json" -> report.toJson();
            case "markdown", "md" -> report.toMarkdown();
            default -> throw new IllegalArgumentException("Invalid output format. Use: json or markdown");
        };
        emit(content, command);
    }

    private static void writeJson(Object value, CommandLine command) throws IOException {
        if (!command.options().containsKey("--output")) {
            return;
        }
        try {
            emit(JsonSupport.newPrettyObjectMapper().writeValueAsString(value), command);
        } catch (JsonProcessingException e) {
            throw new IOException("Could not serialize result: " + e.getMessage(), e);
        }
    }

    private static void emit(String content, CommandLine command) throws IOException {
        String output = command.options().get("--output");
        if (output == null) {
            System.out.println("\n" + content);
            return;
        }
        Path path = Paths.get(output);
        if (path.getParent() != null && !Files.exists(path.getParent())) {
            throw new IllegalArgumentException("Output directory does not exist: " + path.getParent());
        }
        Files.writeString(path, content);
        System.out.println("\n📝 Report written to " + path);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + option + ": " + value);
        }
    }

    private static double parseDouble(String option, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar lbs-anomaly-engine.jar <command> [arguments] [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  detect <method>             Run one detector (" + DetectionMethod.getAvailableMethods() + ")");
        System.out.println("  detect-all                  Run the standard detector battery");
        System.out.println("  ask \"<question>\"            Translate a question into SQL and run it");
        System.out.println("  examples <action>           add | search <question> | list | delete <id> | clear | seed | stats");
        System.out.println("  cache <action>              stats | clear [anomalies|queries|all]");
        System.out.println("  profiles                    Describe the sensitivity profiles");
        System.out.println();
        System.out.println("Detection options:");
        System.out.println("  --metric <column>           Fact measure (default: configured default metric)");
        System.out.println("  --dimension <key>           Dimension key column, e.g. ProductKey");
        System.out.println("  --threshold <num>           Z-score, IQR multiplier or percent change threshold");
        System.out.println("  --granularity <g>           daily | weekly | monthly (time_series)");
        System.out.println("  --lookback <days>           Lookback window in days");
        System.out.println("  --comparison <type>         yoy | mom | qoq (comparative)");
        System.out.println("  --top-n <num>               Entities analyzed (day_on_day)");
        System.out.println("  --forecast-days <num>       Days to forecast (forecast)");
        System.out.println();
        System.out.println("Query and example options:");
        System.out.println("  --no-execute                Only generate SQL");
        System.out.println("  --limit <rows>              Row limit applied to generated SQL");
        System.out.println("  --question <text>           Question for 'examples add'");
        System.out.println("  --sql <text>                SQL for 'examples add'");
        System.out.println("  --intent <name>             Intent for 'examples add' or filter for 'examples search'");
        System.out.println("  --k <num>                   Number of matches for 'examples search' (default: 5)");
        System.out.println();
        System.out.println("General options:");
        System.out.println("  --config <file>             YAML configuration file");
        System.out.println("  --profile <name>            Sensitivity profile: " + SensitivityProfile.getAvailableProfiles());
        System.out.println("  --format, -f <fmt>          Report format: json | markdown (default: json)");
        System.out.println("  --output, -o <file>         Write the report to a file");
        System.out.println("  --help, -h                  Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar lbs-anomaly-engine.jar detect zscore --dimension ProductKey --threshold 2.5");
        System.out.println("  java -jar lbs-anomaly-engine.jar detect comparative --comparison mom -f markdown -o mom.md");
        System.out.println("  java -jar lbs-anomaly-engine.jar ask \"Who are the top 10 customers?\"");
        System.out.println();
        System.out.println("To run without a language model, use -Dskip.ai=true");
    }

    /**
     * Positional arguments and options of one invocation. Configuration overrides such as
     * {@code --detection.zscore-threshold} are left to {@link ConfigurationLoader}.
     */
    record CommandLine(String name, List<String> arguments, Map<String, String> options, List<String> flags) {

        private static final List<String> FLAGS = List.of("--no-execute");

        static CommandLine parse(String[] args) {
            List<String> positional = new ArrayList<>();
            Map<String, String> options = new LinkedHashMap<>();
            List<String> flags = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (FLAGS.contains(arg)) {
                    flags.add(arg);
                } else if (arg.startsWith("-")) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Value not specified for " + arg);
                    }
                    String value = args[++i];
                    if (CONFIG_PREFIXES.stream().noneMatch(arg::startsWith)) {
                        options.put(normalize(arg), value);
                    }
                } else {
                    positional.add(arg);
                }
            }

            if (positional.isEmpty()) {
                throw new IllegalArgumentException("Command not specified");
            }
            return new CommandLine(positional.get(0), List.copyOf(positional.subList(1, positional.size())),
                    options, flags);
        }

        private static String normalize(String option) {
            return switch (option) {
                case "-o" -> "--output";
                case "-f" -> "--format";
                default -> option;
            };
        }

        String configFile() {
            return options.get("--config");
        }

        String profile() {
            return options.get("--profile");
        }

        boolean flag(String name) {
            return flags.contains(name);
        }

        String argument(int index, String description) {
            if (index >= arguments.size()) {
                throw new IllegalArgumentException("Missing " + description + " for command " + name);
            }
            return arguments.get(index);
        }

        String requiredOption(String option) {
            String value = options.get(option);
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(option + " is required for command " + name);
            }
            return value;
        }

        int intOption(String option, int fallback) {
            String value = options.get(option);
            return value == null ? fallback : parseInt(option, value);
        }
    }
}
