package com.raditha.formscope.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.formscope.analysis.ExpressionAnalyzer;
import com.raditha.formscope.analysis.RuleAnalyzer;
import com.raditha.formscope.analyzer.ReusableControlGroupAnalyzer;
import com.raditha.formscope.analyzer.ReusableGroupReport;
import com.raditha.formscope.config.ExpressionAnalysisConfig;
import com.raditha.formscope.config.FormscopeSettings;
import com.raditha.formscope.config.MiningConfig;
import com.raditha.formscope.config.Settings;
import com.raditha.formscope.expression.XPathFunctionParser;
import com.raditha.formscope.loader.FormDefinitionLoader;
import com.raditha.formscope.metrics.MetricsExporter;
import com.raditha.formscope.model.AnalysisResult;
import com.raditha.formscope.model.EnhancedExpression;
import com.raditha.formscope.model.FormDefinition;
import com.raditha.formscope.model.FormRule;
import com.raditha.formscope.model.RuleAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface for form migration analysis.
 * <p>
 * Usage:
 * java -jar formscope.jar --forms &lt;file-or-directory&gt; [options]
 * java -jar formscope.jar --expression "&lt;xpath&gt;" [--expression ...]
 * <p>
 * Configuration priority: CLI arguments > formscope.yml > defaults
 */
@Command(name = "formscope", mixinStandardHelpOptions = true, version = "Formscope v1.0.0",
        description = "Form expression analyzer and reusable control group miner")
public class FormscopeCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(FormscopeCLI.class);

    private static final String VERSION = "1.0.0";

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(names = "--forms", description = "Form definition JSON file or directory", paramLabel = "<path>")
    private Path formsPath;

    @Option(names = "--expression", description = "Expression to analyze (repeatable)", paramLabel = "<xpath>")
    private List<String> expressions = new ArrayList<>();

    @Option(names = "--rules", description = "Also analyze the rules of each form")
    private boolean analyzeRules = false;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--min-occurrences", description = "Minimum forms a group must appear in (default: 2)",
            paramLabel = "<n>")
    private int minOccurrences = 0; // 0 = use YAML/default

    @Option(names = "--min-group-size", description = "Smallest group of controls (default: 2)", paramLabel = "<n>")
    private int minGroupSize = 0;

    @Option(names = "--max-group-size", description = "Largest group of controls (default: 10)", paramLabel = "<n>")
    private int maxGroupSize = 0;

    @Option(names = "--preset", description = "Mining preset: default, strict or lenient", paramLabel = "<name>")
    private String preset;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        if (configFile != null) {
            Settings.loadConfigMap(new File(configFile));
        } else {
            Settings.loadConfigMap();
        }

        ExpressionAnalysisConfig expressionConfig = FormscopeSettings.loadExpressionConfig();
        XPathFunctionParser parser = new XPathFunctionParser();
        ExpressionAnalyzer expressionAnalyzer = new ExpressionAnalyzer(parser, expressionConfig);

        if (!expressions.isEmpty()) {
            runExpressionAnalysis(expressionAnalyzer);
        }

        if (formsPath != null) {
            MiningConfig miningConfig = FormscopeSettings.loadMiningConfig(
                    minOccurrences, minGroupSize, maxGroupSize, preset);
            Map<String, FormDefinition> forms = new FormDefinitionLoader().load(formsPath);

            runMining(forms, miningConfig);

            if (analyzeRules) {
                runRuleAnalysis(forms, new RuleAnalyzer(expressionAnalyzer, parser));
            }
        }

        return 0;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the command with the standard exception handlers.
     *
     * @return exit code
     */
    public static int execute(String... args) {
        CommandLine cmd = new CommandLine(new FormscopeCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                logger.error("Unexpected failure", ex);
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });

        return cmd.execute(args);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (formsPath == null && expressions.isEmpty()) {
            throw new IllegalArgumentException("Nothing to do: specify --forms and/or --expression");
        }

        if (analyzeRules && formsPath == null) {
            throw new IllegalArgumentException("--rules requires --forms");
        }

        if (minOccurrences < 0 || minGroupSize < 0 || maxGroupSize < 0) {
            throw new IllegalArgumentException("Occurrence and group size options must be positive");
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase(Locale.ROOT);
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
            if (formsPath == null) {
                throw new IllegalArgumentException("--export requires --forms");
            }
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private void runExpressionAnalysis(ExpressionAnalyzer analyzer) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        List<EnhancedExpression> results = new ArrayList<>();

        for (String expression : expressions) {
            Optional<EnhancedExpression> analyzed = analyzer.analyzeExpression(expression);
            if (analyzed.isEmpty()) {
                logger.info("Skipping empty expression");
                continue;
            }
            results.add(analyzed.get());
        }

        if (jsonOutput) {
            out.println(mapper.writeValueAsString(results));
            return;
        }

        out.println("=".repeat(80));
        out.println("EXPRESSION ANALYSIS");
        out.println("=".repeat(80));
        out.println();
        for (EnhancedExpression result : results) {
            printExpression(out, result, "");
            out.println();
        }
        out.flush();
    }

    private static void printExpression(PrintWriter out, EnhancedExpression result, String indent) {
        out.printf("%sExpression: %s%n", indent, result.parsedExpression());
        out.printf("%s  Type: %s, returns %s%s%n", indent, result.type(), result.returnType(),
                result.complex() ? " (complex)" : "");
        out.printf("%s  Reads as: %s%n", indent, result.humanReadable());
        if (!result.referencedFields().isEmpty()) {
            out.printf("%s  Fields: %s%n", indent, String.join(", ", result.referencedFields()));
        }
        if (!result.usedFunctions().isEmpty()) {
            out.printf("%s  Functions: %s%n", indent, String.join(", ", result.usedFunctions()));
        }
        for (String hint : result.translationHints()) {
            out.printf("%s  Hint: %s%n", indent, hint);
        }
        if (!result.subExpressions().isEmpty()) {
            out.printf("%s  Sub-expressions (%d nodes):%n", indent, result.totalNodeCount() - 1);
            for (EnhancedExpression sub : result.subExpressions()) {
                printExpression(out, sub, indent + "    ");
            }
        }
    }

    private void runMining(Map<String, FormDefinition> forms, MiningConfig config) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        ReusableControlGroupAnalyzer analyzer = new ReusableControlGroupAnalyzer(config);
        AnalysisResult result = analyzer.analyzeForReusableGroups(forms);

        if (jsonOutput) {
            out.println(mapper.writeValueAsString(toJson(result)));
        } else {
            out.print(new ReusableGroupReport(result, config).getDetailedReport());
        }
        out.flush();

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(result);
        }
    }

    /**
     * JSON view of a mining result. Frequency keys are rendered as
     * {@code Type:LABEL}.
     */
    private static Map<String, Object> toJson(AnalysisResult result) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        result.controlFrequency().forEach((key, count) -> frequency.put(key.toString(), count));

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("version", VERSION);
        json.put("totalFormsAnalyzed", result.totalFormsAnalyzed());
        json.put("totalControlsAnalyzed", result.totalControlsAnalyzed());
        json.put("controlsInRepeatingSections", result.controlsInRepeatingSections());
        json.put("identifiedGroups", result.identifiedGroups());
        json.put("controlFrequency", frequency);
        json.put("commonPatterns", result.commonPatterns());
        json.put("repeatingSections", result.repeatingSections());
        return json;
    }

    private void runRuleAnalysis(Map<String, FormDefinition> forms, RuleAnalyzer ruleAnalyzer) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        Map<String, RuleAnalysisResult> results = new LinkedHashMap<>();

        for (Map.Entry<String, FormDefinition> form : forms.entrySet()) {
            List<FormRule> rules = form.getValue().rules();
            if (!rules.isEmpty()) {
                results.put(form.getKey(), ruleAnalyzer.analyze(rules));
            }
        }

        if (jsonOutput) {
            out.println(mapper.writeValueAsString(results));
        } else {
            out.println("RULE ANALYSIS");
            out.println("-".repeat(80));
            if (results.isEmpty()) {
                out.println("No rules found.");
            }
            results.forEach((formId, result) -> out.printf("  %s: %s%n", formId, result.getSummary()));
        }
        out.flush();
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(AnalysisResult result) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        MetricsExporter exporter = new MetricsExporter();

        Path fileName = formsPath.getFileName();
        String corpusName = fileName != null ? fileName.toString() : "forms";
        MetricsExporter.CorpusMetrics metrics = exporter.buildMetrics(result, corpusName);

        Path outputDir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        Files.createDirectories(outputDir);

        String format = exportFormat.toLowerCase(Locale.ROOT);
        if ("csv".equals(format) || "both".equals(format)) {
            Path csvPath = outputDir.resolve("formscope-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            out.println("Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(format) || "both".equals(format)) {
            Path jsonPath = outputDir.resolve("formscope-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            out.println("Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
