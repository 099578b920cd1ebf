package com.semverorder;

import java.io.IOException;
import java.io.PrintWriter;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.semverorder.check.SelfCheckReport;
import com.semverorder.check.SelfCheckResult;
import com.semverorder.check.SelfCheckRunner;
import com.semverorder.runtime.AppConfig;
import com.semverorder.versioning.InvalidNumericFieldException;
import com.semverorder.versioning.SemanticVersion;
import com.semverorder.versioning.VersionFormatException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
        name = "semver-order",
        mixinStandardHelpOptions = true,
        version = "semver-order 0.1.0",
        description = "Parse and order semantic versions (the dash before a pre-release is optional).")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_MALFORMED_VERSION = 3;
    static final int EXIT_CHECK_FAILED = 4;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "check")
    Mode mode;

    @Option(names = "--format", description = "Output format overriding the config: ${COMPLETION-CANDIDATES}")
    AppConfig.OutputFormat format;

    @Option(names = "--descending", description = "Sort from highest to lowest precedence in sort mode", defaultValue = "false")
    boolean descending;

    @Parameters(arity = "0..*", description = "Versions to parse, compare or sort")
    List<String> versions = new ArrayList<>();

    private final ObjectMapper jsonMapper = JsonMapper.builder().build();

    enum Mode {
        parse,
        compare,
        sort,
        check
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        AppConfig.OutputFormat outputFormat = format != null ? format : config.getOutput().getFormat();
        log.debug("Running mode={} format={} config={}", mode, outputFormat, configPath);

        try {
            return switch (mode) {
                case parse -> runParse(outputFormat);
                case compare -> runCompare(outputFormat);
                case sort -> runSort();
                case check -> runCheck(config.getSelfCheck());
            };
        } catch (InvalidNumericFieldException e) {
            log.error("Version component {} out of range: {}", e.field(), e.getMessage());
            return EXIT_MALFORMED_VERSION;
        } catch (VersionFormatException e) {
            log.error(e.getMessage());
            return EXIT_MALFORMED_VERSION;
        }
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            log.debug("Config file {} not found, using defaults", config);
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private int runParse(AppConfig.OutputFormat outputFormat) throws IOException {
        if (versions.isEmpty()) {
            log.error("at least one version is required in parse mode");
            return EXIT_USAGE_ERROR;
        }
        List<VersionReport> reports = new ArrayList<>();
        for (String value : versions) {
            reports.add(VersionReport.of(SemanticVersion.parse(value)));
        }
        PrintWriter out = out();
        if (outputFormat == AppConfig.OutputFormat.json) {
            out.println(jsonMapper.writeValueAsString(reports));
        } else {
            for (VersionReport report : reports) {
                out.printf("%s major=%d minor=%d patch=%d preRelease=%s buildMetadata=%s%n",
                        report.input(),
                        report.major(),
                        report.minor(),
                        report.patch(),
                        report.preRelease() == null ? "-" : report.preRelease(),
                        report.buildMetadata() == null ? "-" : report.buildMetadata());
            }
        }
        out.flush();
        return EXIT_OK;
    }

    private int runCompare(AppConfig.OutputFormat outputFormat) throws IOException {
        if (versions.size() != 2) {
            log.error("compare mode requires exactly two versions but got {}", versions.size());
            return EXIT_USAGE_ERROR;
        }
        SemanticVersion left = SemanticVersion.parse(versions.get(0));
        SemanticVersion right = SemanticVersion.parse(versions.get(1));
        int result = Integer.signum(left.compareTo(right));
        String relation = result < 0 ? "<" : result > 0 ? ">" : "==";

        PrintWriter out = out();
        if (outputFormat == AppConfig.OutputFormat.json) {
            out.println(jsonMapper.writeValueAsString(new ComparisonReport(left.toString(), right.toString(), relation, result)));
        } else {
            out.println(left + " " + relation + " " + right);
        }
        out.flush();
        return EXIT_OK;
    }

    private int runSort() {
        if (versions.isEmpty()) {
            log.error("at least one version is required in sort mode");
            return EXIT_USAGE_ERROR;
        }
        List<SemanticVersion> parsed = new ArrayList<>();
        for (String value : versions) {
            parsed.add(SemanticVersion.parse(value));
        }
        parsed.sort(descending ? Collections.reverseOrder(SemanticVersion.PRECEDENCE) : SemanticVersion.PRECEDENCE);

        PrintWriter out = out();
        parsed.forEach(out::println);
        out.flush();
        return EXIT_OK;
    }

    private int runCheck(AppConfig.SelfCheckConfig selfCheckConfig) {
        SelfCheckReport report = new SelfCheckRunner().run(selfCheckConfig);
        PrintWriter out = out();
        for (SelfCheckResult result : report.results()) {
            out.printf("%s %s %s%n", result.passed() ? "PASS" : "FAIL", result.checkId(), result.versions());
        }
        out.flush();
        if (!report.passed()) {
            report.failures().forEach(log::error);
            return EXIT_CHECK_FAILED;
        }
        log.info("Self-check passed: {} checks", report.results().size());
        return EXIT_OK;
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    public record VersionReport(
            String input,
            BigInteger major,
            BigInteger minor,
            BigInteger patch,
            String preRelease,
            String buildMetadata) {

        public static VersionReport of(SemanticVersion version) {
            return new VersionReport(
                    version.toString(),
                    version.major(),
                    version.minor(),
                    version.patch(),
                    version.preRelease().orElse(null),
                    version.buildMetadata().orElse(null));
        }
    }

    public record ComparisonReport(String left, String right, String relation, int result) {
    }
}
