package dev.nishisan.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.monitor.AgentMetrics;
import dev.nishisan.monitor.alert.AlertRule;
import dev.nishisan.monitor.alert.AlertSeverity;
import dev.nishisan.monitor.alert.RuleAggregation;
import dev.nishisan.monitor.alert.ThresholdComparator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the monitor's YAML configuration and converts it to a
 * {@link MonitorConfig}.
 * <p>
 * {@code ${VAR}} and {@code ${VAR:default}} placeholders are resolved against
 * the environment before parsing. Durations accept ISO-8601 ({@code PT10M}) or
 * the short forms {@code 500ms}, {@code 30s}, {@code 10m}, {@code 2h}.
 */
public class MonitorConfigLoader {

    private static final ObjectMapper mapper;
    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private MonitorConfigLoader() {
    }

    public static MonitorYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static MonitorYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        return parse(Files.readString(yamlFile), envProvider);
    }

    public static MonitorYamlConfig parse(String content, Function<String, String> envProvider) throws IOException {
        String processedContent = resolveVariables(content, envProvider);
        if (processedContent.isBlank()) {
            return new MonitorYamlConfig();
        }
        MonitorYamlConfig config = mapper.readValue(processedContent, MonitorYamlConfig.class);
        // a document holding only comments maps to null
        return config != null ? config : new MonitorYamlConfig();
    }

    /**
     * Loads and converts in one step.
     */
    public static MonitorConfig loadConfig(Path yamlFile) throws IOException {
        return toDomain(load(yamlFile));
    }

    public static void save(Path yamlFile, MonitorYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    private static String resolveVariables(String content, Function<String, String> envProvider) {
        Matcher matcher = VARIABLE.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            builder.append(content, i, matcher.start());
            builder.append(getReplacement(matcher.group(1), envProvider));
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String varName = parts[0];
        String defaultValue = parts.length > 1 ? parts[1] : null;

        String value = envProvider.apply(varName);
        if (value != null) {
            return value;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new IllegalArgumentException(
                "Environment variable '" + varName + "' not found and no default value provided.");
    }

    /**
     * Converts the YAML beans to the immutable domain configuration. Absent
     * values keep their defaults.
     *
     * @throws IllegalArgumentException on invalid values
     */
    public static MonitorConfig toDomain(MonitorYamlConfig yamlConfig) {
        MonitorConfig.Builder builder = MonitorConfig.builder();

        if (yamlConfig.getShards() != null) {
            builder.shardCount(yamlConfig.getShards());
        }
        if (yamlConfig.getTimerReservoir() != null) {
            builder.timerReservoirSize(yamlConfig.getTimerReservoir());
        }
        Duration lockTimeout = parseDuration(yamlConfig.getLockTimeout());
        if (lockTimeout != null) {
            builder.lockTimeout(lockTimeout);
        }
        Duration maintenance = parseDuration(yamlConfig.getMaintenanceInterval());
        if (maintenance != null) {
            builder.maintenanceInterval(maintenance);
        }

        ExecutionPolicyConfig execution = yamlConfig.getExecution();
        if (execution != null) {
            Duration retention = parseDuration(execution.getRetention());
            if (retention != null) {
                builder.executionRetention(retention);
            }
            if (execution.getMaxRetained() != null) {
                builder.maxRetainedExecutions(execution.getMaxRetained());
            }
            Duration stale = parseDuration(execution.getStaleCeiling());
            if (stale != null) {
                builder.staleExecutionCeiling(stale);
            }
            Duration sweep = parseDuration(execution.getSweepInterval());
            if (sweep != null) {
                builder.sweepInterval(sweep);
            }
        }

        AlertPolicyConfig alerts = yamlConfig.getAlerts();
        if (alerts == null || alerts.isIncludeDefaultRules()) {
            builder.rules(AgentMetrics.defaultRules());
        }
        if (alerts != null) {
            Duration activeWindow = parseDuration(alerts.getActiveWindow());
            if (activeWindow != null) {
                builder.activeAlertWindow(activeWindow);
            }
            if (alerts.getRules() != null) {
                for (AlertRuleConfig rule : alerts.getRules()) {
                    if (rule != null) {
                        builder.rule(convertRule(rule));
                    }
                }
            }
        }

        DashboardConfig dashboard = yamlConfig.getDashboard();
        if (dashboard != null && dashboard.isEnabled()) {
            if (dashboard.getPath() == null || dashboard.getPath().isBlank()) {
                throw new IllegalArgumentException("Dashboard is enabled but has no path");
            }
            builder.dashboardPath(Path.of(dashboard.getPath()));
            Duration interval = parseDuration(dashboard.getInterval());
            if (interval != null) {
                builder.dashboardInterval(interval);
            }
        }

        return builder.build();
    }

    private static AlertRule convertRule(AlertRuleConfig rc) {
        if (rc.getName() == null || rc.getMetric() == null) {
            throw new IllegalArgumentException("Alert rule must have a name and a metric");
        }
        AlertSeverity severity = rc.getSeverity() != null ? AlertSeverity.parse(rc.getSeverity())
                : AlertSeverity.WARNING;
        RuleAggregation aggregation = rc.getAggregation() != null ? RuleAggregation.parse(rc.getAggregation())
                : null;
        Duration window = parseDuration(rc.getWindow());
        return new AlertRule(rc.getName(), rc.getMetric(),
                ThresholdComparator.fromSymbol(rc.getComparator() != null ? rc.getComparator() : ">="),
                rc.getThreshold(), severity, aggregation,
                window != null ? window : AlertRule.DEFAULT_WINDOW, rc.getLabels());
    }

    static Duration parseDuration(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        s = s.trim().toUpperCase(Locale.ROOT);
        try {
            return Duration.parse(s); // ISO-8601 first (PT10M)
        } catch (DateTimeParseException e) {
            try {
                if (s.endsWith("MS")) {
                    return Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2).trim()));
                } else if (s.endsWith("H")) {
                    return Duration.ofHours(Long.parseLong(s.substring(0, s.length() - 1).trim()));
                } else if (s.endsWith("M")) {
                    return Duration.ofMinutes(Long.parseLong(s.substring(0, s.length() - 1).trim()));
                } else if (s.endsWith("S")) {
                    return Duration.ofSeconds(Long.parseLong(s.substring(0, s.length() - 1).trim()));
                } else if (s.endsWith("D")) {
                    return Duration.ofDays(Long.parseLong(s.substring(0, s.length() - 1).trim()));
                }
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Invalid duration: " + s, nfe);
            }
            throw new IllegalArgumentException("Invalid duration: " + s, e);
        }
    }
}
