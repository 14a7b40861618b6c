package com.platform.datakeeper.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a YAML policy document into typed {@link Policy} values.
 * 
 * Any malformed selector, trigger or action rejects the whole document with a
 * {@link ValidationException} naming the offending field. YAML anchors and merge keys
 * are resolved by SnakeYAML; {@code template: <name>} references resolve against
 * {@code policy_templates}.
 */
@Slf4j
public class PolicyDocumentParser {
    
    private static final Set<String> RETENTION_STRATEGIES = Set.of("default", "none", "dry-run");
    private static final String DEFAULT_ON_DEMAND_PATH = "/api/policies/{id}/trigger";
    
    private final ObjectMapper objectMapper;
    
    public PolicyDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    /**
     * Parses a document.
     *
     * @param content YAML text
     * @param source file reference recorded on every policy
     */
    public PolicyDocument parse(String content, String source) {
        JsonNode root = readYaml(content);
        if (!root.isObject()) {
            throw new ValidationException("document", "policy document must be a mapping");
        }
        
        Map<String, JsonNode> templates = parseTemplates(root.path("policy_templates"));
        
        JsonNode policiesNode = root.path("policies");
        if (!policiesNode.isArray()) {
            throw new ValidationException("policies", "policies must be a list");
        }
        
        List<Policy> policies = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (JsonNode node : policiesNode) {
            Policy policy = parsePolicy(node, "policies[" + index + "]", templates, source);
            if (!names.add(policy.getName())) {
                throw new ValidationException("policies[" + index + "].name", policy.getName(),
                    "duplicate policy name");
            }
            policies.add(policy);
            index++;
        }
        
        JsonNode metadata = root.path("metadata");
        PolicyDocument document = new PolicyDocument(
            textOrNull(root.path("apiVersion")),
            textOrNull(metadata.path("name")),
            textOrNull(metadata.path("version")),
            parseSettings(root.path("settings")),
            List.copyOf(policies)
        );
        
        log.debug("Parsed policy document '{}' from {}: {} policies", document.name(), source, policies.size());
        return document;
    }
    
    private JsonNode readYaml(String content) {
        Object raw;
        try {
            raw = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
        } catch (YAMLException e) {
            throw new ValidationException("document", "policy document is not valid YAML: " + e.getMessage());
        }
        if (raw == null) {
            throw new ValidationException("document", "policy document is empty");
        }
        return objectMapper.valueToTree(raw);
    }
    
    private PolicyDocument.Settings parseSettings(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return PolicyDocument.Settings.EMPTY;
        }
        Duration interval = null;
        if (node.has("policy_evaluation_interval")) {
            long seconds = requirePositiveLong(node, "policy_evaluation_interval", "settings");
            interval = Duration.ofSeconds(seconds);
        }
        Integer auditRetention = node.has("audit_retention") 
            ? (int) requirePositiveLong(node, "audit_retention", "settings") 
            : null;
        return new PolicyDocument.Settings(textOrNull(node.path("log_level")), interval, auditRetention);
    }
    
    private Map<String, JsonNode> parseTemplates(JsonNode node) {
        Map<String, JsonNode> templates = new HashMap<>();
        if (node.isMissingNode() || node.isNull()) {
            return templates;
        }
        if (!node.isArray()) {
            throw new ValidationException("policy_templates", "policy_templates must be a list");
        }
        for (JsonNode template : node) {
            String name = requireText(template, "name", "policy_templates");
            ObjectNode spec = JsonNodeFactory.instance.objectNode();
            if (template.path("spec").isObject()) {
                spec.setAll((ObjectNode) template.path("spec"));
            }
            if (template.hasNonNull("type")) {
                spec.put("__type", template.get("type").asText());
            }
            templates.put(name, spec);
        }
        return templates;
    }
    
    private Policy parsePolicy(JsonNode node, String field, Map<String, JsonNode> templates, String source) {
        if (!node.isObject()) {
            throw new ValidationException(field, "policy must be a mapping");
        }
        
        String name = requireText(node, "name", field);
        String strategy = node.hasNonNull("strategy") ? node.get("strategy").asText() : "default";
        
        Selector selector = parseSelector(node.path("selector"), field + ".selector");
        
        List<TriggerSpec> triggers = new ArrayList<>();
        JsonNode triggersNode = requireList(node, "triggers", field);
        for (int i = 0; i < triggersNode.size(); i++) {
            triggers.add(parseTrigger(triggersNode.get(i), field + ".triggers[" + i + "]"));
        }
        
        List<ActionSpec> actions = new ArrayList<>();
        Set<String> operations = new LinkedHashSet<>();
        JsonNode actionsNode = requireList(node, "actions", field);
        if (actionsNode.isEmpty()) {
            throw new ValidationException(field + ".actions", "at least one action is required");
        }
        for (int i = 0; i < actionsNode.size(); i++) {
            String actionField = field + ".actions[" + i + "]";
            JsonNode spec = resolveActionSpec(actionsNode.get(i), actionField, templates);
            String type = spec.path("__type").asText();
            actions.add(parseAction(type, spec, actionField, strategy));
            operations.addAll(stringList(spec.path("operations"), actionField + ".operations"));
            operations.add(actions.get(i).kind());
        }
        
        if (node.has("operations")) {
            operations = new LinkedHashSet<>(stringList(node.path("operations"), field + ".operations"));
        }
        
        return Policy.builder()
            .name(name)
            .description(textOrNull(node.path("description")))
            .policyFile(source)
            .enabled(!node.has("enabled") || node.get("enabled").asBoolean(true))
            .strategy(strategy)
            .selector(selector)
            .operations(List.copyOf(operations))
            .triggers(List.copyOf(triggers))
            .actions(List.copyOf(actions))
            .build();
    }
    
    private Selector parseSelector(JsonNode node, String field) {
        if (!node.isObject()) {
            throw new ValidationException(field, "selector is required");
        }
        Set<String> dataTypes = new HashSet<>();
        for (String type : stringList(node.path("data_type"), field + ".data_type")) {
            dataTypes.add(type.toLowerCase(Locale.ROOT));
        }
        if (dataTypes.isEmpty()) {
            throw new ValidationException(field + ".data_type", "at least one data type is required");
        }
        Set<String> paths = new HashSet<>(stringList(node.path("paths"), field + ".paths"));
        if (paths.isEmpty()) {
            throw new ValidationException(field + ".paths", "at least one path is required");
        }
        Set<String> tags = new HashSet<>(stringList(node.path("tags"), field + ".tags"));
        return new Selector(dataTypes, tags, paths);
    }
    
    private TriggerSpec parseTrigger(JsonNode node, String field) {
        String type = requireText(node, "type", field).toLowerCase(Locale.ROOT);
        JsonNode spec = node.path("spec");
        String specField = field + ".spec";
        
        return switch (type) {
            case "on-demand", "on_demand", "ondemand" -> {
                String path = spec.hasNonNull("api") ? spec.get("api").asText() 
                    : spec.hasNonNull("api_path") ? spec.get("api_path").asText() 
                    : DEFAULT_ON_DEMAND_PATH;
                yield new TriggerSpec.OnDemand(path);
            }
            case "schedule" -> parseSchedule(spec, specField);
            case "condition" -> {
                String expression = spec.hasNonNull("expression") 
                    ? spec.get("expression").asText() 
                    : requireText(spec, "condition", specField);
                ConditionParser.parse(expression);
                yield new TriggerSpec.Condition(expression);
            }
            case "event", "geofence" -> {
                String filter = textOrNull(spec.path("condition"));
                if (filter != null) {
                    ConditionParser.parse(filter);
                }
                long window = spec.has("delta_t_seconds") 
                    ? requirePositiveLong(spec, "delta_t_seconds", specField)
                    : requirePositiveLong(spec, "window_seconds", specField);
                yield new TriggerSpec.Event(
                    requireText(spec, "source", specField),
                    requirePositiveDouble(spec, "radius_km", specField),
                    window,
                    filter);
            }
            default -> throw new ValidationException(field + ".type", type, "unknown trigger type");
        };
    }
    
    private TriggerSpec parseSchedule(JsonNode spec, String field) {
        String kind = spec.hasNonNull("type") 
            ? spec.get("type").asText().toLowerCase(Locale.ROOT)
            : spec.has("date") ? "date" : "cron";
        
        return switch (kind) {
            case "cron" -> {
                String cron = requireText(spec, "cron", field);
                try {
                    yield new TriggerSpec.Cron(CronExpressions.normalize(cron));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException(ErrorCode.INVALID_CRON, field + ".cron", cron,
                        "invalid cron expression: " + e.getMessage());
                }
            }
            case "date" -> new TriggerSpec.FixedDate(requireInstant(spec, "date", field));
            case "interval" -> {
                TimeUnitSpec unit = parseTimeUnit(spec, "unit", field, TimeUnitSpec.SECOND);
                long value = requireWithinUnit(requirePositiveLong(spec, "value", field), unit, field + ".value");
                yield new TriggerSpec.Interval(unit.toDuration(value));
            }
            default -> throw new ValidationException(field + ".type", kind, "unknown schedule type");
        };
    }
    
    /**
     * Returns the action spec with template defaults merged in and the action type
     * recorded under {@code __type}.
     */
    private JsonNode resolveActionSpec(JsonNode node, String field, Map<String, JsonNode> templates) {
        if (!node.isObject()) {
            throw new ValidationException(field, "action must be a mapping");
        }
        ObjectNode merged = JsonNodeFactory.instance.objectNode();
        
        String templateName = textOrNull(node.path("template"));
        if (templateName == null) {
            templateName = textOrNull(node.path("spec").path("template"));
        }
        if (templateName != null) {
            JsonNode template = templates.get(templateName);
            if (template == null) {
                throw new ValidationException(field + ".template", templateName, "unknown policy template");
            }
            merged.setAll((ObjectNode) template.deepCopy());
        }
        
        JsonNode spec = node.path("spec");
        if (spec.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = spec.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (!"template".equals(entry.getKey())) {
                    merged.set(entry.getKey(), entry.getValue());
                }
            }
        }
        
        if (node.hasNonNull("type")) {
            merged.put("__type", node.get("type").asText());
        }
        if (!merged.hasNonNull("__type")) {
            throw new ValidationException(field + ".type", "action type is required");
        }
        return merged;
    }
    
    private ActionSpec parseAction(String type, JsonNode spec, String field, String policyStrategy) {
        String specField = field + ".spec";
        
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "retention" -> parseRetention(spec, specField, policyStrategy);
            case "transform", "downsampler", "downsample" -> parseTransform(spec, specField);
            case "roi" -> {
                String channels = spec.hasNonNull("channel_range") 
                    ? channelText(spec.get("channel_range")) 
                    : channelText(spec.path("channels"));
                yield new ActionSpec.Roi(requireChannels(channels, specField + ".channel_range"));
            }
            case "time-window", "time_window" -> {
                Instant from = requireInstant(spec, "from", specField);
                Instant to = requireInstant(spec, "to", specField);
                if (from.isAfter(to)) {
                    throw new ValidationException(specField + ".from", from, "'from' must not be after 'to'");
                }
                yield new ActionSpec.TimeWindow(from, to);
            }
            case "event-proximity", "event_proximity" -> new ActionSpec.EventProximity(
                spec.has("radius_km") ? requirePositiveDouble(spec, "radius_km", specField) : null,
                spec.has("window_seconds") ? requirePositiveLong(spec, "window_seconds", specField) : null,
                textOrNull(spec.path("event_source")));
            default -> throw new ValidationException(field + ".type", type, "unknown action type");
        };
    }
    
    private ActionSpec.Retention parseRetention(JsonNode spec, String field, String policyStrategy) {
        String strategy = spec.hasNonNull("strategy") ? spec.get("strategy").asText() : policyStrategy;
        if (!RETENTION_STRATEGIES.contains(strategy)) {
            throw new ValidationException(field + ".strategy", strategy, "unknown retention strategy");
        }
        
        TimeUnitSpec unit = parseTimeUnit(spec, "time_unit", field, TimeUnitSpec.DAY);
        long retentionTime = requireWithinUnit(requireRetentionTime(spec, field), unit, field + ".retention_time");
        long warningTime = 0;
        if (spec.has("warning_time")) {
            warningTime = requireLong(spec, "warning_time", field);
            if (warningTime < 0) {
                throw new ValidationException(field + ".warning_time", warningTime, "must not be negative");
            }
            requireWithinUnit(warningTime, unit, field + ".warning_time");
        }
        
        List<RetentionRule> rules = new ArrayList<>();
        JsonNode exceptions = spec.path("exceptions");
        if (!exceptions.isMissingNode() && !exceptions.isNull()) {
            if (!exceptions.isArray()) {
                throw new ValidationException(field + ".exceptions", "exceptions must be a list");
            }
            for (int i = 0; i < exceptions.size(); i++) {
                JsonNode rule = exceptions.get(i);
                String ruleField = field + ".exceptions[" + i + "]";
                String condition = requireText(rule, "condition", ruleField);
                ConditionParser.parse(condition);
                TimeUnitSpec ruleUnit = parseTimeUnit(rule, "time_unit", ruleField, unit);
                rules.add(new RetentionRule(
                    condition,
                    requireWithinUnit(requireRetentionTime(rule, ruleField), ruleUnit, ruleField + ".retention_time"),
                    ruleUnit));
            }
        }
        
        return new ActionSpec.Retention(strategy, unit, retentionTime, warningTime, rules);
    }
    
    private ActionSpec.Transform parseTransform(JsonNode spec, String field) {
        JsonNode methodsNode = spec.path("methods");
        if (!methodsNode.isArray() || methodsNode.isEmpty()) {
            throw new ValidationException(field + ".methods", "at least one method is required");
        }
        
        List<DownsampleMethod> methods = new ArrayList<>();
        for (int i = 0; i < methodsNode.size(); i++) {
            JsonNode method = methodsNode.get(i);
            String methodField = field + ".methods[" + i + "]";
            
            DownsampleMethod.Dimension dimension = parseEnum(DownsampleMethod.Dimension.class,
                requireText(method, "dimension", methodField), methodField + ".dimension");
            DownsampleMethod.Aggregation algorithm = parseEnum(DownsampleMethod.Aggregation.class,
                requireText(method, "algorithm", methodField), methodField + ".algorithm");
            
            long factor = requireLong(method, "factor", methodField);
            if (factor <= 0 || factor > Integer.MAX_VALUE) {
                throw new ValidationException(methodField + ".factor", factor, "factor must be a positive integer");
            }
            
            String channels = method.has("apply_to_channels") 
                ? channelText(method.get("apply_to_channels")) 
                : ChannelSelection.ALL;
            methods.add(new DownsampleMethod(dimension, algorithm, (int) factor,
                requireChannels(channels, methodField + ".apply_to_channels")));
        }
        
        return new ActionSpec.Transform(
            stringList(spec.path("operations"), field + ".operations"),
            spec.path("preserve_original").asBoolean(false),
            methods);
    }
    
    private static String requireChannels(String channels, String field) {
        try {
            ChannelSelection.validate(channels);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, channels, e.getMessage());
        }
        return channels.trim();
    }
    
    private static String channelText(JsonNode node) {
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            node.forEach(n -> parts.add(n.asText()));
            return String.join(",", parts);
        }
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
    
    private static long requireRetentionTime(JsonNode node, String field) {
        long value = requireLong(node, "retention_time", field);
        if (value < RetentionRule.NEVER_DELETE) {
            throw new ValidationException(field + ".retention_time", value,
                "retention_time must be -1 or non-negative");
        }
        return value;
    }
    
    private static long requireWithinUnit(long amount, TimeUnitSpec unit, String field) {
        if (amount > unit.maxAmount()) {
            throw new ValidationException(field, amount, 
                "too large, at most " + unit.maxAmount() + " " + unit.name().toLowerCase(Locale.ROOT) + "s");
        }
        return amount;
    }
    
    private static TimeUnitSpec parseTimeUnit(JsonNode node, String key, String field, TimeUnitSpec fallback) {
        if (!node.hasNonNull(key)) {
            return fallback;
        }
        String text = node.get(key).asText();
        try {
            return TimeUnitSpec.fromText(text);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + "." + key, text, "unknown time unit");
        }
    }
    
    private static <E extends Enum<E>> E parseEnum(Class<E> type, String text, String field) {
        try {
            return Enum.valueOf(type, text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_FIELD_VALUE, field, text,
                "unsupported value '" + text + "'");
        }
    }
    
    private static Instant requireInstant(JsonNode node, String key, String field) {
        JsonNode value = node.path(key);
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        String text = requireText(node, key, field);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.trace("'{}' is not an instant, trying offset form", text);
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + "." + key, text, "expected an ISO-8601 instant");
        }
    }
    
    private static String requireText(JsonNode node, String key, String field) {
        JsonNode value = node.path(key);
        if (!value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, field + "." + key, null,
                "'" + key + "' is required");
        }
        return value.asText().trim();
    }
    
    private static long requireLong(JsonNode node, String key, String field) {
        JsonNode value = node.path(key);
        if (!value.isIntegralNumber()) {
            if (value.isMissingNode() || value.isNull()) {
                throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, field + "." + key, null,
                    "'" + key + "' is required");
            }
            throw new ValidationException(field + "." + key, value.asText(), "expected an integer");
        }
        return value.asLong();
    }
    
    private static long requirePositiveLong(JsonNode node, String key, String field) {
        long value = requireLong(node, key, field);
        if (value <= 0) {
            throw new ValidationException(field + "." + key, value, "must be positive");
        }
        return value;
    }
    
    private static double requirePositiveDouble(JsonNode node, String key, String field) {
        JsonNode value = node.path(key);
        if (!value.isNumber() || value.asDouble() <= 0) {
            throw new ValidationException(field + "." + key, value.asText(), "expected a positive number");
        }
        return value.asDouble();
    }
    
    private static List<String> stringList(JsonNode node, String field) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (node.isValueNode()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new ValidationException(field, "expected a list of strings");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isValueNode() || item.isNull()) {
                throw new ValidationException(field, "expected a list of strings");
            }
            values.add(item.asText());
        }
        return values;
    }
    
    private static JsonNode requireList(JsonNode node, String key, String field) {
        JsonNode value = node.path(key);
        if (!value.isArray()) {
            throw new ValidationException(field + "." + key, "'" + key + "' must be a list");
        }
        return value;
    }
    
    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
