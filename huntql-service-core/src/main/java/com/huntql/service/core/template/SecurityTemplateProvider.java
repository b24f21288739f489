package com.huntql.service.core.template;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.huntql.service.core.kql.lexer.KqlLexer;
import com.huntql.service.core.kql.lexer.LexException;
import com.huntql.service.core.kql.lexer.Token;
import com.huntql.service.core.kql.lexer.TokenKind;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Catalog of security hunting templates, loaded once from a YAML or JSON resource such as
 * {@code classpath:/templates/security-templates.yml}.
 *
 * <p>Rendering replaces every {@code {name}} placeholder with a KQL literal of the parameter's declared type, so a
 * value can never add query text of its own: strings are quoted and escaped, numbers, timespans, datetimes and
 * booleans are checked before they are inserted. Missing values fall back to the parameter default.
 */
@Slf4j
public class SecurityTemplateProvider {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final KqlLexer lexer = new KqlLexer();
    private final Map<String, SecurityTemplate> templatesById;

    public SecurityTemplateProvider(String location) {
        this(new DefaultResourceLoader(), location);
    }

    public SecurityTemplateProvider(ResourceLoader loader, String location) {
        this(load(loader.getResource(location), location).templates());
    }

    public SecurityTemplateProvider(List<SecurityTemplate> templates) {
        Map<String, SecurityTemplate> byId = new LinkedHashMap<>();
        for (SecurityTemplate template : templates) {
            check(template);
            if (byId.putIfAbsent(template.id(), template) != null) {
                throw new IllegalStateException("Duplicate template id '" + template.id() + "'");
            }
        }
        this.templatesById = byId;
    }

    static TemplateCatalog load(Resource resource, String location) {
        if (!resource.exists() || !resource.isReadable()) {
            throw new IllegalStateException("Template catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            TemplateCatalog catalog = chooseMapper(location).readValue(in, TemplateCatalog.class);
            log.info("Template catalog: loaded {} template(s) from {}", catalog.templates().size(), location);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read template catalog " + location, e);
        }
    }

    private static ObjectMapper chooseMapper(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        ObjectMapper mapper = lower.endsWith(".json") ? new ObjectMapper() : new ObjectMapper(new YAMLFactory());
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<SecurityTemplate> getTemplates() {
        return List.copyOf(templatesById.values());
    }

    public List<SecurityTemplate> byCategory(SecurityCategory category) {
        return templatesById.values().stream().filter(t -> t.category() == category).toList();
    }

    public List<SecurityTemplate> byTag(String tag) {
        return templatesById.values().stream().filter(t -> t.tags().contains(tag)).toList();
    }

    public List<SecurityTemplate> byDifficulty(TemplateDifficulty difficulty) {
        return templatesById.values().stream().filter(t -> t.difficulty() == difficulty).toList();
    }

    public Optional<SecurityTemplate> getTemplate(String id) {
        return Optional.ofNullable(id).map(templatesById::get);
    }

    /** Every category, including those with no template yet. */
    public List<SecurityCategory> getCategories() {
        return List.of(SecurityCategory.values());
    }

    /** Case-insensitive search over name, description, tags and use case; a blank term returns everything. */
    public List<SecurityTemplate> searchTemplates(String term) {
        if (term == null || term.isBlank()) {
            return getTemplates();
        }
        String lower = term.trim().toLowerCase(Locale.ROOT);
        return templatesById.values().stream().filter(t -> t.matches(lower)).toList();
    }

    /**
     * @return the template query with every placeholder replaced
     * @throws IllegalArgumentException for an unknown template, an undeclared parameter, a missing value or a value
     *     that is not a valid literal of the parameter type
     */
    public String renderTemplate(String templateId, Map<String, ?> values) {
        SecurityTemplate template = getTemplate(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Template not found: " + templateId));
        Map<String, ?> given = values == null ? Map.of() : values;
        for (String key : given.keySet()) {
            if (template.findParameter(key).isEmpty()) {
                throw new IllegalArgumentException(
                        "Template '" + templateId + "' has no parameter '" + key + "'");
            }
        }
        Matcher m = PLACEHOLDER.matcher(template.query());
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            TemplateParameter parameter = template.findParameter(m.group(1)).orElseThrow();
            Object value = given.containsKey(parameter.name()) ? given.get(parameter.name()) : parameter.defaultValue();
            if (value == null) {
                throw new IllegalArgumentException("Template '" + templateId + "' needs a value for '"
                        + parameter.name() + "'");
            }
            m.appendReplacement(out, Matcher.quoteReplacement(literal(parameter, value)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private void check(SecurityTemplate template) {
        Set<String> declared = new HashSet<>();
        for (TemplateParameter parameter : template.parameters()) {
            if (!declared.add(parameter.name())) {
                throw new IllegalStateException(
                        "Template '" + template.id() + "' declares '" + parameter.name() + "' twice");
            }
            if (parameter.defaultValue() != null) {
                try {
                    literal(parameter, parameter.defaultValue());
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException("Template '" + template.id() + "': bad default for '"
                            + parameter.name() + "': " + e.getMessage(), e);
                }
            }
        }
        Matcher m = PLACEHOLDER.matcher(template.query());
        while (m.find()) {
            if (!declared.contains(m.group(1))) {
                throw new IllegalStateException(
                        "Template '" + template.id() + "' uses undeclared parameter '" + m.group(1) + "'");
            }
        }
    }

    private String literal(TemplateParameter parameter, Object value) {
        return switch (parameter.type()) {
            case STRING -> quote(value.toString());
            case NUMBER -> number(parameter, value);
            case TIMESPAN -> timespan(parameter, value);
            case DATETIME -> datetime(parameter, value);
            case BOOLEAN -> bool(parameter, value);
        };
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static String number(TemplateParameter parameter, Object value) {
        try {
            return new BigDecimal(value.toString().trim()).toPlainString();
        } catch (NumberFormatException e) {
            throw invalid(parameter, value);
        }
    }

    private String timespan(TemplateParameter parameter, Object value) {
        if (value instanceof Duration d) {
            if (d.isNegative()) throw invalid(parameter, value);
            if (d.toNanos() % 1_000_000_000L == 0) return d.toSeconds() + "s";
            if (d.toNanos() % 1_000_000L == 0) return d.toMillis() + "ms";
            return d.toNanos() / 100 + "ticks";
        }
        String text = value.toString().trim();
        return singleToken(text, TokenKind.TIMESPAN_LITERAL) ? text : failWith(parameter, value);
    }

    private String datetime(TemplateParameter parameter, Object value) {
        String text = "datetime(" + (value instanceof Instant i ? i.toString() : value.toString().trim()) + ")";
        return singleToken(text, TokenKind.DATETIME_LITERAL) ? text : failWith(parameter, value);
    }

    private static String bool(TemplateParameter parameter, Object value) {
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("false")) return text;
        throw invalid(parameter, value);
    }

    private boolean singleToken(String text, TokenKind kind) {
        try {
            List<Token> tokens = lexer.tokenize(text);
            return tokens.size() == 2 && tokens.get(0).kind() == kind;
        } catch (LexException e) {
            return false;
        }
    }

    private static String failWith(TemplateParameter parameter, Object value) {
        throw invalid(parameter, value);
    }

    private static IllegalArgumentException invalid(TemplateParameter parameter, Object value) {
        return new IllegalArgumentException(
                "Value '" + value + "' is not a valid " + parameter.type().label() + " for '" + parameter.name() + "'");
    }
}
