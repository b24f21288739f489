package com.huntql.service.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.parser.KqlParser;
import com.huntql.service.core.kql.sql.SqlGenerator;
import com.huntql.service.core.schema.TestSchemas;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SecurityTemplateProviderTest {

    private static final SecurityTemplateProvider TEMPLATES =
            new SecurityTemplateProvider("classpath:/templates/security-templates.yml");

    private final KqlParser parser = new KqlParser();
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer(TestSchemas.security());
    private final SqlGenerator generator = new SqlGenerator(TestSchemas.security());

    @Test
    void loadsTemplatesWithMetadataFromYaml() {
        assertThat(TEMPLATES.getTemplates()).extracting(SecurityTemplate::id).containsExactly(
                "failed-logins-high-volume",
                "account-enumeration",
                "suspicious-network-connections",
                "privilege-escalation-detection",
                "malware-process-indicators",
                "data-exfiltration-patterns",
                "lateral-movement-detection",
                "anomalous-sign-ins");

        SecurityTemplate failedLogins = TEMPLATES.getTemplate("failed-logins-high-volume").orElseThrow();
        assertThat(failedLogins.category()).isEqualTo(SecurityCategory.AUTHENTICATION);
        assertThat(failedLogins.difficulty()).isEqualTo(TemplateDifficulty.BEGINNER);
        assertThat(failedLogins.mitreAttackIds()).containsExactly("T1110");
        assertThat(failedLogins.findParameter("timeRange")).get().satisfies(p -> {
            assertThat(p.type()).isEqualTo(ParameterType.TIMESPAN);
            assertThat(p.defaultValue()).isEqualTo("1h");
            assertThat(p.required()).isTrue();
            assertThat(p.options()).hasSize(5);
        });
        assertThat(TEMPLATES.getTemplate("nope")).isEmpty();
    }

    @Test
    void everyTemplateRendersWithDefaultsIntoAValidQuery() {
        for (SecurityTemplate template : TEMPLATES.getTemplates()) {
            String kql = TEMPLATES.renderTemplate(template.id(), Map.of());

            assertThat(kql).as(template.id()).doesNotContain("{").doesNotContain("}");
            assertThatCode(() -> {
                        Query query = parser.parse(kql);
                        analyzer.analyze(query);
                        generator.generate(query, "org-1");
                    })
                    .as(template.id())
                    .doesNotThrowAnyException();
        }
    }

    @Test
    void renderSubstitutesTypedLiterals() {
        String kql = TEMPLATES.renderTemplate("failed-logins-high-volume", Map.of("timeRange", "30m", "threshold", 5));

        assertThat(kql).contains("| where Timestamp > ago(30m)").contains("| where FailedAttempts > 5");
        assertThat(TEMPLATES.renderTemplate("failed-logins-high-volume", Map.of("timeRange", Duration.ofMinutes(90))))
                .contains("ago(5400s)")
                .contains("FailedAttempts > 10");
        assertThat(TEMPLATES.renderTemplate("anomalous-sign-ins", Map.of("riskThreshold", "8.5E-1")))
                .contains("RiskScore >= 0.85");
    }

    @Test
    void stringValuesAreQuotedAndEscaped() {
        String kql = TEMPLATES.renderTemplate("malware-process-indicators", Map.of("indicator", "x\" or true or \""));

        assertThat(kql).contains("CommandLine contains \"x\\\" or true or \\\"\"");
        Query query = parser.parse(kql);
        assertThat(query.pipeline()).hasSize(6);
    }

    @Test
    void valuesThatAreNotLiteralsOfTheirTypeAreRejected() {
        assertThatThrownBy(() -> TEMPLATES.renderTemplate("failed-logins-high-volume", Map.of("threshold", "5 | take 1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a valid number for 'threshold'");
        assertThatThrownBy(() -> TEMPLATES.renderTemplate("failed-logins-high-volume", Map.of("timeRange", "1h) | take 1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a valid timespan");
        assertThatThrownBy(() -> TEMPLATES.renderTemplate("failed-logins-high-volume", Map.of("timeRange", Duration.ofHours(-1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownTemplateOrParameterIsRejected() {
        assertThatThrownBy(() -> TEMPLATES.renderTemplate("nope", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Template not found: nope");
        assertThatThrownBy(() -> TEMPLATES.renderTemplate("failed-logins-high-volume", Map.of("treshold", 5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no parameter 'treshold'");
    }

    @Test
    void filtersByCategoryTagAndDifficulty() {
        assertThat(TEMPLATES.byCategory(SecurityCategory.LATERAL_MOVEMENT)).extracting(SecurityTemplate::id)
                .containsExactly("lateral-movement-detection");
        assertThat(TEMPLATES.byCategory(SecurityCategory.COMPLIANCE)).isEmpty();
        assertThat(TEMPLATES.byTag("threat-hunting")).extracting(SecurityTemplate::id)
                .containsExactly("malware-process-indicators", "lateral-movement-detection");
        assertThat(TEMPLATES.byDifficulty(TemplateDifficulty.BEGINNER)).extracting(SecurityTemplate::id)
                .containsExactly("failed-logins-high-volume", "account-enumeration");
        assertThat(TEMPLATES.getCategories()).hasSize(12).contains(SecurityCategory.PERSISTENCE);
    }

    @Test
    void searchMatchesNameDescriptionTagsAndUseCaseIgnoringCase() {
        assertThat(TEMPLATES.searchTemplates("BRUTE")).extracting(SecurityTemplate::id)
                .containsExactly("failed-logins-high-volume");
        assertThat(TEMPLATES.searchTemplates("exfil")).extracting(SecurityTemplate::id)
                .containsExactly("suspicious-network-connections", "data-exfiltration-patterns");
        assertThat(TEMPLATES.searchTemplates("  ")).hasSize(TEMPLATES.getTemplates().size());
    }

    @Test
    void catalogProblemsFailAtLoad() {
        SecurityTemplate undeclared = template("a", "T | where x > {limit}", List.of());
        assertThatThrownBy(() -> new SecurityTemplateProvider(List.of(undeclared)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("undeclared parameter 'limit'");

        SecurityTemplate plain = template("a", "T | take 1", List.of());
        assertThatThrownBy(() -> new SecurityTemplateProvider(List.of(plain, plain)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate template id 'a'");

        TemplateParameter badDefault =
                new TemplateParameter("when", ParameterType.DATETIME, null, "yesterday", true, null);
        assertThatThrownBy(() -> new SecurityTemplateProvider(
                        List.of(template("b", "T | where t > {when}", List.of(badDefault)))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("bad default for 'when'");
    }

    @Test
    void missingValueWithoutDefaultIsRejected() {
        TemplateParameter since = new TemplateParameter("since", ParameterType.DATETIME, null, null, true, null);
        SecurityTemplateProvider provider =
                new SecurityTemplateProvider(List.of(template("c", "T | where t > {since}", List.of(since))));

        assertThatThrownBy(() -> provider.renderTemplate("c", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs a value for 'since'");
        assertThat(provider.renderTemplate("c", Map.of("since", Instant.parse("2024-05-01T00:00:00Z"))))
                .isEqualTo("T | where t > datetime(2024-05-01T00:00:00Z)");
    }

    @Test
    void categoriesParseFromDisplayOrConstantNames() {
        assertThat(SecurityCategory.fromName("Network Security")).isEqualTo(SecurityCategory.NETWORK_SECURITY);
        assertThat(SecurityCategory.fromName("lateral-movement")).isEqualTo(SecurityCategory.LATERAL_MOVEMENT);
        assertThatThrownBy(() -> SecurityCategory.fromName("Cooking")).isInstanceOf(IllegalArgumentException.class);
    }

    private static SecurityTemplate template(String id, String query, List<TemplateParameter> parameters) {
        return new SecurityTemplate(id, null, null, SecurityCategory.THREAT_HUNTING, query, parameters,
                null, null, null, null, null);
    }
}
