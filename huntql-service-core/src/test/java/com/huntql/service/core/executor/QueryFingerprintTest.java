package com.huntql.service.core.executor;

import static org.assertj.core.api.Assertions.assertThat;

import com.huntql.service.core.kql.lexer.KqlLexer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryFingerprintTest {

    private final KqlLexer lexer = new KqlLexer();

    private String fingerprint(String query, String org) {
        return QueryFingerprint.of(lexer.normalize(query), org, Map.of("maxRows", 100));
    }

    @Test
    void whitespaceCommentsAndKeywordCaseDoNotMatter() {
        String base = fingerprint("SecurityEvent | where EventID == 4625 | summarize count() by Account", "org-1");

        assertThat(fingerprint("SecurityEvent\n\t| WHERE EventID==4625 // failed logons\n| Summarize count() BY Account",
                        "org-1"))
                .isEqualTo(base);
        assertThat(fingerprint("SecurityEvent | where Account == 'x'", "org-1"))
                .isEqualTo(fingerprint("SecurityEvent | where Account == \"x\"", "org-1"));
    }

    @Test
    void identifiersLiteralsAndOrganizationDo() {
        String base = fingerprint("SecurityEvent | where Account == \"x\"", "org-1");

        assertThat(fingerprint("SecurityEvent | where Account == \"X\"", "org-1")).isNotEqualTo(base);
        assertThat(fingerprint("SecurityEvent | where account == \"x\"", "org-1")).isNotEqualTo(base);
        assertThat(fingerprint("SecurityEvent | where Account == \"x\"", "org-2")).isNotEqualTo(base);
    }

    @Test
    void bindingsAreOrderIndependentButValueSensitive() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", "two");
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", "two");
        ba.put("a", 1);

        assertThat(QueryFingerprint.of("T", "org", ab)).isEqualTo(QueryFingerprint.of("T", "org", ba));
        assertThat(QueryFingerprint.of("T", "org", Map.of("maxRows", 1)))
                .isNotEqualTo(QueryFingerprint.of("T", "org", Map.of("maxRows", 2)));
    }

    @Test
    void isLowerCaseSha256Hex() {
        assertThat(QueryFingerprint.of("T", "org", Map.of())).matches("[0-9a-f]{64}");
    }
}
