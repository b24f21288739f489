package com.huntql.service.core.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Detection area a security template belongs to. */
public enum SecurityCategory {
    AUTHENTICATION("Authentication"),
    NETWORK_SECURITY("Network Security"),
    MALWARE_DETECTION("Malware Detection"),
    DATA_EXFILTRATION("Data Exfiltration"),
    PRIVILEGE_ESCALATION("Privilege Escalation"),
    LATERAL_MOVEMENT("Lateral Movement"),
    PERSISTENCE("Persistence"),
    RECONNAISSANCE("Reconnaissance"),
    THREAT_HUNTING("Threat Hunting"),
    COMPLIANCE("Compliance"),
    INCIDENT_RESPONSE("Incident Response"),
    ANOMALY_DETECTION("Anomaly Detection");

    private final String displayName;

    SecurityCategory(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /** Accepts the display name or the constant name, ignoring case, spaces and dashes. */
    @JsonCreator
    public static SecurityCategory fromName(String name) {
        String key = name.trim().replace(' ', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        for (SecurityCategory category : values()) {
            if (category.name().equals(key)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown security category: " + name);
    }
}
