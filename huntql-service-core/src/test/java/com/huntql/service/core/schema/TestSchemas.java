package com.huntql.service.core.schema;

import java.util.List;

/** Catalogs shared by the tests. */
public final class TestSchemas {

    public static final String SECURITY_CATALOG = "classpath:/schema/security-catalog.yml";

    private static SchemaProvider security;

    private TestSchemas() {}

    /** The bundled security catalog, loaded once. */
    public static synchronized SchemaProvider security() {
        if (security == null) {
            security = new ResourceSchemaProvider(SECURITY_CATALOG);
        }
        return security;
    }

    /** A single small {@code events} table plus the bundled function catalog. */
    public static SchemaProvider events() {
        TableInfo events = new TableInfo(
                "events",
                "events",
                "test events",
                1000,
                List.of(
                        ColumnInfo.of("id", "id", ColumnType.LONG),
                        ColumnInfo.of("user", "user_name", ColumnType.STRING),
                        ColumnInfo.of("host", "host", ColumnType.STRING),
                        ColumnInfo.of("severity", "severity", ColumnType.LONG),
                        ColumnInfo.of("bytes", "bytes", ColumnType.LONG)),
                null);
        return new InMemorySchemaProvider(List.of(events), security().listFunctions());
    }
}
