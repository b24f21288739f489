package com.huntql.service.core.schema;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Catalog loaded once from a YAML or JSON resource, e.g. {@code classpath:/schema/security-catalog.yml}.
 */
public class ResourceSchemaProvider extends InMemorySchemaProvider {

    private static final Logger log = LoggerFactory.getLogger(ResourceSchemaProvider.class);

    public ResourceSchemaProvider(String location) {
        this(new DefaultResourceLoader(), location);
    }

    public ResourceSchemaProvider(ResourceLoader loader, String location) {
        super(load(loader.getResource(location), location));
    }

    static SchemaCatalog load(Resource resource, String location) {
        if (!resource.exists() || !resource.isReadable()) {
            throw new IllegalStateException("Schema catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            SchemaCatalog catalog = chooseMapper(location).readValue(in, SchemaCatalog.class);
            log.info(
                    "Schema catalog: loaded {} table(s) and {} function(s) from {}",
                    catalog.tables().size(),
                    catalog.functions().size(),
                    location);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema catalog " + location, e);
        }
    }

    private static ObjectMapper chooseMapper(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        ObjectMapper mapper = lower.endsWith(".json") ? new ObjectMapper() : new ObjectMapper(new YAMLFactory());
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
