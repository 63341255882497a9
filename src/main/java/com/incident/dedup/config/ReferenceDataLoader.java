package com.incident.dedup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ReferenceData} from JSON with Jackson.
 * The bundled defaults live in {@value #DEFAULT_RESOURCE} on the classpath.
 */
public final class ReferenceDataLoader {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    public static final String DEFAULT_RESOURCE = "/dedup-reference-data.json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static volatile ReferenceData defaults;

    private ReferenceDataLoader() {
        // Utility class
    }

    /**
     * Returns the bundled reference data, loaded once per class loader.
     */
    public static ReferenceData loadDefaults() {
        ReferenceData result = defaults;
        if (result == null) {
            synchronized (ReferenceDataLoader.class) {
                result = defaults;
                if (result == null) {
                    result = loadResource(DEFAULT_RESOURCE);
                    defaults = result;
                }
            }
        }
        return result;
    }

    public static ReferenceData loadResource(String resourcePath) {
        try (InputStream in = ReferenceDataLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Reference data resource not found: " + resourcePath);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read reference data resource " + resourcePath, e);
        }
    }

    public static ReferenceData load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read reference data file " + path, e);
        }
    }

    public static ReferenceData load(InputStream in) throws IOException {
        ReferenceData data = objectMapper.readValue(in, ReferenceData.class);
        log.info("reference.loaded sources={} synonymGroups={} keywordSignatures={}",
                data.sourcePriorities().size(),
                data.incidentTypeSynonymGroups().size(),
                data.keywordSignatures().size());
        return data;
    }
}
