package edu.harvard.hms.dbmi.avillach.sdtm.builder.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import edu.harvard.hms.dbmi.avillach.sdtm.data.metadata.MetadataStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.metadata.TestMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads test-code metadata: a YAML or JSON map of test code to {@code {test, obj}}.
 */
public class MetadataLoader {
    private static final Logger log = LoggerFactory.getLogger(MetadataLoader.class);

    private static final TypeReference<LinkedHashMap<String, TestMetadata>> ENTRIES = new TypeReference<>() {
    };

    /**
     * @param metadataFile may be null; a missing file yields an empty store
     */
    public MetadataStore load(Path metadataFile) throws IOException {
        if (metadataFile == null) {
            return MetadataStore.empty();
        }
        if (!Files.isRegularFile(metadataFile)) {
            log.warn("Metadata file not found: {}; lookups fall back to codes", metadataFile);
            return MetadataStore.empty();
        }
        boolean json = metadataFile.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
        ObjectMapper mapper = json ? new ObjectMapper() : new ObjectMapper(new YAMLFactory());
        Map<String, TestMetadata> entries = new LinkedHashMap<>();
        if (!Files.readString(metadataFile).isBlank()) {
            Map<String, TestMetadata> parsed = mapper.readValue(metadataFile.toFile(), ENTRIES);
            if (parsed != null) {
                parsed.forEach((code, metadata) -> {
                    if (metadata != null) {
                        entries.put(code, metadata);
                    }
                });
            }
        }
        log.info("Loaded {} metadata entries from {}", entries.size(), metadataFile);
        return new MetadataStore(entries);
    }
}
