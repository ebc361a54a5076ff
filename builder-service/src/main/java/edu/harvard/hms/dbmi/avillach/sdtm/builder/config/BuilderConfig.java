package edu.harvard.hms.dbmi.avillach.sdtm.builder.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the domain builder.
 *
 * Uses Spring Boot property binding with fail-fast validation.
 * All properties use the "builder.*" prefix.
 */
@ConfigurationProperties(prefix = "builder")
@Validated
public class BuilderConfig {
    private static final Logger log = LoggerFactory.getLogger(BuilderConfig.class);

    static final List<String> DEFAULT_KEYS = List.of("StudyOID", "SubjectKey", "StudyEventOID", "ItemGroupRepeatKey");

    // Required properties
    private String odmFile;
    private String specPath;
    private String outputDir;

    // Optional properties with defaults
    private String metadataFile; // null = metadata lookups fall back to codes
    private String warningFile;
    private List<String> defaultKeys = new ArrayList<>(DEFAULT_KEYS);
    private List<String> tables = new ArrayList<>(); // empty = every table in the specification
    private int tableThreads = 4;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        List<String> errors = new ArrayList<>();

        if (odmFile == null || odmFile.isBlank()) {
            errors.add("builder.odm-file is required");
        }
        if (specPath == null || specPath.isBlank()) {
            errors.add("builder.spec-path is required");
        }
        if (outputDir == null || outputDir.isBlank()) {
            errors.add("builder.output-dir is required");
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Missing required configuration properties:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        errors.clear();

        if (!Files.isRegularFile(Path.of(odmFile))) {
            errors.add("ODM file not found: " + odmFile);
        }
        if (!Files.exists(Path.of(specPath))) {
            errors.add("Specification path not found: " + specPath);
        }
        if (metadataFile != null && !metadataFile.isBlank() && !Files.isRegularFile(Path.of(metadataFile))) {
            // A missing metadata file only degrades lookups
            log.warn("Metadata file not found, lookups will fall back to codes: {}", metadataFile);
        }
        if (defaultKeys == null || defaultKeys.isEmpty()) {
            errors.add("builder.default-keys must name at least one key column");
        }
        if (tableThreads < 1) {
            errors.add("builder.table-threads must be at least 1, was " + tableThreads);
        }

        Path outputPath = Path.of(outputDir);
        try {
            Files.createDirectories(outputPath);
            if (!Files.isWritable(outputPath)) {
                errors.add("Output directory is not writable: " + outputDir);
            }
        } catch (Exception e) {
            errors.add("Cannot create output directory: " + outputDir + " - " + e.getMessage());
        }

        if (warningFile == null || warningFile.isBlank()) {
            warningFile = outputPath.resolve("warnings.jsonl").toString();
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("ODM file: {}", odmFile);
        log.info("Specification: {}", specPath);
        log.info("Metadata file: {}", metadataFile != null ? metadataFile : "(none)");
        log.info("Output dir: {}", outputDir);
        log.info("Warning file: {}", warningFile);
        log.info("Default keys: {}", defaultKeys);
        log.info("Tables: {}", tables.isEmpty() ? "(all)" : tables);
        log.info("Table threads: {}", tableThreads);
        log.info("================================");
    }

    public String getOdmFile() {
        return odmFile;
    }

    public void setOdmFile(String odmFile) {
        this.odmFile = odmFile;
    }

    public String getSpecPath() {
        return specPath;
    }

    public void setSpecPath(String specPath) {
        this.specPath = specPath;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getMetadataFile() {
        return metadataFile;
    }

    public void setMetadataFile(String metadataFile) {
        this.metadataFile = metadataFile;
    }

    public String getWarningFile() {
        return warningFile;
    }

    public void setWarningFile(String warningFile) {
        this.warningFile = warningFile;
    }

    public List<String> getDefaultKeys() {
        return defaultKeys;
    }

    public void setDefaultKeys(List<String> defaultKeys) {
        this.defaultKeys = defaultKeys;
    }

    public List<String> getTables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables == null ? new ArrayList<>() : tables;
    }

    public int getTableThreads() {
        return tableThreads;
    }

    public void setTableThreads(int tableThreads) {
        this.tableThreads = tableThreads;
    }
}
