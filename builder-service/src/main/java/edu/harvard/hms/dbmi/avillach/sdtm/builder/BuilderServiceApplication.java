package edu.harvard.hms.dbmi.avillach.sdtm.builder;

import edu.harvard.hms.dbmi.avillach.sdtm.builder.config.BuilderConfig;
import edu.harvard.hms.dbmi.avillach.sdtm.builder.diagnostics.JsonlWarningSink;
import edu.harvard.hms.dbmi.avillach.sdtm.builder.metadata.MetadataLoader;
import edu.harvard.hms.dbmi.avillach.sdtm.builder.output.CsvDomainWriter;
import edu.harvard.hms.dbmi.avillach.sdtm.builder.producer.OdmObservationProducer;
import edu.harvard.hms.dbmi.avillach.sdtm.builder.spec.MappingSpecificationLoader;
import edu.harvard.hms.dbmi.avillach.sdtm.data.metadata.MetadataStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.MappingSpecification;
import edu.harvard.hms.dbmi.avillach.sdtm.exception.SpecificationValidationException;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.DomainAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Clinical domain table builder.
 *
 * Orchestrates:
 * - ODM extraction into a flat record store
 * - Mapping specification and metadata loading
 * - Table-parallel domain assembly
 * - CSV output and warning capture
 *
 * Run with:
 * java -jar builder-service.jar \
 *   --builder.odm-file=/path/to/odm_export.xml \
 *   --builder.spec-path=/path/to/specs/ \
 *   --builder.metadata-file=/path/to/test_metadata.yaml \
 *   --builder.output-dir=/path/to/output/
 */
@SpringBootApplication(exclude = {
    org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration.class
})
@ConfigurationPropertiesScan("edu.harvard.hms.dbmi.avillach.sdtm.builder.config")
public class BuilderServiceApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(BuilderServiceApplication.class);

    private final BuilderConfig config;

    public BuilderServiceApplication(BuilderConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(BuilderServiceApplication.class);
        app.run(args);
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting domain build");

        String runId = UUID.randomUUID().toString();
        log.info("Run ID: {}", runId);
        Instant startTime = Instant.now();

        MappingSpecification specification;
        try {
            specification = new MappingSpecificationLoader().load(Path.of(config.getSpecPath()));
        } catch (SpecificationValidationException e) {
            log.error(e.getMessage());
            throw e;
        }
        MetadataStore metadata = new MetadataLoader().load(
            config.getMetadataFile() == null || config.getMetadataFile().isBlank() ? null : Path.of(config.getMetadataFile()));
        RecordStore records = new OdmObservationProducer().read(Path.of(config.getOdmFile()));

        if (records.isEmpty()) {
            log.error("!!! NO OBSERVATIONS EXTRACTED - EVERY TABLE WILL BE EMPTY !!!");
            log.error("ODM file: {}", config.getOdmFile());
        }

        try (JsonlWarningSink warningSink = new JsonlWarningSink(Path.of(config.getWarningFile()))) {
            DomainAssembler assembler = new DomainAssembler(metadata, warningSink);
            DomainBuildRunner runner = new DomainBuildRunner(
                assembler, new CsvDomainWriter(Path.of(config.getOutputDir())), warningSink, config.getTableThreads());

            DomainBuildRunner.BuildSummary summary = runner.run(specification, records, config.getDefaultKeys(), config.getTables());

            log.info("=== BUILD COMPLETE ===");
            log.info("Run ID: {}", runId);
            log.info("Observations: {}", records.size());
            log.info("Tables built: {}", summary.tables(DomainBuildRunner.Outcome.BUILT));
            log.info("Tables without output: {}", summary.tables(DomainBuildRunner.Outcome.SKIPPED));
            log.info("Tables failed: {}", summary.tables(DomainBuildRunner.Outcome.FAILED));
            log.info("Total warnings: {}", warningSink.getTotalWarnings());
            log.info("Duration: {} seconds", Duration.between(startTime, Instant.now()).toSeconds());
            log.info("Output: {}", config.getOutputDir());
            log.info("Warnings: {}", config.getWarningFile());
        }
    }
}
