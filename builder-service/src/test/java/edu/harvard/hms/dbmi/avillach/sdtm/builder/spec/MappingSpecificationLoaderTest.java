package edu.harvard.hms.dbmi.avillach.sdtm.builder.spec;

import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.MappingSpecification;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ProcessingType;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ValueSource;
import edu.harvard.hms.dbmi.avillach.sdtm.exception.SpecificationValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasKey;
import static org.junit.jupiter.api.Assertions.*;

public class MappingSpecificationLoaderTest {

    private final MappingSpecificationLoader loader = new MappingSpecificationLoader();

    private static Path resource(String name) throws Exception {
        return Path.of(MappingSpecificationLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    public void load_directory_readsYamlFilesInNameOrder() throws Exception {
        MappingSpecification specification = loader.load(resource("specs"));

        assertThat(specification.tables().keySet(), contains("DM", "VS"));
        assertEquals(ProcessingType.PIVOT, specification.table("DM").orElseThrow().processingType());
        assertEquals(ProcessingType.FUNCTIONAL, specification.table("VS").orElseThrow().processingType());
        assertTrue(specification.table("VS").orElseThrow().blocks().get(0).column("VSTESTCD").orElseThrow().isGenerated());
    }

    @Test
    public void load_jsonFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("ae.json");
        Files.writeString(file, """
            {"AE": [
              {"formoid": "F_AE", "columns": {"AETERM": "I_AE_TERM", "DOMAIN": {"literal": "AE"}}},
              {"formoid": ["F_AE_LOG"], "columns": {"AETERM": "I_AE_LOG_TERM"}}
            ]}
            """);

        MappingSpecification specification = loader.load(file);

        assertEquals(2, specification.table("AE").orElseThrow().blocks().size());
        assertEquals(new ValueSource.Literal("AE"),
            specification.table("AE").orElseThrow().blocks().get(0).column("DOMAIN").orElseThrow().source());
    }

    @Test
    public void load_laterFileRedefinesTable(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("a.yaml"), "DM:\n  formoid: F_OLD\n");
        Files.writeString(tempDir.resolve("b.yaml"), "DM:\n  formoid: F_NEW\n");
        Files.writeString(tempDir.resolve("c.yaml"), "");

        MappingSpecification specification = loader.load(tempDir);

        assertEquals(List.of("F_NEW"), specification.table("DM").orElseThrow().blocks().get(0).formOids());
    }

    @Test
    public void load_invalidSpecification_reportsEveryTable(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("bad.yaml"), """
            LB:
              type: matrix
            FA:
              type: functional
              columns:
                FATESTCD:
                  function: func_zz
            """);

        SpecificationValidationException e = assertThrows(SpecificationValidationException.class, () -> loader.load(tempDir));

        assertThat(e.getResult(), hasKey("LB"));
        assertThat(e.getResult(), hasKey("FA"));
        assertThat(e.getMessage(), containsString("unknown processing type 'matrix'"));
    }

    @Test
    public void load_missingPath_throwsIOException(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("absent.yaml")));
    }
}
