package edu.harvard.hms.dbmi.avillach.sdtm.builder.producer;

import edu.harvard.hms.dbmi.avillach.sdtm.data.record.Observation;
import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OdmObservationProducerTest {

    private final OdmObservationProducer producer = new OdmObservationProducer();

    static Path resource(String name) throws URISyntaxException {
        return Path.of(OdmObservationProducerTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    public void read_flattensEveryItemData() throws Exception {
        RecordStore records = producer.read(resource("odm/study01.xml"));

        assertEquals(7, records.size());
        assertEquals(
            new Observation("S_STUDY01", "SS_1001", "1001", "SE_SCREENING", "F_DM", "IG_DM", "1", "I_DM_SEX", "1"),
            records.observations().get(0)
        );
        assertEquals("I_VS_EVAL", records.observations().get(4).itemOid());
        assertEquals("INVESTIGATOR", records.observations().get(4).value());
    }

    @Test
    public void read_subjectWithoutKey_fallsBackToStudySubjectId() throws Exception {
        List<Observation> observations = producer.read(resource("odm/study01.xml")).observations();

        Observation sex = observations.get(5);
        assertEquals("1002", sex.subjectKey());
        assertEquals("1002", sex.studySubjectId());
        assertEquals("3", sex.value());
        assertNull(observations.get(6).value());
    }

    @Test
    public void read_withoutNamespace_andLowercaseStudySubjectId(@TempDir Path tempDir) throws IOException {
        Path odm = tempDir.resolve("plain.xml");
        Files.writeString(odm, """
            <ODM>
              <ClinicalData StudyOID="ST">
                <SubjectData SubjectKey="K1" studysubjectid="SUBJ-1">
                  <StudyEventData StudyEventOID="E1">
                    <FormData FormOID="F1">
                      <ItemGroupData ItemGroupOID="G1">
                        <ItemData ItemOID="I1" Value="v"/>
                      </ItemGroupData>
                    </FormData>
                  </StudyEventData>
                </SubjectData>
              </ClinicalData>
            </ODM>
            """);

        RecordStore records = producer.read(odm);

        assertEquals(List.of(new Observation("ST", "K1", "SUBJ-1", "E1", "F1", "G1", null, "I1", "v")), records.observations());
    }

    @Test
    public void read_malformedDocument_throwsIOException(@TempDir Path tempDir) throws IOException {
        Path odm = tempDir.resolve("broken.xml");
        Files.writeString(odm, "<ODM><ClinicalData>");

        assertThrows(IOException.class, () -> producer.read(odm));
    }
}
