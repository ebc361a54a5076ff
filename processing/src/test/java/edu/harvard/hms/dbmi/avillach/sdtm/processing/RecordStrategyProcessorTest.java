package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.Block;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ColumnDefinition;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ProcessingType;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.SourceKind;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.TargetType;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ValueSource;
import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyWarning;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static edu.harvard.hms.dbmi.avillach.sdtm.processing.ObservationFixtures.list;
import static edu.harvard.hms.dbmi.avillach.sdtm.processing.ObservationFixtures.observation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class RecordStrategyProcessorTest {

    private AssemblyDiagnostics diagnostics;
    private RecordStrategyProcessor processor;

    @BeforeEach
    public void setup() {
        diagnostics = ObservationFixtures.diagnostics();
        processor = new RecordStrategyProcessor(diagnostics);
    }

    private static RecordStore labs() {
        return RecordStore.of(List.of(
            observation("S1", "SE_V1", "F_LB", "IG_LB_CHEM", "1", "LB_GLUC", "5.4"),
            observation("S1", "SE_V1", "F_LB", "IG_LB_CHEM", "1", "LB_ALT", "31"),
            observation("S1", "SE_V1", "F_LB", "IG_LB_HEME", "1", "LB_HGB", "13.9"),
            observation("S1", "SE_V1", "F_LB", "IG_LB_CHEM", "1", "LBX_COMMENT", "fasting"),
            observation("S2", "SE_V1", "F_VS", "IG_VS", "1", "LB_GLUC", "0")
        ));
    }

    @Test
    public void process_emitsOneRowPerMatchingObservation() {
        Block block = new Block(0, ProcessingType.RECORD, List.of("F_LB"), List.of("SubjectKey"), List.of(
            ColumnDefinition.of("USUBJID", ValueSource.SourceReference.column("SubjectKey")),
            ColumnDefinition.builder("LBTESTCD").source(new ValueSource.SourceReference(SourceKind.ITEM_OID, "ItemOID"))
                .regexExtract(Pattern.compile("LB_(\\w+)")).build(),
            ColumnDefinition.builder("LBORRES").source(new ValueSource.SourceReference(SourceKind.ITEM_VALUE, "Value"))
                .type(TargetType.FLOAT).build(),
            ColumnDefinition.of("VISIT", ValueSource.SourceReference.column("StudyEventOID")),
            ColumnDefinition.of("LBCAT", new ValueSource.Literal("CHEMISTRY"))
        ), "IG_LB_CH", "LB_");

        StrategyResult result = processor.process("LB", List.of(block), labs(), List.of());

        DataTable table = result.partialTables().get(0);
        assertEquals(List.of("USUBJID", "LBTESTCD", "LBORRES", "VISIT", "LBCAT"), table.columnNames());
        assertEquals(list("GLUC", "ALT"), table.column("LBTESTCD"));
        assertEquals(list(5.4, 31.0), table.column("LBORRES"));
        assertEquals(list("SE_V1", "SE_V1"), table.column("VISIT"));
        assertEquals(list("CHEMISTRY", "CHEMISTRY"), table.column("LBCAT"));
        verify(diagnostics, never()).warn(any(AssemblyWarning.class));
    }

    @Test
    public void filter_regexesMatchFromStartOfValue() {
        Block block = new Block(0, ProcessingType.RECORD, List.of(), null, List.of(), null, "GLUC");

        long matches = labs().observations().stream().filter(RecordStrategyProcessor.filter(block)).count();

        assertEquals(0, matches);
    }

    @Test
    public void process_nothingMatches_skipsBlock() {
        Block block = new Block(0, ProcessingType.RECORD, List.of("F_AE"), List.of("SubjectKey"),
            List.of(ColumnDefinition.of("USUBJID", ValueSource.SourceReference.column("SubjectKey"))), null, null);

        StrategyResult result = processor.process("AE", List.of(block), labs(), List.of());

        assertTrue(result.partialTables().isEmpty());
        verify(diagnostics).warn(eq(WarningReason.EMPTY_RECORD_SET), eq("AE"), eq(0), isNull(), anyString());
    }

    @Test
    public void process_unknownKeyColumn_skipsBlock() {
        Block block = new Block(0, ProcessingType.RECORD, List.of("F_LB"), List.of("Site"),
            List.of(ColumnDefinition.of("USUBJID", ValueSource.SourceReference.column("SubjectKey"))), null, null);

        StrategyResult result = processor.process("LB", List.of(block), labs(), List.of());

        assertTrue(result.partialTables().isEmpty());
        verify(diagnostics).warn(eq(WarningReason.MISSING_JOIN_KEY), eq("LB"), eq(0), isNull(), anyString());
    }
}
