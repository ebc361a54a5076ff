package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.Block;

import java.util.List;

/**
 * Turns the blocks of one table into partial tables. Implementations hold no per-run state and never modify the record store.
 */
public interface AssemblyStrategy {

    StrategyResult process(String tableName, List<Block> blocks, RecordStore records, List<String> defaultKeys);
}
