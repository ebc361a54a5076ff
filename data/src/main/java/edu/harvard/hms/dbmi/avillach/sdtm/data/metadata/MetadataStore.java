package edu.harvard.hms.dbmi.avillach.sdtm.data.metadata;

import com.google.common.collect.ImmutableMap;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.MetadataAttribute;

import java.util.Map;

/**
 * Read-only lookup from test code to {@link TestMetadata}.
 */
public final class MetadataStore {

    private static final MetadataStore EMPTY = new MetadataStore(Map.of());

    private final ImmutableMap<String, TestMetadata> entries;

    public MetadataStore(Map<String, TestMetadata> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    public static MetadataStore empty() {
        return EMPTY;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Maps a test code to the requested attribute. Unknown codes and absent attributes fall back to the code itself for
     * {@link MetadataAttribute#TEST} and to {@code null} otherwise.
     */
    public Object lookup(Object code, MetadataAttribute attribute) {
        if (code == null) {
            return null;
        }
        TestMetadata metadata = entries.get(code.toString());
        String value = metadata == null ? null : switch (attribute) {
            case TEST -> metadata.test();
            case OBJ -> metadata.obj();
        };
        if (value == null && attribute.fallsBackToCode()) {
            return code;
        }
        return value;
    }
}
