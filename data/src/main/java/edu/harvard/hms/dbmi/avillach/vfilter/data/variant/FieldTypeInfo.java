package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Jacksonized
@Value
@Builder
public class FieldTypeInfo {

    String key, description;
    FieldType type;
    @Builder.Default
    Multiplicity multiplicity = Multiplicity.SINGLE;
    @Builder.Default
    StorageClass storageClass = StorageClass.CATCH_ALL;
    FieldSource source;

    @JsonIgnore
    public boolean isPushable() {
        return storageClass == StorageClass.PUSHABLE;
    }

    @JsonIgnore
    public boolean isPerAlternate() {
        return multiplicity == Multiplicity.PER_ALTERNATE || source == FieldSource.ALTERNATE_ALLELE;
    }
}
