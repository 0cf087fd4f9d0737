package edu.harvard.hms.dbmi.avillach.vfilter.data.storage;

import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldTypeInfo;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A serialized, read only copy of a variant data set: the catch-all fields it declares and its variants.
 */
@Jacksonized
@Value
@Builder
public class VariantSnapshot {

    @Singular
    List<FieldTypeInfo> fields;
    @Singular
    List<VariantRecord> variants;
}
