package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Variant fields that are real columns of the backing store and can therefore be filtered and sorted on by the store itself.
 */
public enum VariantColumn {

    POSITION("position", FieldType.INTEGER, variant -> (long) variant.getPosition()),
    CHROMOSOME("chromosome", FieldType.STRING, VariantRecord::getChromosome),
    REF("ref", FieldType.STRING, VariantRecord::getRef),
    TYPE("type", FieldType.STRING, VariantRecord::getType),
    UID("uid", FieldType.STRING, VariantRecord::getUid);

    private final String key;

    private final FieldType fieldType;

    private final Function<VariantRecord, Object> accessor;

    VariantColumn(String key, FieldType fieldType, Function<VariantRecord, Object> accessor) {
        this.key = key;
        this.fieldType = fieldType;
        this.accessor = accessor;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the column value, a Long for integer columns and a String otherwise
     */
    public Object valueOf(VariantRecord variant) {
        return accessor.apply(variant);
    }

    public FieldTypeInfo fieldTypeInfo() {
        return FieldTypeInfo.builder()
            .key(key)
            .description("Variant column " + key)
            .type(fieldType)
            .multiplicity(Multiplicity.SINGLE)
            .storageClass(StorageClass.PUSHABLE)
            .source(FieldSource.VARIANT)
            .build();
    }

    public static Optional<VariantColumn> forKey(String key) {
        return Arrays.stream(values()).filter(column -> column.key.equals(key)).findFirst();
    }
}
