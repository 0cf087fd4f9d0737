package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the built in {@link VariantColumn}s plus the catch-all fields declared for a data set.
 */
public class DefaultFieldTypeRegistry implements FieldTypeRegistry {

    private final Map<String, FieldTypeInfo> fields;

    public DefaultFieldTypeRegistry(Collection<FieldTypeInfo> catchAllFields) {
        ImmutableMap.Builder<String, FieldTypeInfo> builder = ImmutableMap.builder();
        for (VariantColumn column : VariantColumn.values()) {
            builder.put(column.getKey(), column.fieldTypeInfo());
        }
        for (FieldTypeInfo field : catchAllFields) {
            validate(field);
            builder.put(field.getKey(), field);
        }
        // duplicate keys fail here
        this.fields = builder.buildOrThrow();
    }

    private void validate(FieldTypeInfo field) {
        if (field.getKey() == null || field.getKey().isBlank()) {
            throw new IllegalArgumentException("Field declarations require a key");
        } else if (field.getType() == null) {
            throw new IllegalArgumentException("Field " + field.getKey() + " has no type");
        } else if (field.getSource() == null || field.getSource() == FieldSource.VARIANT) {
            throw new IllegalArgumentException("Field " + field.getKey() + " must come from common data, sample evidence or an alternate allele");
        } else if (field.isPushable()) {
            throw new IllegalArgumentException("Field " + field.getKey() + " is not a variant column and cannot be pushed to the store");
        }
    }

    @Override
    public Optional<FieldTypeInfo> lookup(String fieldKey) {
        return Optional.ofNullable(fields.get(fieldKey));
    }

    @Override
    public Collection<FieldTypeInfo> getFields() {
        return fields.values();
    }
}
