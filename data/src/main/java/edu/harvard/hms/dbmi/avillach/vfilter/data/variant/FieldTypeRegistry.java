package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import java.util.Collection;
import java.util.Optional;

public interface FieldTypeRegistry {

    Optional<FieldTypeInfo> lookup(String fieldKey);

    Collection<FieldTypeInfo> getFields();
}
