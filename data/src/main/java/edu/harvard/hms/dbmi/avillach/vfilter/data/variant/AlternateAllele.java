package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One non-reference allele of a variant together with the annotation values that are specific to it.
 */
@Jacksonized
@Value
@Builder
public class AlternateAllele {

    String alt;
    @Singular
    Map<String, Object> values;

    public Object get(String key) {
        return values.get(key);
    }
}
