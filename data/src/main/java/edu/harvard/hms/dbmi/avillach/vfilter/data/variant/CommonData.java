package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Per variant annotation produced by a variant caller, not specific to any sample.
 */
@Jacksonized
@Value
@Builder
public class CommonData {

    @Singular
    Map<String, Object> values;

    public Object get(String key) {
        return values.get(key);
    }
}
