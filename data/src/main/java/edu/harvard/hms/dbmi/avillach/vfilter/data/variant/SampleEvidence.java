package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.SortedSet;

/**
 * The observation of a variant in a single sample.
 */
@Jacksonized
@Value
@Builder
public class SampleEvidence {

    String sampleId;
    boolean called;
    String genotype;
    @Singular
    Map<String, Object> values;

    public Object get(String key) {
        return values.get(key);
    }

    public SortedSet<Integer> nonReferenceAlleleIndexes() {
        return Genotypes.nonReferenceAlleleIndexes(genotype);
    }
}
