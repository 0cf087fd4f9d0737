package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A single variant of a reference genome with everything the filter evaluator may need to look at: the pushable columns, the
 * caller's common data, the per sample evidence and the per allele annotations.
 */
@Jacksonized
@Value
@Builder
public class VariantRecord {

    long id;
    String referenceGenomeId;
    String chromosome;
    int position;
    String ref;
    String type;
    String uid;

    @Singular
    List<AlternateAllele> alternates;
    @Singular
    List<CommonData> commonRecords;
    @Singular
    List<SampleEvidence> evidenceEntries;
    @Singular
    Set<String> variantSetUids;

    /**
     * @return ids of every sample that has evidence for this variant, called or not
     */
    public Set<String> linkedSampleIds() {
        Set<String> sampleIds = new TreeSet<>();
        for (SampleEvidence evidence : evidenceEntries) {
            sampleIds.add(evidence.getSampleId());
        }
        return sampleIds;
    }

    /**
     * Values of a per allele field, element 0 belonging to allele 1. Alleles without a value for the key hold null.
     */
    public List<Object> alleleValues(String key) {
        List<Object> values = new ArrayList<>(alternates.size());
        for (AlternateAllele alternate : alternates) {
            values.add(alternate.get(key));
        }
        return values;
    }
}
