package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

public enum FieldSource {
    VARIANT, COMMON_DATA, SAMPLE_EVIDENCE, ALTERNATE_ALLELE;

    public boolean isPerSample() {
        return this == SAMPLE_EVIDENCE || this == ALTERNATE_ALLELE;
    }
}
