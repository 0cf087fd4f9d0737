package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

public enum Multiplicity {
    /**
     * One value per record
     */
    SINGLE,
    /**
     * One value per alternate allele, ordered by allele index (Number=A in a VCF header)
     */
    PER_ALTERNATE
}
