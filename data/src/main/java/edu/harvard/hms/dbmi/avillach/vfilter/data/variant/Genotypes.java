package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedSet;
import java.util.TreeSet;

public final class Genotypes {

    private static final Logger log = LoggerFactory.getLogger(Genotypes.class);

    private static final Splitter ALLELE_SPLITTER = Splitter.on(CharMatcher.anyOf("/|")).trimResults().omitEmptyStrings();

    private static final String NO_CALL = ".";

    private Genotypes() {
    }

    /**
     * Allele indexes of a VCF style genotype that refer to alternate alleles. The reference allele is 0, so "0/2" returns {2} and
     * "1/1" returns {1}. Phased and unphased genotypes are treated the same and no-call alleles are skipped.
     */
    public static SortedSet<Integer> nonReferenceAlleleIndexes(String genotype) {
        SortedSet<Integer> alleleIndexes = new TreeSet<>();
        if (genotype == null) {
            return alleleIndexes;
        }
        for (String allele : ALLELE_SPLITTER.split(genotype)) {
            if (NO_CALL.equals(allele)) {
                continue;
            }
            try {
                int alleleIndex = Integer.parseInt(allele);
                if (alleleIndex > 0) {
                    alleleIndexes.add(alleleIndex);
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable allele [" + allele + "] in genotype " + genotype);
            }
        }
        return alleleIndexes;
    }
}
