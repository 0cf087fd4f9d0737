package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;

import java.util.Collection;
import java.util.List;

/**
 * Read only access to the variants of the backing store. Implementations are free to plan queries however they like but must
 * return exactly the variants {@link StorePredicate#test} accepts.
 */
public interface VariantRecordStore {

    /**
     * @param predicates conditions that must all hold, an empty list selects every variant of the reference genome
     * @return matching variants, always restricted to the reference genome, with their sample evidence attached
     */
    List<VariantRecord> query(String referenceGenomeId, List<StorePredicate> predicates);

    /**
     * Ids that do not exist, or belong to another reference genome, are skipped.
     */
    List<VariantRecord> getVariants(String referenceGenomeId, Collection<Long> variantIds);
}
