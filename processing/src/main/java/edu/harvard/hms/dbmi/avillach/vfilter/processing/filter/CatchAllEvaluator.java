package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.CommonData;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldSource;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.SampleEvidence;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.VariantRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies catch-all conditions in process to variants returned by the store. Conditions are ANDed: each one can only remove
 * variants and narrow the samples recorded as passing.
 */
public class CatchAllEvaluator {

    private static final Logger log = LoggerFactory.getLogger(CatchAllEvaluator.class);

    static final int CANCELLATION_CHECK_INTERVAL = 1024;

    /**
     * @param candidates variants to test, only those present in {@code seed} are considered
     * @param seed       samples passing so far for each candidate
     * @param scope      the scope of the expression being evaluated, null when unscoped
     */
    public FilterEvalResult apply(
        List<VariantRecord> candidates, FilterEvalResult seed, List<ConditionTriple> triples, SampleScope scope, FilterCancellation cancellation
    ) {
        Map<Long, Set<String>> passingSampleIds = new LinkedHashMap<>();
        int scanned = 0;
        for (VariantRecord variant : candidates) {
            if (++scanned % CANCELLATION_CHECK_INTERVAL == 0) {
                cancellation.checkpoint("catch-all scan after " + scanned + " variants");
            }
            if (!seed.getVariantIds().contains(variant.getId())) {
                continue;
            }
            Set<String> samples = new HashSet<>(seed.getPassingSampleIds(variant.getId()));
            if (passesAll(variant, triples, scope, samples)) {
                passingSampleIds.put(variant.getId(), samples);
            }
        }
        if (!triples.isEmpty()) {
            log.debug("Catch-all conditions " + triples + " kept " + passingSampleIds.size() + " of " + seed.size() + " variants");
        }
        return FilterEvalResult.of(passingSampleIds);
    }

    private boolean passesAll(VariantRecord variant, List<ConditionTriple> triples, SampleScope scope, Set<String> samples) {
        for (ConditionTriple triple : triples) {
            if (triple.field().getSource() == FieldSource.COMMON_DATA) {
                // common data says nothing about samples, so the passing samples stay as they are
                if (!anyCommonRecordMatches(variant, triple)) {
                    return false;
                }
            } else {
                Set<String> samplesPassingTriple = samplesPassing(variant, triple);
                if (samplesPassingTriple.isEmpty() || !ScopeResolver.isSatisfied(samplesPassingTriple, scope)) {
                    return false;
                }
                samples.retainAll(samplesPassingTriple);
            }
        }
        return true;
    }

    private boolean anyCommonRecordMatches(VariantRecord variant, ConditionTriple triple) {
        for (CommonData commonData : variant.getCommonRecords()) {
            if (anyMatches(valuesOf(commonData.get(triple.fieldKey())), triple)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Called samples for which the condition holds. Per allele values are narrowed to the alleles in the sample's genotype, and the
     * sample passes if any of those does.
     */
    Set<String> samplesPassing(VariantRecord variant, ConditionTriple triple) {
        List<Object> alleleValues = triple.field().getSource() == FieldSource.ALTERNATE_ALLELE ? variant.alleleValues(triple.fieldKey()) : null;

        Set<String> passing = new HashSet<>();
        for (SampleEvidence evidence : variant.getEvidenceEntries()) {
            if (!evidence.isCalled()) {
                continue;
            }
            List<?> values;
            if (alleleValues != null) {
                values = selectAlleles(alleleValues, evidence.nonReferenceAlleleIndexes());
            } else {
                Object stored = evidence.get(triple.fieldKey());
                values = triple.field().isPerAlternate() && stored instanceof List<?> list
                    ? selectAlleles(list, evidence.nonReferenceAlleleIndexes())
                    : valuesOf(stored);
            }
            if (anyMatches(values, triple)) {
                passing.add(evidence.getSampleId());
            }
        }
        return passing;
    }

    private static List<Object> selectAlleles(List<?> valuesByAllele, SortedSet<Integer> alleleIndexes) {
        List<Object> selected = new ArrayList<>(alleleIndexes.size());
        for (int alleleIndex : alleleIndexes) {
            // allele 1 is the first alternate
            if (alleleIndex - 1 < valuesByAllele.size()) {
                selected.add(valuesByAllele.get(alleleIndex - 1));
            }
        }
        return selected;
    }

    private static List<?> valuesOf(Object stored) {
        if (stored instanceof List<?> list) {
            return list;
        }
        return stored == null ? List.of() : List.of(stored);
    }

    private static boolean anyMatches(List<?> values, ConditionTriple triple) {
        for (Object value : values) {
            if (triple.test(value)) {
                return true;
            }
        }
        return false;
    }
}
