package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import java.util.Optional;

public interface GeneRegionResolver {

    /**
     * A gene annotated with more than one interval resolves to its first one.
     */
    Optional<GeneRegion> resolve(String referenceGenomeId, String geneLabel);
}
