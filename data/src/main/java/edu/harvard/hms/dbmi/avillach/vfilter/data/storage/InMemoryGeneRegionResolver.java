package edu.harvard.hms.dbmi.avillach.vfilter.data.storage;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.GeneRegion;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.GeneRegionResolver;

import java.util.Collection;
import java.util.Optional;

public class InMemoryGeneRegionResolver implements GeneRegionResolver {

    // reference genome id, gene label -> region
    private final ImmutableTable<String, String, GeneRegion> regions;

    public InMemoryGeneRegionResolver(Collection<GeneRegion> geneRegions) {
        Table<String, String, GeneRegion> table = HashBasedTable.create();
        for (GeneRegion region : geneRegions) {
            // genes with several intervals keep the first
            if (!table.contains(region.referenceGenomeId(), region.label())) {
                table.put(region.referenceGenomeId(), region.label(), region);
            }
        }
        this.regions = ImmutableTable.copyOf(table);
    }

    @Override
    public Optional<GeneRegion> resolve(String referenceGenomeId, String geneLabel) {
        return Optional.ofNullable(regions.get(referenceGenomeId, geneLabel));
    }
}
