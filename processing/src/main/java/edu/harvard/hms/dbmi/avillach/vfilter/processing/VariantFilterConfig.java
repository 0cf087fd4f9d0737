package edu.harvard.hms.dbmi.avillach.vfilter.processing;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.GeneRegionResolver;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.VariantRecordStore;
import edu.harvard.hms.dbmi.avillach.vfilter.data.storage.*;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.DefaultFieldTypeRegistry;
import edu.harvard.hms.dbmi.avillach.vfilter.data.variant.FieldTypeRegistry;
import edu.harvard.hms.dbmi.avillach.vfilter.processing.filter.FilterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.util.List;

@Configuration
public class VariantFilterConfig {

    private static final Logger log = LoggerFactory.getLogger(VariantFilterConfig.class);

    @Value("${VARIANT_FILTER_MAX_SCOPE_DEPTH:8}")
    private int maxScopeDepth;

    @Value("${VARIANT_FILTER_MAX_NESTING_DEPTH:256}")
    private int maxNestingDepth;

    @Value("${VARIANT_FILTER_MAX_CONJUNCTIONS:1024}")
    private int maxConjunctions;

    @Value("${VARIANT_FILTER_PARALLEL_SCOPES:true}")
    private boolean parallelScopes;

    @Value("${VARIANT_FILTER_TIMEOUT_MS:0}")
    private long timeoutMillis;

    @Value("${VARIANT_FILTER_SNAPSHOT_FILE:}")
    private String snapshotFile;

    @Value("${VARIANT_FILTER_GENE_FILE:}")
    private String geneFile;

    @Bean
    public FilterSettings filterSettings() {
        FilterSettings settings = new FilterSettings(maxScopeDepth, maxNestingDepth, maxConjunctions, parallelScopes, timeoutMillis);
        log.info("Filter settings: " + settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public VariantSnapshot variantSnapshot() {
        if (snapshotFile.isBlank()) {
            log.warn("VARIANT_FILTER_SNAPSHOT_FILE is not set, starting with an empty variant store");
            return VariantSnapshot.builder().build();
        }
        return new VariantSnapshotLoader().load(new File(snapshotFile));
    }

    @Bean
    @ConditionalOnMissingBean
    public VariantRecordStore variantRecordStore(VariantSnapshot variantSnapshot) {
        return new InMemoryVariantStore(variantSnapshot.getVariants());
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldTypeRegistry fieldTypeRegistry(VariantSnapshot variantSnapshot) {
        return new DefaultFieldTypeRegistry(variantSnapshot.getFields());
    }

    @Bean
    @ConditionalOnMissingBean
    public GeneRegionResolver geneRegionResolver() {
        if (geneFile.isBlank()) {
            log.warn("VARIANT_FILTER_GENE_FILE is not set, GENE() conditions will not resolve");
            return new InMemoryGeneRegionResolver(List.of());
        }
        return new InMemoryGeneRegionResolver(new GeneRegionCsvLoader().load(new File(geneFile)));
    }
}
