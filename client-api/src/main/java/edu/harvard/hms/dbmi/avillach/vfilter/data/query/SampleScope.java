package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Set;

public record SampleScope(
    @Schema(description = "How the passing samples are compared to the scope samples") ScopeType scopeType,
    @Schema(description = "Identifiers of the samples this scope covers", example = "[\"sample1\", \"sample2\"]") Set<String> sampleIds
) {

    public SampleScope {
        if (scopeType == null) {
            throw new IllegalArgumentException("A scope requires a scope type");
        }
        sampleIds = sampleIds == null ? Set.of() : Set.copyOf(sampleIds);
    }
}
