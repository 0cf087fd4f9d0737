package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import io.swagger.v3.oas.annotations.media.Schema;

public enum ScopeType {
    @Schema(description = "Every sample in the scope must pass the condition")
    ALL, @Schema(description = "At least one sample in the scope must pass the condition")
    ANY, @Schema(description = "Exactly the samples in the scope, and no others, must pass the condition")
    ONLY
}
