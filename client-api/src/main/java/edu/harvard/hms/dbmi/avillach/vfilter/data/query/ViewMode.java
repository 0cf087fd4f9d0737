package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

import io.swagger.v3.oas.annotations.media.Schema;

public enum ViewMode {
    @Schema(description = "One row per variant, carrying the set of passing samples")
    CAST, @Schema(description = "One row per variant and passing sample")
    MELTED
}
