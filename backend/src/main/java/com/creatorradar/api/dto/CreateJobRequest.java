package com.creatorradar.api.dto;

import com.creatorradar.api.validation.SearchKeywords;
import com.creatorradar.api.validation.SupportedPlatform;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * POST /api/v2/jobs request body. Validated with Jakarta Bean Validation.
 * A missing enableExpansion means expansion on.
 */
public record CreateJobRequest(
        @NotBlank(message = "INVALID_OWNER")
        String ownerId,

        @SupportedPlatform
        String platform,

        @SearchKeywords
        List<String> keywords,

        @NotNull(message = "INVALID_TARGET")
        @Min(value = 1, message = "INVALID_TARGET")
        @Max(value = 1000, message = "INVALID_TARGET")
        Integer targetResults,

        Boolean enableExpansion
) {

    public boolean expansionEnabled() {
        return !Boolean.FALSE.equals(enableExpansion);
    }
}
