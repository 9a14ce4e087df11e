package dev.archivist.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /api/retrieve}.
 *
 * @param query natural-language query with optional inline filters
 * @param userId requesting user
 * @param k maximum number of files, default 5
 * @param searchType {@code vector}, {@code keyword} or {@code hybrid} (default)
 * @param minScore optional score threshold in [0, 1]
 */
public record RetrieveRequestBody(
    @NotBlank String query,
    @NotBlank String userId,
    @Nullable @Min(1) @Max(50) Integer k,
    @Nullable String searchType,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double minScore) {}
