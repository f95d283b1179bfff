package com.ledgerly.core.global.web.response;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope for one page of a list. {@code page} is 1-based.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PagedResponse<T>(
        boolean success,
        String message,
        List<T> data,
        List<String> errors,
        OffsetDateTime timestamp,
        int page,
        int pageSize,
        long totalCount
) {

    public static <T> PagedResponse<T> of(List<T> data, int page, int pageSize, long totalCount) {
        return of(data, page, pageSize, totalCount, null);
    }

    public static <T> PagedResponse<T> of(List<T> data, int page, int pageSize, long totalCount, String message) {
        return new PagedResponse<>(true, message, List.copyOf(data), null, ApiResponse.now(), page, pageSize,
                totalCount);
    }

    public static <T> PagedResponse<T> error(String message, List<String> errors) {
        return new PagedResponse<>(false, message, List.of(), errors == null ? null : List.copyOf(errors),
                ApiResponse.now(), 0, 0, 0);
    }

    /**
     * Page count, capped at {@link Integer#MAX_VALUE}.
     */
    @JsonProperty("totalPages")
    public int totalPages() {
        if (pageSize <= 0 || totalCount <= 0) {
            return 0;
        }
        long pages = totalCount / pageSize + (totalCount % pageSize == 0 ? 0 : 1);
        return (int) Math.min(pages, Integer.MAX_VALUE);
    }

    @JsonProperty("hasPreviousPage")
    public boolean hasPreviousPage() {
        return page > 1;
    }

    @JsonProperty("hasNextPage")
    public boolean hasNextPage() {
        return page < totalPages();
    }
}
