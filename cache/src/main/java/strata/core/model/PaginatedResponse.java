package strata.core.model;

import java.util.List;

/**
 * A page of records enriched with the pagination metadata returned to clients.
 *
 * @param data the records of the page
 * @param total the total number of records
 * @param page the 1-based page number
 * @param limit the page size
 * @param totalPages the number of pages, {@code ceil(total / limit)}
 * @param <T> the record type
 */
public record PaginatedResponse<T>(List<T> data, long total, int page, int limit, long totalPages) {

    /**
     * Builds a response from a query result and the request that produced it.
     */
    public static <T> PaginatedResponse<T> of(PageResult<T> result, PageRequest request) {
        final var limit = request.limit();
        final var totalPages = (result.total() + limit - 1) / limit;
        return new PaginatedResponse<>(result.data(), result.total(), request.page(), limit, totalPages);
    }
}
