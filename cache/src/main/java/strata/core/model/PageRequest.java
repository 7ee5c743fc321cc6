package strata.core.model;

/**
 * A 1-based page request.
 *
 * @param page the page number, starting at 1
 * @param limit the maximum number of records per page
 */
public record PageRequest(int page, int limit) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public PageRequest {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got: " + page);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
    }

    /**
     * Creates a page request from untrusted input.
     *
     * <p>Missing or non-positive values fall back to defaults; the limit is
     * capped at {@link #MAX_LIMIT}.
     *
     * @param page requested page (may be null)
     * @param limit requested limit (may be null)
     * @return a valid page request
     */
    public static PageRequest normalize(Integer page, Integer limit) {
        final var safePage = page == null ? DEFAULT_PAGE : Math.max(1, page);
        final var requestedLimit = limit == null || limit == 0 ? DEFAULT_LIMIT : limit;
        final var safeLimit = Math.min(Math.max(1, requestedLimit), MAX_LIMIT);
        return new PageRequest(safePage, safeLimit);
    }

    /**
     * Returns the number of records to skip for this page.
     */
    public long offset() {
        return (long) (page - 1) * limit;
    }
}
