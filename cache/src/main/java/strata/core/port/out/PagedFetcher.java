package strata.core.port.out;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for a data source that can return one page of records and the
 * total record count of the same query.
 *
 * <p>Implementations are provided by the data-access layer. Failures of either
 * operation are business errors and are never masked by the caching layer.
 *
 * @param <T> the record type
 */
public interface PagedFetcher<T> {

    /**
     * Fetch one page of records.
     *
     * @param offset number of records to skip
     * @param limit maximum number of records to return
     * @return Uni with the records of the page
     */
    Uni<List<T>> fetchPage(long offset, int limit);

    /**
     * Count all records matched by the query, ignoring pagination.
     *
     * @return Uni with the total count
     */
    Uni<Long> fetchCount();

    /**
     * Fixed name of the query, used in slow-query logs and as a metric tag.
     * It must not contain per-call values such as ids or filter values.
     */
    default String description() {
        return getClass().getSimpleName();
    }

    /**
     * Adapts blocking fetch functions.
     *
     * <p>Each call is subscribed on the given executor, so a page fetch and a
     * count fetch started together run in parallel.
     *
     * @param description the query description
     * @param page blocking page function
     * @param count blocking count function
     * @param executor executor running the blocking calls
     * @param <T> the record type
     * @return a fetcher running the functions on the executor
     */
    static <T> PagedFetcher<T> blocking(
            String description, BlockingPageFunction<T> page, Supplier<Long> count, Executor executor) {
        Objects.requireNonNull(page, "page must not be null");
        Objects.requireNonNull(count, "count must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        return new PagedFetcher<>() {
            @Override
            public Uni<List<T>> fetchPage(long offset, int limit) {
                return Uni.createFrom().item(() -> page.fetch(offset, limit)).runSubscriptionOn(executor);
            }

            @Override
            public Uni<Long> fetchCount() {
                return Uni.createFrom().item(count).runSubscriptionOn(executor);
            }

            @Override
            public String description() {
                return description;
            }
        };
    }

    /**
     * A blocking page fetch.
     *
     * @param <T> the record type
     */
    @FunctionalInterface
    interface BlockingPageFunction<T> {
        List<T> fetch(long offset, int limit);
    }
}
