package strata.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of records together with the total record count.
 *
 * <p>This is the payload stored in the cache for paginated queries.
 *
 * @param data the records of the page
 * @param total the total number of records across all pages
 * @param <T> the record type
 */
public record PageResult<T>(List<T> data, long total) {

    public PageResult {
        data = data == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(data));
    }
}
