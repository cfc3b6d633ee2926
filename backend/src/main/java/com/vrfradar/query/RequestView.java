package com.vrfradar.query;

import com.vrfradar.domain.RandomnessRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Filters, sorts and slices request aggregates for presentation. Pure, no I/O.
 */
@Component
public class RequestView {

    private static final Comparator<RandomnessRequest> BY_ID = Comparator.comparing(RandomnessRequest::id);

    public PageResult<RandomnessRequest> view(Collection<RandomnessRequest> aggregates, QueryParams params) {
        List<RandomnessRequest> sorted = sort(filter(aggregates, params.filters()), params.sortBy(), params.sortDirection());
        return paginate(sorted, params.page(), params.pageSize());
    }

    public List<RandomnessRequest> filter(Collection<RandomnessRequest> aggregates, RequestFilters filters) {
        return aggregates.stream().filter(r -> matches(r, filters)).toList();
    }

    /**
     * Stable sort by the given key; DESC reverses the key order only, ties are always broken by ascending id.
     */
    public List<RandomnessRequest> sort(List<RandomnessRequest> requests, SortField sortBy, SortDirection direction) {
        Comparator<RandomnessRequest> byKey = keyComparator(sortBy);
        if (direction == SortDirection.DESC) {
            byKey = byKey.reversed();
        }
        List<RandomnessRequest> sorted = new ArrayList<>(requests);
        sorted.sort(byKey.thenComparing(BY_ID));
        return sorted;
    }

    public <T> PageResult<T> paginate(List<T> items, int page, int pageSize) {
        long start = (long) (page - 1) * pageSize;
        long end = Math.min((long) page * pageSize, items.size());
        List<T> slice = start >= items.size() ? List.of() : items.subList((int) start, (int) end);
        boolean hasNext = (long) page * pageSize < items.size();
        return new PageResult<>(slice, items.size(), page, pageSize, hasNext, page > 1);
    }

    public RequestStats stats(Collection<RandomnessRequest> aggregates, RequestFilters filters) {
        return RequestStats.of(filter(aggregates, filters));
    }

    static boolean matches(RandomnessRequest r, RequestFilters f) {
        if (f.requester() != null && !f.requester().equalsIgnoreCase(r.requester())) {
            return false;
        }
        if (f.statuses() != null && !f.statuses().contains(r.status())) {
            return false;
        }
        if (f.fromTimestamp() != null && r.timestamp() < f.fromTimestamp()) {
            return false;
        }
        if (f.toTimestamp() != null && r.timestamp() > f.toTimestamp()) {
            return false;
        }
        if (f.minCallbackGasLimit() != null && r.callbackGasLimit().compareTo(f.minCallbackGasLimit()) < 0) {
            return false;
        }
        return f.maxCallbackGasLimit() == null || r.callbackGasLimit().compareTo(f.maxCallbackGasLimit()) <= 0;
    }

    private static Comparator<RandomnessRequest> keyComparator(SortField sortBy) {
        return switch (sortBy) {
            case TIMESTAMP -> Comparator.comparingLong(RandomnessRequest::timestamp);
            case FEE -> Comparator.comparing(RandomnessRequest::feePaid);
            case DEADLINE -> Comparator.comparingLong(RandomnessRequest::deadline);
        };
    }
}
