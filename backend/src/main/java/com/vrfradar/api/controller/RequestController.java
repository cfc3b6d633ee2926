package com.vrfradar.api.controller;

import com.vrfradar.api.dto.BlockWindowResponse;
import com.vrfradar.api.dto.RandomnessRequestResponse;
import com.vrfradar.api.dto.RequestPageResponse;
import com.vrfradar.domain.RequestStatus;
import com.vrfradar.query.QueryParams;
import com.vrfradar.query.RequestFilters;
import com.vrfradar.query.RequestQueryOrchestrator;
import com.vrfradar.query.SortDirection;
import com.vrfradar.query.SortField;
import com.vrfradar.query.config.QueryProperties;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only randomness request history over the active block window.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RequestController {

    private final RequestQueryOrchestrator orchestrator;
    private final Clock clock;
    private final QueryProperties queryProperties;

    @GetMapping("/requests")
    public Mono<ResponseEntity<RequestPageResponse>> getRequests(
            @RequestParam(defaultValue = "0") @Min(0) int windowPage,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) int pageSize,
            @RequestParam(defaultValue = "TIMESTAMP") String sortBy,
            @RequestParam(defaultValue = "DESC") String sortDirection,
            @RequestParam(required = false) String requester,
            @RequestParam(required = false) List<String> status,
            @RequestParam(required = false) Long fromTimestamp,
            @RequestParam(required = false) Long toTimestamp,
            @RequestParam(required = false) BigInteger minGasLimit,
            @RequestParam(required = false) BigInteger maxGasLimit
    ) {
        if (pageSize > queryProperties.getMaxPageSize()) {
            throw new IllegalArgumentException("pageSize must be at most " + queryProperties.getMaxPageSize());
        }
        RequestFilters filters = new RequestFilters(
                requester == null || requester.isBlank() ? null : requester.trim(),
                parseStatuses(status),
                fromTimestamp,
                toTimestamp,
                minGasLimit,
                maxGasLimit);
        QueryParams params = new QueryParams(page, pageSize, filters,
                parseEnum(SortField.class, sortBy, "sortBy"),
                parseEnum(SortDirection.class, sortDirection, "sortDirection"));
        return orchestrator.query(params, windowPage)
                .map(result -> ResponseEntity.ok(RequestPageResponse.from(result, clock.instant())));
    }

    @GetMapping("/requests/{id}")
    public ResponseEntity<RandomnessRequestResponse> getRequest(@PathVariable BigInteger id) {
        return orchestrator.findRequest(id)
                .map(r -> ResponseEntity.ok(RandomnessRequestResponse.from(r, clock.instant())))
                .orElseThrow(() -> new ResourceNotFoundException("REQUEST_NOT_FOUND",
                        "Request " + id + " is not in the current block window"));
    }

    @PostMapping("/requests/refresh")
    public Mono<ResponseEntity<RequestPageResponse>> refresh() {
        return orchestrator.refetch()
                .map(result -> ResponseEntity.ok(RequestPageResponse.from(result, clock.instant())));
    }

    @GetMapping("/blocks/window")
    public ResponseEntity<BlockWindowResponse> getBlockWindow() {
        return orchestrator.blockWindowInfo()
                .map(info -> ResponseEntity.ok(BlockWindowResponse.from(info)))
                .orElseThrow(() -> new ResourceNotFoundException("NO_WINDOW", "No block window has been loaded yet"));
    }

    private static Set<RequestStatus> parseStatuses(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        Set<RequestStatus> statuses = EnumSet.noneOf(RequestStatus.class);
        for (String value : values) {
            if (!value.isBlank()) {
                statuses.add(parseEnum(RequestStatus.class, value, "status"));
            }
        }
        return statuses;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String name) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported " + name + ": " + value);
        }
    }
}
