package com.vrfradar.ingestion.decoder;

import com.vrfradar.domain.EventKind;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * ABI definitions of the coordinator events and their topic0 hashes.
 */
public final class CoordinatorEvents {

    public static final Event RANDOMNESS_REQUESTED = new Event("RandomnessRequested", Arrays.<TypeReference<?>>asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}));

    public static final Event RANDOMNESS_FULFILLED = new Event("RandomnessFulfilled", Arrays.<TypeReference<?>>asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<Bool>() {},
            new TypeReference<Uint256>() {}));

    public static final Event RANDOMNESS_CALLBACK_FAILED = new Event("RandomnessCallbackFailed", Arrays.<TypeReference<?>>asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Bytes32>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}));

    private static final Map<EventKind, Event> EVENTS = new EnumMap<>(Map.of(
            EventKind.REQUESTED, RANDOMNESS_REQUESTED,
            EventKind.FULFILLED, RANDOMNESS_FULFILLED,
            EventKind.CALLBACK_FAILED, RANDOMNESS_CALLBACK_FAILED));

    private static final Map<EventKind, String> TOPICS = new EnumMap<>(EventKind.class);

    static {
        EVENTS.forEach((kind, event) -> TOPICS.put(kind, EventEncoder.encode(event)));
    }

    private CoordinatorEvents() {
    }

    public static Event definition(EventKind kind) {
        return EVENTS.get(kind);
    }

    /** keccak-256 of the canonical signature, 0x-prefixed lower-case hex. */
    public static String topic(EventKind kind) {
        return TOPICS.get(kind);
    }

    public static Optional<EventKind> kindOfTopic(String topic0) {
        if (topic0 == null) {
            return Optional.empty();
        }
        return TOPICS.entrySet().stream()
                .filter(e -> e.getValue().equalsIgnoreCase(topic0))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
