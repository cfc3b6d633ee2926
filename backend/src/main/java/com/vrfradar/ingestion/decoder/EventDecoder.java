package com.vrfradar.ingestion.decoder;

import com.vrfradar.common.HexQuantity;
import com.vrfradar.domain.BlockRef;
import com.vrfradar.domain.DomainEvent;
import com.vrfradar.domain.EventKind;
import com.vrfradar.domain.RandomnessCallbackFailedEvent;
import com.vrfradar.domain.RandomnessFulfilledEvent;
import com.vrfradar.domain.RandomnessRequestedEvent;
import com.vrfradar.ingestion.adapter.RawLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw coordinator logs into typed domain events. Pure: no I/O, no shared state.
 * All three events carry only static ABI types, so every indexed topic and every data word is 32 bytes.
 */
@Slf4j
@Component
public class EventDecoder {

    private static final int WORD_HEX_LENGTH = 64;

    /**
     * Decodes every log, skipping (and logging) the ones that do not decode. Never fails the batch.
     *
     * @param blocks headers by block number, used when a log carries no block timestamp
     */
    public List<DomainEvent> decodeAll(List<RawLog> logs, Map<Long, BlockRef> blocks) {
        List<DomainEvent> events = new ArrayList<>(logs.size());
        int skipped = 0;
        for (RawLog raw : logs) {
            try {
                events.add(decode(raw, blockFor(raw, blocks)));
            } catch (DecodeException e) {
                skipped++;
                log.warn("Skipping undecodable log tx={} logIndex={} block={}: {}",
                        raw.transactionHash(), raw.logIndex(), raw.blockNumber(), e.getMessage());
            }
        }
        if (skipped > 0) {
            log.info("Decoded {} of {} log(s), {} skipped", events.size(), logs.size(), skipped);
        }
        return events;
    }

    public DomainEvent decode(RawLog raw, BlockRef block) throws DecodeException {
        EventKind kind = CoordinatorEvents.kindOfTopic(raw.topic0())
                .orElseThrow(() -> new DecodeException("unknown topic0 " + raw.topic0()));
        if (block == null) {
            throw new DecodeException("no block header for block " + raw.blockNumber());
        }
        if (block.number() != raw.blockNumber()) {
            throw new DecodeException("block header " + block.number() + " does not match log block " + raw.blockNumber());
        }
        if (raw.transactionHash() == null || !HexQuantity.isHex(raw.transactionHash())) {
            throw new DecodeException("missing or malformed transaction hash");
        }
        if (raw.logIndex() < 0) {
            throw new DecodeException("negative log index " + raw.logIndex());
        }
        Event definition = CoordinatorEvents.definition(kind);
        List<String> indexed = indexedTopics(raw, definition);
        List<Type> values = nonIndexedValues(raw, definition);
        String txHash = raw.transactionHash().toLowerCase(Locale.ROOT);
        try {
            return switch (kind) {
                case REQUESTED -> new RandomnessRequestedEvent(
                        uint(indexed.get(0)),
                        address(indexed.get(1)),
                        bytes32(indexed.get(2)),
                        (BigInteger) values.get(0).getValue(),
                        (BigInteger) values.get(1).getValue(),
                        (BigInteger) values.get(2).getValue(),
                        (BigInteger) values.get(3).getValue(),
                        block, txHash, raw.logIndex());
                case FULFILLED -> new RandomnessFulfilledEvent(
                        uint(indexed.get(0)),
                        (BigInteger) values.get(0).getValue(),
                        (Boolean) values.get(1).getValue(),
                        (BigInteger) values.get(2).getValue(),
                        block, txHash, raw.logIndex());
                case CALLBACK_FAILED -> new RandomnessCallbackFailedEvent(
                        uint(indexed.get(0)),
                        Numeric.toHexString((byte[]) values.get(0).getValue()),
                        (BigInteger) values.get(1).getValue(),
                        (BigInteger) values.get(2).getValue(),
                        block, txHash, raw.logIndex());
            };
        } catch (RuntimeException e) {
            throw new DecodeException(kind.eventName() + " has malformed arguments: " + e.getMessage(), e);
        }
    }

    private static BlockRef blockFor(RawLog raw, Map<Long, BlockRef> blocks) {
        BlockRef known = blocks.get(raw.blockNumber());
        if (known != null) {
            return known;
        }
        return raw.blockTimestamp() != null ? new BlockRef(raw.blockNumber(), raw.blockTimestamp()) : null;
    }

    private static List<String> indexedTopics(RawLog raw, Event definition) throws DecodeException {
        int expected = definition.getIndexedParameters().size() + 1;
        if (raw.topics().size() != expected) {
            throw new DecodeException(definition.getName() + " expects " + expected + " topics, got " + raw.topics().size());
        }
        List<String> indexed = raw.topics().subList(1, expected);
        for (String topic : indexed) {
            if (!isWord(topic)) {
                throw new DecodeException(definition.getName() + " has a malformed indexed topic " + topic);
            }
        }
        return indexed;
    }

    private static List<Type> nonIndexedValues(RawLog raw, Event definition) throws DecodeException {
        List<TypeReference<Type>> params = definition.getNonIndexedParameters();
        String data = raw.data();
        int expectedLength = 2 + params.size() * WORD_HEX_LENGTH;
        if (data == null || !HexQuantity.isHex(data) || data.length() != expectedLength) {
            throw new DecodeException(definition.getName() + " expects " + params.size() + " data word(s), got "
                    + (data == null ? "no data" : data.length() + " hex chars"));
        }
        try {
            List<Type> values = FunctionReturnDecoder.decode(data, params);
            if (values.size() != params.size()) {
                throw new DecodeException(definition.getName() + " decoded " + values.size() + " of " + params.size() + " values");
            }
            return values;
        } catch (RuntimeException e) {
            throw new DecodeException(definition.getName() + " data does not decode: " + e.getMessage(), e);
        }
    }

    private static boolean isWord(String topic) {
        return topic != null && topic.length() == 2 + WORD_HEX_LENGTH && HexQuantity.isHex(topic);
    }

    private static BigInteger uint(String topic) {
        return ((Uint256) FunctionReturnDecoder.decodeIndexedValue(topic, new TypeReference<Uint256>() {})).getValue();
    }

    private static String address(String topic) {
        Address address = (Address) FunctionReturnDecoder.decodeIndexedValue(topic, new TypeReference<Address>() {});
        return address.getValue().toLowerCase(Locale.ROOT);
    }

    private static String bytes32(String topic) {
        Bytes32 value = (Bytes32) FunctionReturnDecoder.decodeIndexedValue(topic, new TypeReference<Bytes32>() {});
        return Numeric.toHexString(value.getValue());
    }
}
