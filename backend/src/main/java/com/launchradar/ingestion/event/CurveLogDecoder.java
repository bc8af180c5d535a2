package com.launchradar.ingestion.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.launchradar.domain.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes raw contract logs ({@code topics} + {@code data}) into {@link CurveEvent}s. Logs of other events or with
 * truncated data decode to empty.
 */
@Slf4j
@Component
public class CurveLogDecoder {

    public Optional<CurveEvent> decode(JsonNode rawLog) {
        JsonNode topics = rawLog.path("topics");
        if (!topics.isArray() || topics.isEmpty()) {
            return Optional.empty();
        }
        String topic0 = topics.get(0).asText("").toLowerCase(Locale.ROOT);
        String data = rawLog.path("data").asText("0x");
        try {
            if (CurveEvents.TOKEN_CREATED_TOPIC.equals(topic0)) {
                return decodeCreated(topics, data);
            }
            if (CurveEvents.TOKEN_BOUGHT_TOPIC.equals(topic0)) {
                return decodeTrade(TransactionType.BOUGHT, topics, data);
            }
            if (CurveEvents.TOKEN_SOLD_TOPIC.equals(topic0)) {
                return decodeTrade(TransactionType.SOLD, topics, data);
            }
            if (CurveEvents.TOKEN_GRADUATED_TOPIC.equals(topic0)) {
                return decodeGraduated(topics, data);
            }
        } catch (RuntimeException e) {
            log.warn("Undecodable log with topic {}: {}", topic0, e.getMessage());
            return Optional.empty();
        }
        return Optional.empty();
    }

    private Optional<CurveEvent> decodeCreated(JsonNode topics, String data) {
        List<Type> values = FunctionReturnDecoder.decode(data, CurveEvents.TOKEN_CREATED.getNonIndexedParameters());
        if (topics.size() < 3 || values.size() < 8) {
            log.warn("TokenCreated log truncated: {} topics, {} values", topics.size(), values.size());
            return Optional.empty();
        }
        return Optional.of(new TokenCreatedLog(
                topicAddress(topics.get(1)),
                topicAddress(topics.get(2)),
                string(values.get(0)),
                string(values.get(1)),
                string(values.get(2)),
                string(values.get(3)),
                uint(values.get(4)),
                uint(values.get(5)),
                uint(values.get(6)),
                uint(values.get(7))));
    }

    private Optional<CurveEvent> decodeTrade(TransactionType side, JsonNode topics, String data) {
        List<Type> values = FunctionReturnDecoder.decode(data, CurveEvents.TOKEN_BOUGHT.getNonIndexedParameters());
        if (topics.size() < 3 || values.size() < 6) {
            log.warn("{} log truncated: {} topics, {} values", side, topics.size(), values.size());
            return Optional.empty();
        }
        BigInteger first = uint(values.get(0));
        BigInteger second = uint(values.get(1));
        BigInteger quoteAmount = side == TransactionType.BOUGHT ? first : second;
        BigInteger tokenAmount = side == TransactionType.BOUGHT ? second : first;
        return Optional.of(new TokenTradeLog(
                side,
                topicAddress(topics.get(1)),
                topicAddress(topics.get(2)),
                quoteAmount,
                tokenAmount,
                uint(values.get(2)),
                uint(values.get(3)),
                uint(values.get(4)),
                uint(values.get(5))));
    }

    private Optional<CurveEvent> decodeGraduated(JsonNode topics, String data) {
        List<Type> values = FunctionReturnDecoder.decode(data, CurveEvents.TOKEN_GRADUATED.getNonIndexedParameters());
        if (topics.size() < 2 || values.isEmpty()) {
            log.warn("TokenGraduated log truncated: {} topics, {} values", topics.size(), values.size());
            return Optional.empty();
        }
        return Optional.of(new TokenGraduatedLog(topicAddress(topics.get(1)), uint(values.get(0))));
    }

    static String topicAddress(JsonNode topic) {
        String hex = topic.asText("");
        if (hex.length() < 40) {
            throw new IllegalArgumentException("Topic is not an address: " + hex);
        }
        return "0x" + hex.substring(hex.length() - 40).toLowerCase(Locale.ROOT);
    }

    private static String string(Type value) {
        return ((Utf8String) value).getValue();
    }

    private static BigInteger uint(Type value) {
        return ((Uint256) value).getValue();
    }
}
