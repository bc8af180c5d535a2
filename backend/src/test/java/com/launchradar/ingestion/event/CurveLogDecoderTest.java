package com.launchradar.ingestion.event;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.launchradar.domain.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static com.launchradar.ingestion.event.CurveLogFixtures.CREATOR;
import static com.launchradar.ingestion.event.CurveLogFixtures.ONE_ETH;
import static com.launchradar.ingestion.event.CurveLogFixtures.SUPPLY;
import static com.launchradar.ingestion.event.CurveLogFixtures.TOKEN;
import static com.launchradar.ingestion.event.CurveLogFixtures.TRADER;
import static org.assertj.core.api.Assertions.assertThat;

class CurveLogDecoderTest {

    private final CurveLogDecoder decoder = new CurveLogDecoder();

    @Test
    @DisplayName("TokenCreated decodes indexed addresses, strings and curve parameters")
    void decodesCreated() {
        Optional<CurveEvent> event = decoder.decode(CurveLogFixtures.created("0xaa", 10, 0));

        assertThat(event).containsInstanceOf(TokenCreatedLog.class);
        TokenCreatedLog created = (TokenCreatedLog) event.get();
        assertThat(created.tokenAddress()).isEqualTo(TOKEN);
        assertThat(created.creatorAddress()).isEqualTo(CREATOR);
        assertThat(created.name()).isEqualTo("Moon Cat");
        assertThat(created.symbol()).isEqualTo("MCAT");
        assertThat(created.uri()).isEqualTo("ipfs://cat");
        assertThat(created.totalSupply()).isEqualTo(SUPPLY);
        assertThat(created.virtualQuoteReserves()).isEqualTo(BigInteger.TEN.pow(17));
        assertThat(created.virtualTokenReserves()).isEqualTo(BigInteger.TEN.pow(24));
        assertThat(created.graduationThreshold()).isEqualTo(BigInteger.valueOf(5).multiply(ONE_ETH));
    }

    @Test
    @DisplayName("TokenBought and TokenSold normalize amount order")
    void decodesTrades() {
        BigInteger eth = ONE_ETH;
        BigInteger tokens = BigInteger.valueOf(1_000).multiply(ONE_ETH);

        TokenTradeLog buy = (TokenTradeLog) decoder.decode(CurveLogFixtures.bought("0xb1", 11, 0, eth, tokens)).orElseThrow();
        TokenTradeLog sell = (TokenTradeLog) decoder.decode(CurveLogFixtures.sold("0xb2", 12, 0, tokens, eth)).orElseThrow();

        assertThat(buy.side()).isEqualTo(TransactionType.BOUGHT);
        assertThat(buy.traderAddress()).isEqualTo(TRADER);
        assertThat(buy.quoteAmount()).isEqualTo(eth);
        assertThat(buy.tokenAmount()).isEqualTo(tokens);
        assertThat(buy.realQuoteReserves()).isEqualTo(eth);
        assertThat(buy.virtualQuoteReserves()).isEqualTo(BigInteger.TEN.pow(17).add(eth));
        assertThat(sell.side()).isEqualTo(TransactionType.SOLD);
        assertThat(sell.quoteAmount()).isEqualTo(eth);
        assertThat(sell.tokenAmount()).isEqualTo(tokens);
        assertThat(sell.topic()).isEqualTo(CurveEvents.TOKEN_SOLD_TOPIC);
    }

    @Test
    void decodesGraduated() {
        TokenGraduatedLog graduated = (TokenGraduatedLog) decoder.decode(CurveLogFixtures.graduated("0xc1", 13, 0)).orElseThrow();

        assertThat(graduated.tokenAddress()).isEqualTo(TOKEN);
        assertThat(graduated.graduationPrice()).isEqualTo(BigInteger.valueOf(42_000_000_000L));
    }

    @Test
    @DisplayName("unknown topic and truncated data decode to empty")
    void unknownOrTruncated() {
        ObjectNode other = CurveLogFixtures.graduated("0xc1", 13, 0);
        ((ArrayNode) other.get("topics")).set(0, other.textNode("0x" + "ab".repeat(32)));
        assertThat(decoder.decode(other)).isEmpty();

        ObjectNode truncated = CurveLogFixtures.created("0xaa", 10, 0);
        truncated.put("data", "0x1234");
        assertThat(decoder.decode(truncated)).isEmpty();

        assertThat(decoder.decode(truncated.objectNode())).isEmpty();
    }

    @Test
    @DisplayName("a malformed indexed address is logged and decodes to empty")
    void malformedTopicAddress() {
        ObjectNode bought = CurveLogFixtures.bought("0xb1", 11, 0, ONE_ETH, ONE_ETH.multiply(BigInteger.valueOf(1_000)));
        ((ArrayNode) bought.get("topics")).set(1, bought.textNode("0x12"));

        assertThat(decoder.decode(bought)).isEmpty();
    }

    @Test
    void topicHashesMatchEventSignatures() {
        assertThat(CurveEvents.TOKEN_GRADUATED_TOPIC).startsWith("0x").hasSize(66);
        assertThat(CurveEvents.ALL_TOPICS).doesNotHaveDuplicates().hasSize(4);
        assertThat(CurveEvents.addressTopic(TOKEN)).hasSize(66).endsWith(TOKEN.substring(2));
    }
}
