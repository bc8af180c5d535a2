package com.launchradar.ingestion.event;

import com.launchradar.domain.ChainId;
import com.launchradar.domain.TransactionType;
import com.launchradar.projection.BondingCurveMath;
import com.launchradar.projection.EventProjector;
import com.launchradar.projection.GraduationRecord;
import com.launchradar.projection.PriceSnapshot;
import com.launchradar.projection.TokenLaunch;
import com.launchradar.projection.TradeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Hands a decoded, located curve event to the {@link EventProjector}. Shared by the real-time listener and the
 * backfill scanner. Never throws: a failing event is logged so the caller moves on to the next one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CurveEventProcessor {

    private final EventProjector eventProjector;

    /**
     * @param curveAddress bonding-curve contract of the chain; it is the counterparty of every trade
     * @return true when the projector applied the event, false for duplicates, skips and failures
     */
    public boolean process(ChainId chain, String curveAddress, CurveEvent event, EventMetadata meta, Instant blockTimestamp) {
        try {
            if (event instanceof TokenCreatedLog created) {
                return onCreated(chain, curveAddress, created, meta, blockTimestamp);
            }
            if (event instanceof TokenTradeLog trade) {
                return onTrade(chain, curveAddress, trade, meta, blockTimestamp);
            }
            if (event instanceof TokenGraduatedLog graduated) {
                return eventProjector.recordGraduation(new GraduationRecord(
                        chain, meta.txHash(), graduated.tokenAddress(), graduated.graduationPrice(), curveAddress,
                        meta.blockNumber(), blockTimestamp));
            }
            log.warn("Unhandled curve event {} on {}", event.getClass().getSimpleName(), chain);
            return false;
        } catch (Exception e) {
            log.error("Projecting {} of {} (tx {}) on {} failed: {}", event.getClass().getSimpleName(),
                    event.tokenAddress(), meta.txHash(), chain, e.getMessage(), e);
            return false;
        }
    }

    private boolean onCreated(ChainId chain, String curveAddress, TokenCreatedLog created, EventMetadata meta, Instant at) {
        String price = BondingCurveMath.price(created.virtualQuoteReserves(), created.virtualTokenReserves());
        TokenLaunch launch = new TokenLaunch(
                chain,
                created.tokenAddress(),
                created.creatorAddress(),
                created.name(),
                created.symbol(),
                created.description(),
                created.uri(),
                created.totalSupply(),
                created.graduationThreshold(),
                curveAddress,
                meta.txHash(),
                meta.blockNumber(),
                at);
        return eventProjector.recordTokenCreated(launch, new PriceSnapshot(created.tokenAddress(), price, meta.blockNumber(), at));
    }

    private boolean onTrade(ChainId chain, String curveAddress, TokenTradeLog trade, EventMetadata meta, Instant at) {
        String price = BondingCurveMath.price(trade.virtualQuoteReserves(), trade.virtualTokenReserves());
        if (!BondingCurveMath.isValidPrice(price)) {
            log.warn("Rejected curve price for {} in tx {} (reserves {}/{})", trade.tokenAddress(), meta.txHash(),
                    trade.virtualQuoteReserves(), trade.virtualTokenReserves());
        }
        boolean buy = trade.side() == TransactionType.BOUGHT;
        TradeRecord record = new TradeRecord(
                chain,
                meta.txHash(),
                trade.tokenAddress(),
                trade.side(),
                buy ? curveAddress : trade.traderAddress(),
                buy ? trade.traderAddress() : curveAddress,
                trade.quoteAmount(),
                trade.tokenAmount(),
                trade.realQuoteReserves(),
                meta.blockNumber(),
                at);
        return eventProjector.recordTrade(record, new PriceSnapshot(trade.tokenAddress(), price, meta.blockNumber(), at));
    }
}
