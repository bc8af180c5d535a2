package com.launchradar.projection;

import com.launchradar.domain.GraduationThresholdReachedEvent;
import com.launchradar.domain.HolderSnapshot;
import com.launchradar.domain.LiquidityEvent;
import com.launchradar.domain.Token;
import com.launchradar.domain.TokenCreatedEvent;
import com.launchradar.domain.TokenGraduatedEvent;
import com.launchradar.domain.TokenHistory;
import com.launchradar.domain.TokenPriceUpdatedEvent;
import com.launchradar.domain.TokenTradedEvent;
import com.launchradar.domain.TradeTransaction;
import com.launchradar.domain.TradeTransactionRepository;
import com.launchradar.pricing.UsdPriceOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Projects decoded curve events into tokens, transactions, token_holders, liquidity_events and token_histories.
 * Every write is an insert guarded by a unique index or a conditional update, so the live listener and the
 * backfill scanner may deliver the same event concurrently and in any order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventProjector {

    static final String METHOD_GRADUATED = "TokenGraduated";

    private final MongoTemplate mongoTemplate;
    private final TradeTransactionRepository tradeTransactionRepository;
    private final TokenHolderLedger holderLedger;
    private final UsdPriceOracle usdPriceOracle;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Upserts the token, seeds the curve as holder of the whole supply and stores the initial price snapshot. Trades
     * projected before the launch stay applied to the curve's seeded balance.
     *
     * @return true when this call seeded the curve holder row, i.e. the launch was projected for the first time
     */
    public boolean recordTokenCreated(TokenLaunch launch, PriceSnapshot initialPrice) {
        long chainId = launch.chain().id();
        Instant now = clock.instant();
        Instant at = launch.blockTimestamp() != null ? launch.blockTimestamp() : now;

        upsertToken(launch, now);
        BigDecimal ethUsd = usdPriceOracle.getUsdPrice();
        if (BondingCurveMath.isValidPrice(initialPrice.tokenPrice())) {
            BigInteger marketCap = BondingCurveMath.marketCap(launch.totalSupply(), initialPrice.tokenPrice());
            Query unpriced = tokenQuery(launch.tokenAddress(), chainId)
                    .addCriteria(Criteria.where("currentPrice").is(null));
            mongoTemplate.updateFirst(unpriced, priceUpdate(initialPrice, marketCap, ethUsd, now), Token.class);
        }

        Token token = findToken(launch.tokenAddress(), chainId);
        if (token == null) {
            throw new IllegalStateException("Token " + launch.tokenAddress() + " missing right after upsert");
        }
        boolean seeded = holderLedger.seedIfAbsent(token, launch.curveAddress(), launch.totalSupply(), launch.txHash(), at);
        if (!seeded) {
            log.debug("Token {} on chain {} already projected", launch.tokenAddress(), chainId);
            return false;
        }
        holderLedger.recalculatePercentages(launch.tokenAddress(), launch.totalSupply(), chainId);

        BigInteger marketCap = BondingCurveMath.marketCap(launch.totalSupply(), initialPrice.tokenPrice());
        insertHistory(token, initialPrice.tokenPrice(), marketCap, ethUsd, launch.blockNumber(), at);

        List<HolderSnapshot> holders = holderLedger.snapshot(launch.tokenAddress(), chainId,
                BondingCurveMath.priceToUsd(initialPrice.tokenPrice(), ethUsd));
        applicationEventPublisher.publishEvent(new TokenCreatedEvent(
                chainId,
                launch.tokenAddress(),
                launch.creatorAddress(),
                launch.name(),
                launch.symbol(),
                launch.txHash(),
                launch.blockNumber(),
                initialPrice.tokenPrice(),
                marketCap.toString(),
                BigInteger.ZERO.toString(),
                holders));
        log.info("Projected token {} ({}) on chain {} at block {}", launch.symbol(), launch.tokenAddress(), chainId, launch.blockNumber());
        return true;
    }

    /**
     * Inserts the trade, moves the curve price and both holder balances, then recomputes holder percentages.
     * A trade already applied, or one for a token not yet projected, changes nothing. A trade stored by an attempt
     * that failed midway is finished by the next delivery.
     *
     * @return true when the trade was applied by this call
     */
    public boolean recordTrade(TradeRecord trade, PriceSnapshot price) {
        long chainId = trade.chain().id();
        Token token = findToken(trade.tokenAddress(), chainId);
        if (token == null) {
            log.warn("Skipping {} {} for unknown token {} on chain {}", trade.type(), trade.txHash(), trade.tokenAddress(), chainId);
            return false;
        }
        Instant now = clock.instant();
        Instant at = trade.blockTimestamp() != null ? trade.blockTimestamp() : now;
        BigDecimal ethUsd = usdPriceOracle.getUsdPrice();
        BigDecimal priceUsd = BondingCurveMath.priceToUsd(price.tokenPrice(), ethUsd);

        TradeTransaction tx = new TradeTransaction();
        tx.setTxHash(trade.txHash());
        tx.setChainId(chainId);
        tx.setTokenId(token.getId());
        tx.setTokenAddress(trade.tokenAddress());
        tx.setType(trade.type());
        tx.setSenderAddress(trade.senderAddress());
        tx.setRecipientAddress(trade.recipientAddress());
        tx.setQuoteAmount(trade.quoteAmount().toString());
        tx.setTokenAmount(trade.tokenAmount().toString());
        tx.setTokenPrice(price.tokenPrice());
        tx.setTokenPriceUsd(priceUsd);
        tx.setBlockNumber(trade.blockNumber());
        tx.setBlockTimestamp(at);
        tx.setStatus(TradeTransaction.STATUS_CONFIRMED);
        tx.setMethodName(methodName(trade));
        tx.setCreatedAt(now);
        tx.setApplied(false);
        try {
            mongoTemplate.insert(tx);
        } catch (DuplicateKeyException e) {
            TradeTransaction stored = tradeTransactionRepository.findByTxHashAndChainId(trade.txHash(), chainId).orElse(null);
            if (stored == null || stored.isApplied()) {
                log.debug("Trade {} on chain {} already recorded", trade.txHash(), chainId);
                return false;
            }
            log.info("Resuming trade {} on chain {} left partially applied", trade.txHash(), chainId);
            tx = stored;
        }

        BigInteger totalSupply = BondingCurveMath.parse(token.getTotalSupply());
        BigInteger threshold = BondingCurveMath.parse(token.getGraduationThreshold());
        BigInteger marketCap = BondingCurveMath.marketCap(totalSupply, price.tokenPrice());
        String progress = BondingCurveMath.graduationProgress(trade.realQuoteReserves(), threshold).toString();
        applyTradePrice(token, price, marketCap, progress, ethUsd, now);

        holderLedger.applyDelta(token, trade.senderAddress(), trade.tokenAmount().negate(), trade.txHash(), at);
        holderLedger.applyDelta(token, trade.recipientAddress(), trade.tokenAmount(), trade.txHash(), at);
        holderLedger.recalculatePercentages(trade.tokenAddress(), totalSupply, chainId);
        if (!markApplied(tx)) {
            log.debug("Trade {} on chain {} completed concurrently", trade.txHash(), chainId);
            return false;
        }

        if (insertHistory(token, price.tokenPrice(), marketCap, ethUsd, trade.blockNumber(), at)) {
            applicationEventPublisher.publishEvent(new TokenPriceUpdatedEvent(
                    chainId, trade.tokenAddress(), price.tokenPrice(), priceUsd, marketCap.toString(),
                    BondingCurveMath.weiToUsd(marketCap, ethUsd), trade.blockNumber(), at));
        }
        if (token.isActive() && threshold.signum() > 0 && trade.realQuoteReserves() != null
                && trade.realQuoteReserves().compareTo(threshold) >= 0) {
            log.info("Token {} on chain {} reached its graduation threshold", trade.tokenAddress(), chainId);
            applicationEventPublisher.publishEvent(new GraduationThresholdReachedEvent(
                    chainId, trade.tokenAddress(), trade.realQuoteReserves().toString(), threshold.toString()));
        }

        applicationEventPublisher.publishEvent(new TokenTradedEvent(
                chainId,
                trade.tokenAddress(),
                trade.type(),
                trade.traderAddress(),
                tx.getQuoteAmount(),
                tx.getTokenAmount(),
                trade.txHash(),
                trade.blockNumber(),
                at,
                price.tokenPrice(),
                priceUsd,
                marketCap.toString(),
                BondingCurveMath.weiToUsd(marketCap, ethUsd),
                progress,
                holderLedger.snapshot(trade.tokenAddress(), chainId, priceUsd)));
        log.debug("Recorded {} {} of {} on chain {}", trade.type(), trade.txHash(), trade.tokenAddress(), chainId);
        return true;
    }

    /**
     * Stores the graduation as a liquidity add and retires the token from curve pricing.
     *
     * @return true when the liquidity event was inserted by this call
     */
    public boolean recordGraduation(GraduationRecord graduation) {
        long chainId = graduation.chain().id();
        Instant now = clock.instant();
        Instant at = graduation.blockTimestamp() != null ? graduation.blockTimestamp() : now;
        String graduationPrice = BondingCurveMath.formatUnits(graduation.graduationPrice());

        Query byToken = tokenQuery(graduation.tokenAddress(), chainId);
        mongoTemplate.updateFirst(Query.of(byToken).addCriteria(Criteria.where("graduatedAt").is(null)),
                new Update().set("graduatedAt", at), Token.class);
        mongoTemplate.updateFirst(byToken, new Update()
                .set("active", false)
                .set("pricingSource", Token.PricingSource.MIGRATED)
                .set("updatedAt", now), Token.class);

        Token token = findToken(graduation.tokenAddress(), chainId);
        LiquidityEvent event = new LiquidityEvent();
        event.setTxHash(graduation.txHash());
        event.setChainId(chainId);
        event.setTokenId(token != null ? token.getId() : null);
        event.setTokenAddress(graduation.tokenAddress());
        event.setType(LiquidityEvent.LiquidityEventType.ADD);
        event.setProviderAddress(graduation.curveAddress());
        event.setTokenPrice(graduationPrice);
        event.setBlockNumber(graduation.blockNumber());
        event.setBlockTimestamp(at);
        event.setMethodName(METHOD_GRADUATED);
        event.setStatus(TradeTransaction.STATUS_CONFIRMED);
        event.setCreatedAt(now);
        try {
            mongoTemplate.insert(event);
        } catch (DuplicateKeyException e) {
            log.debug("Graduation {} on chain {} already recorded", graduation.txHash(), chainId);
            return false;
        }
        applicationEventPublisher.publishEvent(new TokenGraduatedEvent(
                chainId, graduation.tokenAddress(), graduation.txHash(), graduation.blockNumber(), graduationPrice));
        log.info("Token {} on chain {} graduated at block {}", graduation.tokenAddress(), chainId, graduation.blockNumber());
        return true;
    }

    public void recalculatePercentages(String tokenAddress, BigInteger totalSupply, long chainId) {
        holderLedger.recalculatePercentages(tokenAddress, totalSupply, chainId);
    }

    private void upsertToken(TokenLaunch launch, Instant now) {
        long chainId = launch.chain().id();
        Query query = tokenQuery(launch.tokenAddress(), chainId);
        Update update = new Update()
                .setOnInsert("address", launch.tokenAddress())
                .setOnInsert("chainId", chainId)
                .setOnInsert("name", launch.name())
                .setOnInsert("symbol", launch.symbol())
                .setOnInsert("description", launch.description())
                .setOnInsert("logoUri", launch.logoUri())
                .setOnInsert("creatorAddress", launch.creatorAddress())
                .setOnInsert("totalSupply", launch.totalSupply().toString())
                .setOnInsert("graduationThreshold", launch.graduationThreshold().toString())
                .setOnInsert("graduationProgress", BigInteger.ZERO.toString())
                .setOnInsert("pricingSource", Token.PricingSource.BONDING_CURVE)
                .setOnInsert("active", true)
                .setOnInsert("createdAt", now)
                .set("updatedAt", now);
        try {
            mongoTemplate.upsert(query, update, Token.class);
        } catch (DuplicateKeyException e) {
            log.debug("Token {} on chain {} inserted concurrently", launch.tokenAddress(), chainId);
        }
        // rows created through the API carry no curve parameters yet
        mongoTemplate.updateFirst(Query.of(query).addCriteria(Criteria.where("totalSupply").is(null)),
                new Update().set("totalSupply", launch.totalSupply().toString()), Token.class);
        mongoTemplate.updateFirst(Query.of(query).addCriteria(Criteria.where("graduationThreshold").is(null)),
                new Update().set("graduationThreshold", launch.graduationThreshold().toString()), Token.class);
    }

    private boolean markApplied(TradeTransaction tx) {
        Query pending = Query.query(Criteria.where("_id").is(tx.getId()).and("applied").is(false));
        return mongoTemplate.updateFirst(pending, new Update().set("applied", true), TradeTransaction.class)
                .getModifiedCount() > 0;
    }

    private void applyTradePrice(Token token, PriceSnapshot price, BigInteger marketCap, String progress,
                                 BigDecimal ethUsd, Instant now) {
        Query notNewer = tokenQuery(token.getAddress(), token.getChainId())
                .addCriteria(new Criteria().orOperator(
                        Criteria.where("priceBlockNumber").is(null),
                        Criteria.where("priceBlockNumber").lte(price.blockNumber())));
        Update update;
        if (BondingCurveMath.isValidPrice(price.tokenPrice())) {
            update = priceUpdate(price, marketCap, ethUsd, now);
        } else {
            update = new Update().set("priceBlockNumber", price.blockNumber()).set("updatedAt", now);
        }
        mongoTemplate.updateFirst(notNewer, update.set("graduationProgress", progress), Token.class);
    }

    private static Update priceUpdate(PriceSnapshot price, BigInteger marketCap, BigDecimal ethUsd, Instant now) {
        return new Update()
                .set("currentPrice", price.tokenPrice())
                .set("currentPriceUsd", BondingCurveMath.priceToUsd(price.tokenPrice(), ethUsd))
                .set("marketCap", marketCap.toString())
                .set("marketCapUsd", BondingCurveMath.weiToUsd(marketCap, ethUsd))
                .set("priceBlockNumber", price.blockNumber())
                .set("updatedAt", now);
    }

    private boolean insertHistory(Token token, String tokenPrice, BigInteger marketCap, BigDecimal ethUsd,
                                  long blockNumber, Instant at) {
        if (!BondingCurveMath.isValidPrice(tokenPrice)) {
            return false;
        }
        TokenHistory history = new TokenHistory();
        history.setTokenId(token.getId());
        history.setTokenAddress(token.getAddress());
        history.setChainId(token.getChainId());
        history.setTokenPrice(tokenPrice);
        history.setPriceUsd(BondingCurveMath.priceToUsd(tokenPrice, ethUsd));
        history.setMarketCap(marketCap.toString());
        history.setMarketCapUsd(BondingCurveMath.weiToUsd(marketCap, ethUsd));
        history.setBlockNumber(blockNumber);
        history.setTimestamp(at);
        history.setHoldersCount(holderLedger.countHolders(token.getAddress(), token.getChainId()));
        history.setTransactionsCount(tradeTransactionRepository.countByTokenAddressAndChainId(token.getAddress(), token.getChainId()));
        try {
            mongoTemplate.insert(history);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("History for {} at {} already stored", token.getAddress(), at);
            return false;
        }
    }

    private Token findToken(String tokenAddress, long chainId) {
        return mongoTemplate.findOne(tokenQuery(tokenAddress, chainId), Token.class);
    }

    private static Query tokenQuery(String tokenAddress, long chainId) {
        return Query.query(Criteria.where("address").is(tokenAddress).and("chainId").is(chainId));
    }

    private static String methodName(TradeRecord trade) {
        return switch (trade.type()) {
            case BOUGHT -> "TokenBought";
            case SOLD -> "TokenSold";
            default -> trade.type().name();
        };
    }
}
