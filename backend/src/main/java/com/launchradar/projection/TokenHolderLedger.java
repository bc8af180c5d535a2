package com.launchradar.projection;

import com.launchradar.domain.HolderSnapshot;
import com.launchradar.domain.Token;
import com.launchradar.domain.TokenHolder;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Holder balances per token. Balances are strings, so each change is a compare-and-set on the row's revision;
 * new rows rely on the (tokenAddress, holderAddress, chainId) unique index. Trades and the launch seed may arrive
 * in any order and converge to the same balances.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenHolderLedger {

    static final int MAX_CAS_ATTEMPTS = 8;
    static final int RECENT_TRANSACTIONS = 64;

    private final MongoTemplate mongoTemplate;

    /**
     * Gives the holder its initial balance, once. Deltas applied before the seed are kept on top of it.
     *
     * @return true when this call seeded the row
     */
    public boolean seedIfAbsent(Token token, String holderAddress, BigInteger balance, String txHash, Instant at) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            TokenHolder current = findHolder(token, holderAddress);
            if (current == null) {
                try {
                    mongoTemplate.insert(newHolder(token, holderAddress, balance, BigInteger.ZERO, true, txHash, at));
                    return true;
                } catch (DuplicateKeyException e) {
                    continue;
                }
            }
            if (current.isSeeded()) {
                log.debug("Holder {} of {} already seeded", holderAddress, token.getAddress());
                return false;
            }
            BigInteger next = balance.add(BondingCurveMath.parse(current.getNetDelta())).max(BigInteger.ZERO);
            Update update = new Update()
                    .set("balance", next.toString())
                    .set("seeded", true)
                    .set("firstTransactionHash", txHash)
                    .set("recentTransactionHashes", withRecent(current.getRecentTransactionHashes(), txHash))
                    .inc("transactionCount", 1)
                    .set("updatedAt", at);
            if (compareAndSet(current, update)) {
                log.debug("Seeded {} of {} over {} earlier trades", holderAddress, token.getAddress(), current.getTransactionCount());
                return true;
            }
        }
        throw conflict(token, holderAddress);
    }

    /**
     * Adds {@code delta} to the holder balance, clamping at zero, and records the transaction on the row. A
     * transaction already applied to the row is skipped.
     */
    public void applyDelta(Token token, String holderAddress, BigInteger delta, String txHash, Instant at) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            TokenHolder current = findHolder(token, holderAddress);
            if (current == null) {
                try {
                    mongoTemplate.insert(newHolder(token, holderAddress, BigInteger.ZERO, delta, false, txHash, at));
                    return;
                } catch (DuplicateKeyException e) {
                    continue;
                }
            }
            List<String> recent = current.getRecentTransactionHashes();
            if (recent != null && recent.contains(txHash)) {
                log.debug("{} already applied to holder {} of {}", txHash, holderAddress, token.getAddress());
                return;
            }
            BigInteger next = BondingCurveMath.parse(current.getBalance()).add(delta).max(BigInteger.ZERO);
            BigInteger netDelta = BondingCurveMath.parse(current.getNetDelta()).add(delta);
            Update update = new Update()
                    .set("balance", next.toString())
                    .set("netDelta", netDelta.toString())
                    .set("lastTransactionHash", txHash)
                    .set("recentTransactionHashes", withRecent(recent, txHash))
                    .inc("transactionCount", 1)
                    .set("updatedAt", at);
            if (compareAndSet(current, update)) {
                return;
            }
        }
        throw conflict(token, holderAddress);
    }

    /**
     * Recomputes every holder's share of {@code totalSupply} from current balances and bulk-writes the results.
     * A balance changing meanwhile is fine; the next recalculation corrects the percentage.
     */
    public void recalculatePercentages(String tokenAddress, BigInteger totalSupply, long chainId) {
        List<TokenHolder> holders = mongoTemplate.find(tokenQuery(tokenAddress, chainId), TokenHolder.class);
        if (holders.isEmpty()) {
            return;
        }
        BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, TokenHolder.class);
        for (TokenHolder holder : holders) {
            double pct = HolderPercentageCalculator.percentage(BondingCurveMath.parse(holder.getBalance()), totalSupply);
            bulk.updateOne(Query.query(Criteria.where("_id").is(holder.getId())), new Update().set("percentage", pct));
        }
        bulk.execute();
        log.debug("Recalculated {} holder percentages for {} on chain {}", holders.size(), tokenAddress, chainId);
    }

    /**
     * Holders with a balance, largest first, valued at {@code priceUsd} per whole token.
     */
    public List<HolderSnapshot> snapshot(String tokenAddress, long chainId, BigDecimal priceUsd) {
        return mongoTemplate.find(tokenQuery(tokenAddress, chainId), TokenHolder.class).stream()
                .filter(h -> BondingCurveMath.parse(h.getBalance()).signum() > 0)
                .sorted(Comparator.comparing((TokenHolder h) -> BondingCurveMath.parse(h.getBalance())).reversed())
                .map(h -> new HolderSnapshot(
                        h.getHolderAddress(),
                        h.getBalance(),
                        BondingCurveMath.weiToUsd(BondingCurveMath.parse(h.getBalance()), priceUsd),
                        h.getPercentage()))
                .toList();
    }

    public long countHolders(String tokenAddress, long chainId) {
        return mongoTemplate.count(tokenQuery(tokenAddress, chainId)
                .addCriteria(Criteria.where("balance").ne("0")), TokenHolder.class);
    }

    private TokenHolder findHolder(Token token, String holderAddress) {
        return mongoTemplate.findOne(holderQuery(token.getAddress(), holderAddress, token.getChainId()), TokenHolder.class);
    }

    private boolean compareAndSet(TokenHolder current, Update update) {
        Query expected = Query.query(Criteria.where("_id").is(current.getId()).and("revision").is(current.getRevision()));
        UpdateResult result = mongoTemplate.updateFirst(expected, update.inc("revision", 1), TokenHolder.class);
        return result.getMatchedCount() > 0;
    }

    private static HolderUpdateConflictException conflict(Token token, String holderAddress) {
        return new HolderUpdateConflictException("Balance of " + holderAddress + " for " + token.getAddress()
                + " changed concurrently " + MAX_CAS_ATTEMPTS + " times");
    }

    static List<String> withRecent(List<String> recent, String txHash) {
        List<String> next = new ArrayList<>(recent == null ? List.of() : recent);
        next.add(txHash);
        return next.size() > RECENT_TRANSACTIONS
                ? new ArrayList<>(next.subList(next.size() - RECENT_TRANSACTIONS, next.size()))
                : next;
    }

    private static TokenHolder newHolder(Token token, String holderAddress, BigInteger seed, BigInteger delta,
                                         boolean seeded, String txHash, Instant at) {
        TokenHolder holder = new TokenHolder();
        holder.setTokenId(token.getId());
        holder.setTokenAddress(token.getAddress());
        holder.setHolderAddress(holderAddress);
        holder.setChainId(token.getChainId());
        holder.setBalance(seed.add(delta).max(BigInteger.ZERO).toString());
        holder.setNetDelta(delta.toString());
        holder.setSeeded(seeded);
        holder.setRevision(0);
        holder.setRecentTransactionHashes(new ArrayList<>(List.of(txHash)));
        holder.setFirstTransactionHash(txHash);
        holder.setLastTransactionHash(txHash);
        holder.setTransactionCount(1);
        holder.setCreatedAt(at);
        holder.setUpdatedAt(at);
        return holder;
    }

    private static Query tokenQuery(String tokenAddress, long chainId) {
        return Query.query(Criteria.where("tokenAddress").is(tokenAddress).and("chainId").is(chainId));
    }

    private static Query holderQuery(String tokenAddress, String holderAddress, long chainId) {
        return Query.query(Criteria.where("tokenAddress").is(tokenAddress)
                .and("holderAddress").is(holderAddress)
                .and("chainId").is(chainId));
    }
}
