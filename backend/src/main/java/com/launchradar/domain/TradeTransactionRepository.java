package com.launchradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface TradeTransactionRepository extends MongoRepository<TradeTransaction, String> {

    Optional<TradeTransaction> findByTxHashAndChainId(String txHash, long chainId);

    long countByTokenAddressAndChainId(String tokenAddress, long chainId);
}
