package com.launchradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface LiquidityEventRepository extends MongoRepository<LiquidityEvent, String> {

    Optional<LiquidityEvent> findByTxHashAndChainId(String txHash, long chainId);
}
