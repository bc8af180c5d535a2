package com.launchradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TokenHistoryRepository extends MongoRepository<TokenHistory, String> {

    List<TokenHistory> findByTokenAddressAndChainIdOrderByTimestampAsc(String tokenAddress, long chainId);
}
