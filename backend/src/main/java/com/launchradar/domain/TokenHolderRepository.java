package com.launchradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TokenHolderRepository extends MongoRepository<TokenHolder, String> {

    List<TokenHolder> findByTokenAddressAndChainId(String tokenAddress, long chainId);

    Optional<TokenHolder> findByTokenAddressAndHolderAddressAndChainId(String tokenAddress, String holderAddress, long chainId);

    /** Holders with a balance; zero rows are kept but not counted. */
    long countByTokenAddressAndChainIdAndBalanceNot(String tokenAddress, long chainId, String balance);
}
