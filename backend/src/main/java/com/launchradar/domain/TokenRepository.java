package com.launchradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface TokenRepository extends MongoRepository<Token, String> {

    Optional<Token> findByAddressAndChainId(String address, long chainId);
}
