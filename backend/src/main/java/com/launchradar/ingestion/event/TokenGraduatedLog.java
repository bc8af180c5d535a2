package com.launchradar.ingestion.event;

import java.math.BigInteger;

/**
 * {@code TokenGraduated(address indexed token, uint256 graduationPrice)}.
 */
public record TokenGraduatedLog(String tokenAddress, BigInteger graduationPrice) implements CurveEvent {

    @Override
    public String topic() {
        return CurveEvents.TOKEN_GRADUATED_TOPIC;
    }
}
