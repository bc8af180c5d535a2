package com.launchradar.ingestion.event;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.List;

/**
 * ABI of the four bonding-curve events and their topic0 hashes.
 */
public final class CurveEvents {

    public static final Event TOKEN_CREATED = new Event("TokenCreated", Arrays.<TypeReference<?>>asList(
            new TypeReference<Address>(true) { },
            new TypeReference<Address>(true) { },
            new TypeReference<Utf8String>() { },
            new TypeReference<Utf8String>() { },
            new TypeReference<Utf8String>() { },
            new TypeReference<Utf8String>() { },
            new TypeReference<Uint256>() { },
            new TypeReference<Uint256>() { },
            new TypeReference<Uint256>() { },
            new TypeReference<Uint256>() { }));

    public static final Event TOKEN_BOUGHT = new Event("TokenBought", tradeParameters());

    public static final Event TOKEN_SOLD = new Event("TokenSold", tradeParameters());

    public static final Event TOKEN_GRADUATED = new Event("TokenGraduated", Arrays.<TypeReference<?>>asList(
            new TypeReference<Address>(true) { },
            new TypeReference<Uint256>() { }));

    public static final String TOKEN_CREATED_TOPIC = EventEncoder.encode(TOKEN_CREATED);
    public static final String TOKEN_BOUGHT_TOPIC = EventEncoder.encode(TOKEN_BOUGHT);
    public static final String TOKEN_SOLD_TOPIC = EventEncoder.encode(TOKEN_SOLD);
    public static final String TOKEN_GRADUATED_TOPIC = EventEncoder.encode(TOKEN_GRADUATED);

    /** All subscribed topics, in subscription order. */
    public static final List<String> ALL_TOPICS = List.of(
            TOKEN_CREATED_TOPIC, TOKEN_BOUGHT_TOPIC, TOKEN_SOLD_TOPIC, TOKEN_GRADUATED_TOPIC);

    private CurveEvents() {
    }

    private static List<TypeReference<?>> tradeParameters() {
        return Arrays.<TypeReference<?>>asList(
                new TypeReference<Address>(true) { },
                new TypeReference<Address>(true) { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { });
    }

    /**
     * 32-byte topic form of an address, as used for indexed address arguments.
     */
    public static String addressTopic(String address) {
        String hex = address.toLowerCase().startsWith("0x") ? address.substring(2) : address;
        return "0x" + "0".repeat(Math.max(0, 64 - hex.length())) + hex.toLowerCase();
    }
}
