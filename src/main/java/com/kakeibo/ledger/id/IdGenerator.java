package com.kakeibo.ledger.id;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Produces record ids of the form {@code <kind>_<24 hex chars>}, backed by 96 random bits.
 */
@Component
public class IdGenerator {

    public static final String ACCOUNT = "acc";
    public static final String TRANSACTION = "tx";
    public static final String FIXED_COST = "fc";

    private static final int RANDOM_BYTES = 12;

    private final SecureRandom random = new SecureRandom();
    private final HexFormat hex = HexFormat.of();

    public String newId(String kind) {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        return kind + "_" + hex.formatHex(bytes);
    }
}
