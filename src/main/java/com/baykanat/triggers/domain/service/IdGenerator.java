package com.baykanat.triggers.domain.service;

import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;

/** Prefix'li, zaman sıralı ULID id'ler (evt_, dlv_). İlk 48 bit milisaniye zaman damgası. */
@Component
public class IdGenerator {

    private static final char[] CROCKFORD = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;

    public IdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String newEventId() {
        return "evt_" + newUlid();
    }

    public String newTaskId() {
        return "dlv_" + newUlid();
    }

    /** Claim turu başına lease token. */
    public String newLeaseToken() {
        return newUlid();
    }

    String newUlid() {
        long time = clock.millis();
        byte[] randomness = new byte[10];
        RANDOM.nextBytes(randomness);

        byte[] data = new byte[16];
        data[0] = (byte) (time >>> 40);
        data[1] = (byte) (time >>> 32);
        data[2] = (byte) (time >>> 24);
        data[3] = (byte) (time >>> 16);
        data[4] = (byte) (time >>> 8);
        data[5] = (byte) (time);
        System.arraycopy(randomness, 0, data, 6, 10);

        return encodeBase32(data);
    }

    private String encodeBase32(byte[] data) {
        BigInteger value = new BigInteger(1, data);
        BigInteger base = BigInteger.valueOf(32);
        char[] out = new char[26];
        for (int i = 25; i >= 0; i--) {
            BigInteger[] divRem = value.divideAndRemainder(base);
            out[i] = CROCKFORD[divRem[1].intValue()];
            value = divRem[0];
        }
        return new String(out);
    }
}
