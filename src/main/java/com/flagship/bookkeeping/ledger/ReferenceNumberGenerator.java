package com.flagship.bookkeeping.ledger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Batch references: prefix, UTC timestamp to the millisecond, six random
 * alphanumerics. Example: {@code REF20250115093012345-K7Q2ZD}.
 */
@Component
public class ReferenceNumberGenerator {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 6;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final String prefix;

    public ReferenceNumberGenerator(Clock clock, @Value("${bookkeeping.reference.prefix:REF}") String prefix) {
        this.clock = clock;
        this.prefix = prefix;
    }

    public String next() {
        StringBuilder sb = new StringBuilder(prefix)
            .append(TIMESTAMP.format(clock.instant()))
            .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
