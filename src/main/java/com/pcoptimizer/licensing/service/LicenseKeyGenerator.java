package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Produces keys of the form {@code PREFIX-yyMMdd-XXXX-XXXX-XXXX-XXXX}: a literal prefix, the UTC issue
 * date and a fixed number of 4-symbol groups over {@code [A-Z0-9]}.
 */
@Component
public class LicenseKeyGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int GROUP_LENGTH = 4;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyMMdd").withZone(ZoneOffset.UTC);

    private final String prefix;
    private final int groups;
    private final SecureRandom random;
    private final Clock clock;

    @Autowired
    public LicenseKeyGenerator(AppProperties props, Clock clock) {
        this(props.keys().prefix(), props.keys().groups(), new SecureRandom(), clock);
    }

    LicenseKeyGenerator(String prefix, int groups, SecureRandom random, Clock clock) {
        if (prefix == null || !prefix.matches("[A-Z0-9]+")) {
            throw new IllegalArgumentException("Key prefix must be non-empty and use only A-Z and 0-9: " + prefix);
        }
        if (groups < 1) {
            throw new IllegalArgumentException("groups must be >= 1");
        }
        this.prefix = prefix;
        this.groups = groups;
        this.random = random;
        this.clock = clock;
    }

    public String generate() {
        StringBuilder sb = new StringBuilder(keyLength());
        sb.append(prefix).append('-').append(DATE.format(clock.instant()));
        for (int g = 0; g < groups; g++) {
            sb.append('-');
            for (int i = 0; i < GROUP_LENGTH; i++) {
                // nextInt(bound) is uniform, unlike a byte modulo 36
                sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
        }
        return sb.toString();
    }

    public int keyLength() {
        return prefix.length() + 1 + 6 + groups * (GROUP_LENGTH + 1);
    }
}
