package com.homepurse.analysis.config;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "homepurse")
public record HomepurseProperties(
        Ai ai,
        Analysis analysis,
        Security security
) {

    @ConstructorBinding
    public HomepurseProperties {
        if (ai == null) {
            throw new IllegalArgumentException("ai configuration must be provided");
        }
        // analysis and security fall back to defaults via accessor methods
    }

    public Analysis analysis() {
        return analysis != null ? analysis : Analysis.defaults();
    }

    public Security security() {
        return security != null ? security : new Security(null, null);
    }

    public record Ai(String provider, String model, String endpoint, String apiKey, String snapshot) {
        public Ai {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model must be provided");
            }
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalArgumentException("endpoint must be provided");
            }
            // apiKey may be blank; the generator then reports a generation failure per attempt
        }

        public String providerOrDefault() {
            return (provider != null && !provider.isBlank()) ? provider.toLowerCase(Locale.ROOT) : "openai";
        }

        public String snapshotOrDefault() {
            return (snapshot != null && !snapshot.isBlank()) ? snapshot : model;
        }
    }

    public record Analysis(
            Integer maxAttempts,
            Duration statementTimeout,
            Duration modelTimeout,
            List<String> allowedTables,
            Integer resultLimit,
            Integer hintLimit,
            Integer ioThreads
    ) {
        public static final int ATTEMPT_CEILING = 3;

        public Analysis {
            if (maxAttempts == null) {
                maxAttempts = ATTEMPT_CEILING;
            }
            if (maxAttempts < 1 || maxAttempts > ATTEMPT_CEILING) {
                throw new IllegalArgumentException("maxAttempts must be between 1 and " + ATTEMPT_CEILING);
            }
            if (statementTimeout == null) {
                statementTimeout = Duration.ofSeconds(5);
            }
            if (modelTimeout == null) {
                modelTimeout = Duration.ofSeconds(30);
            }
            if (statementTimeout.isNegative() || statementTimeout.isZero()) {
                throw new IllegalArgumentException("statementTimeout must be positive");
            }
            if (modelTimeout.isNegative() || modelTimeout.isZero()) {
                throw new IllegalArgumentException("modelTimeout must be positive");
            }
            if (allowedTables == null || allowedTables.isEmpty()) {
                allowedTables = List.of("household_expenses", "household_categories");
            }
            allowedTables = allowedTables.stream()
                    .map(name -> name.trim().toLowerCase(Locale.ROOT))
                    .filter(name -> !name.isEmpty())
                    .distinct()
                    .toList();
            if (resultLimit == null) {
                resultLimit = 200;
            }
            if (resultLimit <= 0) {
                throw new IllegalArgumentException("resultLimit must be positive");
            }
            if (hintLimit == null) {
                hintLimit = 30;
            }
            if (hintLimit < 0) {
                throw new IllegalArgumentException("hintLimit must not be negative");
            }
            if (ioThreads == null) {
                ioThreads = 8;
            }
            if (ioThreads <= 0) {
                throw new IllegalArgumentException("ioThreads must be positive");
            }
        }

        public static Analysis defaults() {
            return new Analysis(null, null, null, null, null, null, null);
        }
    }

    public record Security(String issuer, String devJwtSecret) {
        public boolean hasIssuer() {
            return issuer != null && !issuer.isBlank();
        }

        public boolean hasDevJwtSecret() {
            return devJwtSecret != null && !devJwtSecret.isBlank();
        }
    }
}
