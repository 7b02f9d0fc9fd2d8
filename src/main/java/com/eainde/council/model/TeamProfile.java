package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical identity of an applicant team. Profiles are only ever extended: aliases, wallets and
 * application ids are appended, counters only grow.
 */
@Builder(toBuilder = true)
public record TeamProfile(
        @JsonProperty("id")                String id,
        @JsonProperty("canonical_name")    String canonicalName,
        @JsonProperty("aliases")           List<String> aliases,
        @JsonProperty("wallet_addresses")  List<String> walletAddresses,
        @JsonProperty("application_ids")   List<String> applicationIds,
        @JsonProperty("successful_grants") int successfulGrants,
        @JsonProperty("failed_grants")     int failedGrants,
        @JsonProperty("total_funded")      double totalFunded,
        @JsonProperty("created_at")        Instant createdAt,
        @JsonProperty("updated_at")        Instant updatedAt
) implements Serializable {

    public TeamProfile {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        walletAddresses = walletAddresses == null ? List.of() : List.copyOf(walletAddresses);
        applicationIds = applicationIds == null ? List.of() : List.copyOf(applicationIds);
    }

    public boolean knowsName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String needle = name.trim();
        return needle.equalsIgnoreCase(canonicalName)
                || aliases.stream().anyMatch(needle::equalsIgnoreCase);
    }

    public boolean knowsWallet(String wallet) {
        return wallet != null && walletAddresses.stream().anyMatch(wallet.trim()::equalsIgnoreCase);
    }

    static List<String> appendDistinct(List<String> existing, String value) {
        if (value == null || value.isBlank()) {
            return existing;
        }
        String trimmed = value.trim();
        if (existing.stream().anyMatch(trimmed::equalsIgnoreCase)) {
            return existing;
        }
        List<String> copy = new ArrayList<>(existing);
        copy.add(trimmed);
        return copy;
    }

    public TeamProfile withAlias(String alias) {
        if (alias == null || alias.trim().equalsIgnoreCase(canonicalName)) {
            return this;
        }
        return toBuilder().aliases(appendDistinct(aliases, alias)).build();
    }

    public TeamProfile withWallet(String wallet) {
        return toBuilder().walletAddresses(appendDistinct(walletAddresses, wallet)).build();
    }

    public TeamProfile withApplication(String applicationId) {
        if (applicationIds.contains(applicationId)) {
            return this;
        }
        List<String> ids = new ArrayList<>(applicationIds);
        ids.add(applicationId);
        return toBuilder().applicationIds(ids).build();
    }
}
