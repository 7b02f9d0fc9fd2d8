package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record TeamMember(
        @JsonProperty("name")           String name,
        @JsonProperty("role")           String role,
        @JsonProperty("wallet_address") String walletAddress
) implements Serializable {}
