package com.eainde.council.team;

import com.eainde.council.model.Application;
import com.eainde.council.model.OutcomeResult;
import com.eainde.council.model.TeamMember;
import com.eainde.council.model.TeamProfile;
import com.eainde.council.store.CouncilStore;
import com.eainde.council.store.EntityKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves applicant teams to canonical profiles. Wallet addresses are the stronger identity signal and are
 * tried first; names and aliases compare case-insensitively. Profiles are created on first sight and only
 * ever extended.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TeamRegistry {

    private final CouncilStore store;
    private final Clock clock;

    public Optional<TeamProfile> lookup(Application application) {
        List<String> wallets = wallets(application);
        List<TeamProfile> teams = store.list(EntityKind.TEAM, TeamProfile.class);

        Optional<TeamProfile> byWallet = teams.stream()
                .filter(t -> wallets.stream().anyMatch(t::knowsWallet))
                .findFirst();
        if (byWallet.isPresent()) {
            return byWallet;
        }
        return teams.stream().filter(t -> t.knowsName(application.teamName())).findFirst();
    }

    /** Creates the profile or adds this application, its name and its wallets to the existing one. */
    public synchronized TeamProfile register(Application application) {
        Instant now = clock.instant();
        TeamProfile profile = lookup(application).orElseGet(() -> {
            log.info("First application from team '{}'; creating profile", application.teamName());
            return TeamProfile.builder()
                    .id(UUID.randomUUID().toString())
                    .canonicalName(application.teamName() != null ? application.teamName().trim() : "unknown team")
                    .createdAt(now)
                    .build();
        });

        TeamProfile updated = profile.withAlias(application.teamName()).withApplication(application.id());
        for (String wallet : wallets(application)) {
            updated = updated.withWallet(wallet);
        }
        updated = updated.toBuilder().updatedAt(now).build();
        store.put(EntityKind.TEAM, updated.id(), updated);
        return updated;
    }

    /** Counts a funded application's outcome against its team. */
    public synchronized TeamProfile recordOutcome(Application application, OutcomeResult result) {
        TeamProfile profile = lookup(application).orElseGet(() -> register(application));
        TeamProfile updated = profile.toBuilder()
                .successfulGrants(profile.successfulGrants() + (result == OutcomeResult.SUCCESS ? 1 : 0))
                .failedGrants(profile.failedGrants() + (result == OutcomeResult.FAILURE ? 1 : 0))
                .totalFunded(profile.totalFunded() + application.fundingRequested())
                .updatedAt(clock.instant())
                .build();
        store.put(EntityKind.TEAM, updated.id(), updated);
        log.info("Team {} outcome recorded: {} ({} successful, {} failed)",
                updated.canonicalName(), result.value(), updated.successfulGrants(), updated.failedGrants());
        return updated;
    }

    private static List<String> wallets(Application application) {
        return Stream.concat(
                        Stream.of(application.walletAddress()),
                        application.teamMembers().stream().map(TeamMember::walletAddress))
                .filter(Objects::nonNull)
                .filter(w -> !w.isBlank())
                .distinct()
                .collect(Collectors.toList());
    }
}
