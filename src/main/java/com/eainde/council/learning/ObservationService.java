package com.eainde.council.learning;

import com.eainde.council.config.CouncilProperties;
import com.eainde.council.model.Observation;
import com.eainde.council.model.ObservationStatus;
import com.eainde.council.store.CouncilStore;
import com.eainde.council.store.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Storage-facing side of observations: prompt retrieval, the human lifecycle actions and stale flagging.
 */
@Slf4j
@Service
public class ObservationService {

    /** Highest evidence first, then most recently used (or created), then id for a stable order. */
    static final Comparator<Observation> RANKING = Comparator
            .comparingInt((Observation o) -> o.evidence().size()).reversed()
            .thenComparing(Observation::recency, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Observation::id);

    private final CouncilStore store;
    private final Clock clock;
    private final int maxObservations;

    @Autowired
    public ObservationService(CouncilStore store, Clock clock, CouncilProperties properties) {
        this(store, clock, properties.getRetrieval().getMaxObservations());
    }

    public ObservationService(CouncilStore store, Clock clock, int maxObservations) {
        this.store = store;
        this.clock = clock;
        this.maxObservations = maxObservations;
    }

    /**
     * Active observations of {@code agentId} sharing at least one tag with {@code tags}, best first, capped at
     * the configured maximum. Each returned observation is counted as used.
     */
    public synchronized List<Observation> retrieveForPrompt(String agentId, Set<String> tags) {
        Set<String> wanted = normalize(tags);
        List<Observation> selected = store.list(EntityKind.OBSERVATION, Observation.class, o ->
                        agentId.equals(o.agentId())
                                && o.status() == ObservationStatus.ACTIVE
                                && o.tags().stream().map(t -> t.toLowerCase(Locale.ROOT)).anyMatch(wanted::contains))
                .stream()
                .sorted(RANKING)
                .limit(maxObservations)
                .collect(Collectors.toList());

        Instant now = clock.instant();
        List<Observation> used = new ArrayList<>(selected.size());
        for (Observation observation : selected) {
            Observation updated = observation.markUsed(now);
            store.put(EntityKind.OBSERVATION, updated.id(), updated);
            used.add(updated);
        }
        log.debug("Retrieved {} observations for agent {} (tags {})", used.size(), agentId, wanted);
        return used;
    }

    public Observation save(Observation observation) {
        store.put(EntityKind.OBSERVATION, observation.id(), observation);
        return observation;
    }

    public Observation get(String observationId) {
        return store.get(EntityKind.OBSERVATION, observationId, Observation.class)
                .orElseThrow(() -> new IllegalArgumentException("Unknown observation: " + observationId));
    }

    public List<Observation> list(String agentId, ObservationStatus status) {
        return store.list(EntityKind.OBSERVATION, Observation.class, o ->
                        (agentId == null || agentId.equals(o.agentId())) && (status == null || status == o.status()))
                .stream()
                .sorted(Comparator.comparing(Observation::createdAt).thenComparing(Observation::id))
                .collect(Collectors.toList());
    }

    public int countForAgent(String agentId) {
        return store.list(EntityKind.OBSERVATION, Observation.class, o -> agentId.equals(o.agentId())).size();
    }

    public Observation review(String observationId, String reviewer) {
        return transition(observationId, ObservationStatus.REVIEWED, reviewer);
    }

    /** Makes a draft or reviewed observation visible to retrieval. */
    public Observation activate(String observationId, String reviewer) {
        return transition(observationId, ObservationStatus.ACTIVE, reviewer);
    }

    public Observation deprecate(String observationId, String reviewer, String reason) {
        Observation deprecated = transition(observationId, ObservationStatus.DEPRECATED, reviewer);
        log.info("Observation {} deprecated by {}: {}", observationId, reviewer, reason);
        return deprecated;
    }

    public synchronized Observation markHelpful(String observationId) {
        Observation observation = get(observationId);
        Observation updated = observation.toBuilder().timesHelpful(observation.timesHelpful() + 1).build();
        return save(updated);
    }

    /**
     * Flags active observations used fewer than {@code minEvidence} times and older than {@code maxAgeDays}.
     * Nothing is deleted or deprecated.
     *
     * @return the observations flagged in this pass
     */
    public synchronized List<Observation> flagStale(int minEvidence, int maxAgeDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        List<Observation> flagged = new ArrayList<>();
        for (Observation observation : store.list(EntityKind.OBSERVATION, Observation.class,
                o -> o.status() == ObservationStatus.ACTIVE)) {
            boolean stale = observation.timesUsed() < minEvidence && observation.createdAt().isBefore(cutoff);
            if (stale && !observation.flaggedStale()) {
                Observation updated = observation.toBuilder().flaggedStale(true).build();
                save(updated);
                flagged.add(updated);
            }
        }
        log.info("Pruning flagged {} stale observations (minEvidence={}, maxAgeDays={})",
                flagged.size(), minEvidence, maxAgeDays);
        return flagged;
    }

    private synchronized Observation transition(String observationId, ObservationStatus target, String reviewer) {
        Observation updated = get(observationId).withStatus(target, reviewer, clock.instant());
        log.info("Observation {} moved to {} by {}", observationId, target.value(), reviewer);
        return save(updated);
    }

    private static Set<String> normalize(Collection<String> tags) {
        return tags.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }
}
