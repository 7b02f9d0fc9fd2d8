package com.eainde.council.agent;

import com.eainde.council.CouncilFixtures;
import com.eainde.council.model.Application;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DomainTaggerTest {

    private final DomainTagger tagger = new DomainTagger(Map.of(
            "infrastructure", List.of("indexer", "sdk"),
            "defi", List.of("lending", "amm"),
            "security", List.of("formal verification")));

    @Test
    void matchesKeywordsAcrossApplicationText() {
        assertThat(tagger.domainTags(CouncilFixtures.application())).containsExactly("infrastructure");
    }

    @Test
    void matchesWholeWordsOnly() {
        Application application = CouncilFixtures.application().toBuilder()
                .title("Hammer")
                .summary("Camm tooling")
                .description(null)
                .technicalApproach("plain")
                .proposedSolution("none")
                .build();

        assertThat(tagger.domainTags(application)).isEmpty();
    }

    @Test
    void matchesMultiWordKeywordsCaseInsensitively() {
        Application application = CouncilFixtures.application().toBuilder()
                .technicalApproach("We apply Formal Verification to the vault contracts.")
                .build();

        assertThat(tagger.domainTags(application)).contains("security");
    }

    @Test
    void retrievalTagsAreAgentTagsPlusDomainTags() {
        AgentDescriptor budget = CouncilFixtures.agent("budget", "budget", "milestones");

        assertThat(tagger.retrievalTags(budget, CouncilFixtures.application()))
                .containsExactly("budget", "milestones", "infrastructure");
    }
}
