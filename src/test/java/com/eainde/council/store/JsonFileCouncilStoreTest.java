package com.eainde.council.store;

import com.eainde.council.CouncilFixtures;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import com.eainde.council.model.CouncilDecision;
import com.eainde.council.model.Recommendation;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileCouncilStoreTest {

    @TempDir
    Path root;

    private JsonFileCouncilStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileCouncilStore(root, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    @DisplayName("records survive a new store instance over the same directory")
    void persistsAcrossInstances() {
        Application application = CouncilFixtures.application();
        store.put(EntityKind.APPLICATION, application.id(), application);

        JsonFileCouncilStore reopened = new JsonFileCouncilStore(root, new ObjectMapper().findAndRegisterModules());

        assertThat(reopened.get(EntityKind.APPLICATION, "app-1", Application.class)).contains(application);
        assertThat(Files.exists(root.resolve("applications").resolve("app-1.json"))).isTrue();
    }

    @Test
    @DisplayName("nested records and enums are written in their wire form")
    void wireForm() throws Exception {
        AgentEvaluation evaluation = CouncilFixtures.evaluation("budget", 0.4, Recommendation.NEEDS_REVIEW, 0.7);
        CouncilDecision decision = CouncilDecision.builder()
                .id("d-1").applicationId("app-1")
                .evaluations(List.of(evaluation)).history(List.of(evaluation))
                .recommendation(Recommendation.NEEDS_REVIEW)
                .reviewReasons(List.of("average confidence 0.70 below threshold 0.80"))
                .createdAt(CouncilFixtures.NOW)
                .build();

        store.put(EntityKind.DECISION, "app-1", decision);

        String json = Files.readString(root.resolve("decisions").resolve("app-1.json"));
        assertThat(json).contains("\"recommendation\" : \"needs_review\"").contains("\"application_id\" : \"app-1\"");
        assertThat(store.get(EntityKind.DECISION, "app-1", CouncilDecision.class)).contains(decision);
    }

    @Test
    void listReadsEveryRecordOfAKind() {
        store.put(EntityKind.APPLICATION, "b", CouncilFixtures.application("b", 90_000));
        store.put(EntityKind.APPLICATION, "a", CouncilFixtures.application("a", 10_000));

        assertThat(store.list(EntityKind.APPLICATION, Application.class))
                .extracting(Application::id)
                .containsExactly("a", "b");
        assertThat(store.list(EntityKind.TEAM, Application.class)).isEmpty();
    }

    @Test
    @DisplayName("ids that could escape the store directory are refused")
    void unsafeIds() {
        assertThatThrownBy(() -> store.put(EntityKind.APPLICATION, "../escape", CouncilFixtures.application()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsafe record id");
        assertThat(store.get(EntityKind.APPLICATION, "../escape", Application.class)).isEmpty();
        assertThat(store.get(EntityKind.APPLICATION, "missing", Application.class)).isEmpty();
    }

    @Test
    @DisplayName("a failed write leaves no temporary file and keeps the previous record")
    void failedWriteCleansUp() throws Exception {
        Application application = CouncilFixtures.application();
        store.put(EntityKind.APPLICATION, "app-1", application);

        assertThatThrownBy(() -> store.put(EntityKind.APPLICATION, "app-1", new Object()))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("applications/app-1");

        try (Stream<Path> files = Files.list(root.resolve("applications"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("app-1.json");
        }
        assertThat(store.get(EntityKind.APPLICATION, "app-1", Application.class)).contains(application);
    }
}
