package com.eainde.council.store;

import com.eainde.council.CouncilFixtures;
import com.eainde.council.model.Application;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCouncilStoreTest {

    private final InMemoryCouncilStore store = new InMemoryCouncilStore();

    @Test
    void lastWriterWins() {
        store.put(EntityKind.APPLICATION, "app-1", CouncilFixtures.application("app-1", 10_000));
        store.put(EntityKind.APPLICATION, "app-1", CouncilFixtures.application("app-1", 20_000));

        assertThat(store.get(EntityKind.APPLICATION, "app-1", Application.class))
                .hasValueSatisfying(a -> assertThat(a.fundingRequested()).isEqualTo(20_000));
        assertThat(store.list(EntityKind.APPLICATION, Application.class)).hasSize(1);
    }

    @Test
    void kindsAreSeparateNamespaces() {
        store.put(EntityKind.APPLICATION, "app-1", CouncilFixtures.application());

        assertThat(store.get(EntityKind.DECISION, "app-1", Object.class)).isEmpty();
        assertThat(store.get(EntityKind.APPLICATION, null, Application.class)).isEmpty();
    }

    @Test
    void listAppliesFilter() {
        store.put(EntityKind.APPLICATION, "a", CouncilFixtures.application("a", 10_000));
        store.put(EntityKind.APPLICATION, "b", CouncilFixtures.application("b", 90_000));

        assertThat(store.list(EntityKind.APPLICATION, Application.class, a -> a.fundingRequested() > 50_000))
                .extracting(Application::id)
                .containsExactly("b");
    }
}
