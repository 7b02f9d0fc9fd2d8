package com.eainde.council.workflow;

import com.eainde.council.model.Application;
import com.eainde.council.model.ApplicationStatus;
import com.eainde.council.store.CouncilStore;
import com.eainde.council.store.EntityKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Moves applications through their status table and persists every move. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationLifecycle {

    private final CouncilStore store;

    /**
     * @throws IllegalStateException when the status table forbids the move
     */
    public Application transition(Application application, ApplicationStatus target) {
        Application moved = application.withStatus(target);
        store.put(EntityKind.APPLICATION, moved.id(), moved);
        log.info("Application {} moved {} -> {}", application.id(), application.status().value(), target.value());
        return moved;
    }
}
