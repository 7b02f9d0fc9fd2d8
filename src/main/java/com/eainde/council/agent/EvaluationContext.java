package com.eainde.council.agent;

import com.eainde.council.model.Application;
import com.eainde.council.model.TeamProfile;

import java.util.List;

/**
 * Optional background handed to every agent alongside the application.
 *
 * @param team                   known history of the applicant team, or null for a first-time team
 * @param comparableApplications past applications judged similar; empty until similarity search exists
 */
public record EvaluationContext(TeamProfile team, List<Application> comparableApplications) {

    public EvaluationContext {
        comparableApplications = comparableApplications == null ? List.of() : List.copyOf(comparableApplications);
    }

    public static EvaluationContext empty() {
        return new EvaluationContext(null, List.of());
    }

    public static EvaluationContext forTeam(TeamProfile team) {
        return new EvaluationContext(team, List.of());
    }
}
