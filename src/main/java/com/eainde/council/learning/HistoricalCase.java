package com.eainde.council.learning;

import com.eainde.council.model.Application;
import com.eainde.council.model.OutcomeResult;

/** A past application with a known outcome, used to cold-start observations. */
public record HistoricalCase(Application application, OutcomeResult result, String notes) {}
