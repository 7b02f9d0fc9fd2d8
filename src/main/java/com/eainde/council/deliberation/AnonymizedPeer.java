package com.eainde.council.deliberation;

import com.eainde.council.model.Recommendation;

import java.util.List;

/** What an agent sees of a colleague during deliberation: the opinion without the identity. */
public record AnonymizedPeer(
        String label,
        double score,
        Recommendation recommendation,
        double confidence,
        String rationale,
        List<String> strengths,
        List<String> concerns
) {}
