package com.eainde.council.agent;

import com.eainde.council.config.CouncilProperties;
import com.eainde.council.model.Application;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Derives domain tags (e.g. {@code defi}, {@code infrastructure}) from an application's text.
 * Keywords match as whole words, so "api" does not fire on "capital".
 */
@Component
public class DomainTagger {

    private final Map<String, List<Pattern>> rules = new LinkedHashMap<>();

    @Autowired
    public DomainTagger(CouncilProperties properties) {
        this(properties.getDomainTags());
    }

    public DomainTagger(Map<String, List<String>> keywordsByTag) {
        keywordsByTag.forEach((tag, keywords) -> rules.put(
                tag.toLowerCase(Locale.ROOT),
                keywords.stream()
                        .map(k -> Pattern.compile("\\b" + Pattern.quote(k.toLowerCase(Locale.ROOT)) + "\\b"))
                        .collect(Collectors.toList())));
    }

    public Set<String> domainTags(Application application) {
        String text = Stream.of(application.title(), application.summary(), application.description(),
                        application.problemStatement(), application.proposedSolution(), application.technicalApproach())
                .filter(s -> s != null && !s.isBlank())
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);

        Set<String> tags = new LinkedHashSet<>();
        rules.forEach((tag, patterns) -> {
            if (patterns.stream().anyMatch(p -> p.matcher(text).find())) {
                tags.add(tag);
            }
        });
        return Collections.unmodifiableSet(tags);
    }

    /** The tag set observation retrieval matches against: the agent's own tags plus the domain tags. */
    public Set<String> retrievalTags(AgentDescriptor agent, Application application) {
        Set<String> tags = new LinkedHashSet<>(agent.getTags());
        tags.addAll(domainTags(application));
        return Collections.unmodifiableSet(tags);
    }
}
