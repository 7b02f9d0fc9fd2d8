package com.eainde.council.decision;

import com.eainde.council.config.CouncilProperties;
import com.eainde.council.model.Application;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Forces human review when an application mentions a configured sensitive category
 * ({@code council.routing.sensitive-keywords}), however confident the council is.
 */
@Component
public class SensitiveCategoryVeto implements RoutingVeto {

    private final List<String> keywords;

    @Autowired
    public SensitiveCategoryVeto(CouncilProperties properties) {
        this(properties.getRouting().getSensitiveKeywords());
    }

    public SensitiveCategoryVeto(List<String> keywords) {
        this.keywords = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<String> veto(Application application, AggregateStats stats, RoutingResult result) {
        if (keywords.isEmpty()) {
            return Optional.empty();
        }
        String text = Stream.of(application.title(), application.summary(), application.description(),
                        application.problemStatement(), application.proposedSolution(), application.technicalApproach())
                .filter(s -> s != null && !s.isBlank())
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);

        return keywords.stream()
                .filter(k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b").matcher(text).find())
                .findFirst()
                .map(k -> "application touches sensitive category '" + k + "'");
    }
}
