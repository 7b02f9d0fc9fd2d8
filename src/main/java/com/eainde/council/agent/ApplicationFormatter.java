package com.eainde.council.agent;

import com.eainde.council.model.Application;
import com.eainde.council.model.Milestone;
import com.eainde.council.model.TeamMember;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders an {@link Application} as the markdown block every prompt embeds.
 */
@Component
public class ApplicationFormatter {

    private static final double PERCENTAGE_TOLERANCE = 0.5;

    public static String usd(double amount) {
        return String.format(Locale.US, "$%,.0f", amount);
    }

    /** Formats an amount in its own currency; only USD amounts get a dollar sign. */
    public static String amount(double amount, String currency) {
        if (currency == null || currency.isBlank() || "USD".equalsIgnoreCase(currency.trim())) {
            return usd(amount);
        }
        return String.format(Locale.US, "%,.0f %s", amount, currency.trim().toUpperCase(Locale.ROOT));
    }

    public String format(Application application) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(orDash(application.title())).append('\n');
        sb.append("**Team:** ").append(orDash(application.teamName()));
        if (application.walletAddress() != null && !application.walletAddress().isBlank()) {
            sb.append(" (wallet ").append(application.walletAddress()).append(')');
        }
        sb.append('\n');
        sb.append("**Funding requested:** ").append(amount(application.fundingRequested(), application.currency()))
                .append("\n\n");

        section(sb, "Summary", application.summary());
        section(sb, "Description", application.description());
        section(sb, "Problem", application.problemStatement());
        section(sb, "Proposed Solution", application.proposedSolution());
        section(sb, "Technical Approach", application.technicalApproach());

        if (!application.teamMembers().isEmpty()) {
            sb.append("### Team Members\n");
            for (TeamMember member : application.teamMembers()) {
                sb.append("- ").append(orDash(member.name()));
                if (member.role() != null && !member.role().isBlank()) {
                    sb.append(", ").append(member.role());
                }
                sb.append('\n');
            }
            sb.append('\n');
        }

        if (!application.milestones().isEmpty()) {
            sb.append("### Milestones\n");
            int index = 1;
            for (Milestone milestone : application.milestones()) {
                sb.append(index++).append(". ").append(orDash(milestone.title()))
                        .append(String.format(Locale.US, " (%.0f%% of funding)", milestone.fundingPercentage()));
                if (milestone.description() != null && !milestone.description().isBlank()) {
                    sb.append(": ").append(milestone.description());
                }
                sb.append('\n');
            }
        }
        return sb.toString().trim();
    }

    /**
     * Data-quality findings that do not block evaluation but are worth a budget reviewer's attention.
     * Milestone percentages are reported as given, never corrected.
     */
    public List<String> inputQualitySignals(Application application) {
        List<String> signals = new ArrayList<>();
        if (application.milestones().isEmpty()) {
            signals.add("No milestones were provided, so funding is not tied to deliverables.");
        } else {
            double total = application.milestonePercentageTotal();
            if (Math.abs(total - 100.0) > PERCENTAGE_TOLERANCE) {
                signals.add(String.format(Locale.US,
                        "Milestone funding percentages sum to %.0f%% rather than 100%%.", total));
            }
        }
        if (application.fundingRequested() <= 0) {
            signals.add("The funding amount is missing or not positive.");
        }
        return signals;
    }

    private static void section(StringBuilder sb, String heading, String body) {
        if (body != null && !body.isBlank()) {
            sb.append("### ").append(heading).append('\n').append(body.trim()).append("\n\n");
        }
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
