package com.segcalc.validation.report;

import com.segcalc.common.model.Winner;
import com.segcalc.validation.model.CategoryTally;
import com.segcalc.validation.model.ValidationCategory;
import com.segcalc.validation.model.ValidationOutcome;
import com.segcalc.validation.model.ValidationSummary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link ValidationSummary} as Markdown. Returns a string only;
 * writing it anywhere is the caller's business.
 */
@Component
public class ValidationReportFormatter {

    public String format(ValidationSummary summary) {
        StringBuilder md = new StringBuilder();
        md.append("# Validation summary\n\n");
        md.append("Run: `").append(summary.runId()).append("`\n\n");
        md.append(String.format(Locale.ROOT, "**%d / %d passed (%.1f%%)**%n%n",
            summary.passed(), summary.total(), summary.passRate() * 100.0));

        md.append("| Category | Passed | Total |\n");
        md.append("|---|---:|---:|\n");
        for (Map.Entry<ValidationCategory, CategoryTally> entry : summary.categories().entrySet()) {
            CategoryTally tally = entry.getValue();
            md.append("| ").append(entry.getKey().title())
              .append(" | ").append(tally.passed())
              .append(" | ").append(tally.total()).append(" |\n");
        }

        if (!summary.goldenWinners().isEmpty()) {
            Map<Winner, Integer> winners = summary.goldenWinners();
            md.append(String.format(Locale.ROOT, "%nGolden winners: SSZ %d / GR %d / TIE %d%n",
                winners.getOrDefault(Winner.SSZ, 0),
                winners.getOrDefault(Winner.GR, 0),
                winners.getOrDefault(Winner.TIE, 0)));
        }

        List<ValidationOutcome> failures = summary.failures();
        if (failures.isEmpty()) {
            md.append("\nAll checks passed.\n");
            return md.toString();
        }

        md.append("\n## Failures\n\n");
        md.append("| Test | Expected | Computed | Tolerance | Diagnosis |\n");
        md.append("|---|---|---|---|---|\n");
        for (ValidationOutcome f : failures) {
            md.append("| ").append(f.testId())
              .append(" | ").append(escape(f.expected()))
              .append(" | ").append(escape(f.computed()))
              .append(" | ").append(escape(f.tolerance()))
              .append(" | ").append(escape(f.diagnosis()))
              .append(" |\n");
        }
        return md.toString();
    }

    private static String escape(String cell) {
        return cell == null ? "" : cell.replace("|", "\\|");
    }
}
