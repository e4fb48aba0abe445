/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.validation;

import java.time.Instant;
import java.util.List;

public record ValidationReport(boolean valid, List<ValidationIssue> issues, Instant checkedAt) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public static ValidationReport of(List<ValidationIssue> issues) {
        boolean valid = issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
        return new ValidationReport(valid, issues, Instant.now());
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("P3IF Validation Report\n");
        sb.append("Checked at : ").append(checkedAt).append('\n');
        sb.append("Valid      : ").append(valid ? "yes" : "no").append('\n');
        sb.append("Errors     : ").append(count(Severity.ERROR)).append('\n');
        sb.append("Warnings   : ").append(count(Severity.WARNING)).append('\n');
        sb.append("Info       : ").append(count(Severity.INFO)).append('\n');
        for (ValidationIssue issue : issues) {
            sb.append(String.format("%-7s %-24s %s: %s%n",
                    issue.severity(), issue.rule(), issue.subjectId(), issue.message()));
        }
        return sb.toString();
    }
}
