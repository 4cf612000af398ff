package decision.engine.risk;

import java.util.List;

public record ComplianceReport(
        boolean compliant,
        List<String> issues,
        List<String> warnings,
        List<String> regulationsChecked
) {
    public ComplianceReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        regulationsChecked = regulationsChecked == null ? List.of() : List.copyOf(regulationsChecked);
    }
}
