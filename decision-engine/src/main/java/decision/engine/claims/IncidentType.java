package decision.engine.claims;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public enum IncidentType {
    AUTO(
            List.of("car", "vehicle", "collision", "crash", "truck", "motorcycle", "driver", "traffic", "windshield"),
            List.of("Police Report", "Repair/Replacement Estimate", "Photos", "Driver's Licence Copy")
    ),
    DEATH(
            List.of("death", "died", "deceased", "passed away", "funeral", "fatal", "fatality"),
            List.of("Certified Death Certificate", "Medical Records", "Coroner's Report")
    ),
    MEDICAL(
            List.of("hospital", "hospitalised", "hospitalized", "surgery", "medical", "doctor", "treatment", "diagnosed", "illness"),
            List.of("Doctor's Report", "Hospital Discharge Summary", "Itemised Bills")
    ),
    PROPERTY(
            List.of("fire", "theft", "burglary", "stolen", "flood", "house", "home", "roof", "property", "water damage"),
            List.of("Police/Fire Report", "Photos", "Repair/Replacement Estimate")
    ),
    DISABILITY(
            List.of("disability", "disabled", "unable to work", "incapacity", "incapacitated"),
            List.of("Physician's Statement", "Employer Letter", "Medical Records")
    ),
    GENERAL(
            List.of(),
            List.of("Incident Report", "Witness Statements (x2)", "Photos", "Receipts/Bills")
    );

    private final Pattern keywords;
    private final List<String> checklist;

    IncidentType(List<String> keywords, List<String> checklist) {
        this.keywords = keywords.isEmpty()
                ? null
                : Pattern.compile("\\b(" + String.join("|", keywords) + ")\\b", Pattern.CASE_INSENSITIVE);
        this.checklist = checklist;
    }

    public List<String> checklist() {
        return checklist;
    }

    public static List<IncidentType> infer(String narrative) {
        Set<IncidentType> matched = EnumSet.noneOf(IncidentType.class);
        if (narrative != null) {
            for (IncidentType type : values()) {
                if (type.keywords != null && type.keywords.matcher(narrative).find()) {
                    matched.add(type);
                }
            }
        }
        if (matched.isEmpty()) {
            return List.of(GENERAL);
        }
        return List.copyOf(matched);
    }

    public static List<String> checklist(List<IncidentType> types) {
        Set<String> union = new LinkedHashSet<>();
        for (IncidentType type : types) {
            union.addAll(type.checklist);
        }
        return new ArrayList<>(union);
    }
}
