package decision.engine.claims;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DocumentGuidanceCatalog {
    private static final Map<String, Entry> ENTRIES = new LinkedHashMap<>();

    static {
        ENTRIES.put("police", new Entry(
                "Request a copy of the report from the police station that attended, quoting the incident date and location.",
                "Local police department", "3-5 business days", "Free / $10-$25"));
        ENTRIES.put("fire", new Entry(
                "Request the incident report from the fire department that responded.",
                "Local fire department", "5-10 business days", "Free / $10-$25"));
        ENTRIES.put("estimate", new Entry(
                "Ask a licensed repairer or contractor for an itemised written estimate on their letterhead.",
                "Licensed repair shop or contractor", "1-3 business days", "Usually free"));
        ENTRIES.put("photo", new Entry(
                "Provide dated photographs that clearly show the damage or evidence described in the claim.",
                "Claimant", "Same day", "Free"));
        ENTRIES.put("licence", new Entry(
                "Upload a clear copy of both sides of the driver's licence valid at the time of the incident.",
                "Motor vehicle licensing authority", "Same day", "Free"));
        ENTRIES.put("death", new Entry(
                "Order a certified copy from the vital records office where the death was registered.",
                "Vital records / civil registry office", "5-15 business days", "$15-$30 per copy"));
        ENTRIES.put("coroner", new Entry(
                "Request the report from the coroner or medical examiner's office handling the case.",
                "Coroner / medical examiner's office", "2-6 weeks", "Varies by jurisdiction"));
        ENTRIES.put("medical", new Entry(
                "Ask the treating provider's records department for a copy of the relevant medical records.",
                "Treating hospital or clinic", "5-30 days", "Free / copying fee"));
        ENTRIES.put("doctor", new Entry(
                "Ask the treating doctor for a signed report stating diagnosis, treatment and dates.",
                "Treating physician", "3-7 business days", "Varies"));
        ENTRIES.put("physician", new Entry(
                "Ask the treating physician to complete and sign an attending physician's statement.",
                "Treating physician", "5-10 business days", "Varies"));
        ENTRIES.put("discharge", new Entry(
                "Request the discharge summary from the hospital's medical records department.",
                "Hospital medical records department", "3-10 business days", "Free / copying fee"));
        ENTRIES.put("bill", new Entry(
                "Request itemised invoices from each provider or vendor listing services and amounts.",
                "Provider billing department or vendor", "1-5 business days", "Free"));
        ENTRIES.put("receipt", new Entry(
                "Provide original receipts or bank statements showing the purchase and amount.",
                "Vendor or bank", "1-5 business days", "Free"));
        ENTRIES.put("employer", new Entry(
                "Ask your employer's HR department for a letter confirming role, absence dates and earnings.",
                "Employer HR department", "3-5 business days", "Free"));
        ENTRIES.put("witness", new Entry(
                "Ask each witness for a signed, dated statement with their contact details and account of events.",
                "Independent witnesses", "1-7 days", "Free"));
        ENTRIES.put("incident", new Entry(
                "Write a dated account of the incident and attach any report issued by the responsible authority.",
                "Claimant or attending authority", "1-3 business days", "Free"));
    }

    private static final Entry GENERIC = new Entry(
            "Contact the organisation that issued the document and request a certified copy.",
            "Issuing organisation", "5-10 business days", "Varies");
    private static final String CONTACT = "Claims helpline or the issuing organisation";

    public DocumentGuidance guidanceFor(String document, String status) {
        String key = DocumentStatus.normalize(document);
        Entry entry = GENERIC;
        for (Map.Entry<String, Entry> candidate : ENTRIES.entrySet()) {
            if (key.contains(candidate.getKey())) {
                entry = candidate.getValue();
                break;
            }
        }
        return new DocumentGuidance(document, status, entry.howToObtain(), entry.issuingEntity(),
                entry.turnaround(), entry.cost(), CONTACT);
    }

    public List<DocumentGuidance> complete(List<DocumentGuidance> existing, DocumentStatus status) {
        List<DocumentGuidance> result = new ArrayList<>(existing);
        List<String> covered = existing.stream().map(DocumentGuidance::document).toList();
        for (String document : status.missing()) {
            if (!DocumentStatus.matchesAny(document, covered)) {
                result.add(guidanceFor(document, "MISSING"));
            }
        }
        for (String document : status.unverified()) {
            if (!DocumentStatus.matchesAny(document, covered)) {
                result.add(guidanceFor(document, "DECLARED_BUT_UNVERIFIED"));
            }
        }
        return result;
    }

    private record Entry(String howToObtain, String issuingEntity, String turnaround, String cost) {}
}
