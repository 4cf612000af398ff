package decision.engine.claims;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record DocumentStatus(List<String> verified, List<String> unverified, List<String> missing) {

    public DocumentStatus {
        verified = verified == null ? List.of() : List.copyOf(verified);
        unverified = unverified == null ? List.of() : List.copyOf(unverified);
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public static DocumentStatus empty() {
        return new DocumentStatus(List.of(), List.of(), List.of());
    }

    public List<String> insufficient() {
        List<String> result = new ArrayList<>(unverified);
        result.addAll(missing);
        return result;
    }

    /**
     * Places every checklist document in one bucket. A document classified more than once takes the
     * least favourable status (missing, then unverified, then verified). A document nobody classified
     * is unverified if the claimant declared it and missing otherwise.
     */
    public static DocumentStatus partition(
            List<String> checklist,
            Collection<String> verified,
            Collection<String> unverified,
            Collection<String> missing,
            Collection<String> declared
    ) {
        List<String> verifiedOut = new ArrayList<>();
        List<String> unverifiedOut = new ArrayList<>();
        List<String> missingOut = new ArrayList<>();

        for (String document : distinct(checklist)) {
            if (matchesAny(document, missing)) {
                missingOut.add(document);
            } else if (matchesAny(document, unverified)) {
                unverifiedOut.add(document);
            } else if (matchesAny(document, verified)) {
                verifiedOut.add(document);
            } else if (matchesAny(document, declared)) {
                unverifiedOut.add(document);
            } else {
                missingOut.add(document);
            }
        }
        return new DocumentStatus(verifiedOut, unverifiedOut, missingOut);
    }

    public static List<String> distinct(Collection<String> documents) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String document : documents) {
            if (document != null && !document.isBlank()) {
                unique.putIfAbsent(normalize(document), document.trim());
            }
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Names match when one's words appear as a contiguous run in the other's, so "Photos" matches
     * "Photos of the damage" while "ID" does not match "Incident Report".
     */
    static boolean matchesAny(String document, Collection<String> candidates) {
        List<String> words = words(document);
        if (words.isEmpty()) {
            return false;
        }
        for (String candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            List<String> other = words(candidate);
            if (!other.isEmpty() && (Collections.indexOfSubList(other, words) >= 0
                    || Collections.indexOfSubList(words, other) >= 0)) {
                return true;
            }
        }
        return false;
    }

    static List<String> words(String document) {
        String cleaned = document.toLowerCase(Locale.ROOT).replaceAll("['\u2019]", "");
        List<String> words = new ArrayList<>();
        for (String word : cleaned.split("[^a-z0-9]+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    static String normalize(String document) {
        return document.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
