package decision.engine.claims;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentStatusTest {
    private static final List<String> CHECKLIST = List.of("Police Report", "Photos", "Repair Estimate", "Medical Records");

    @Test
    void shouldPlaceEveryDocumentInExactlyOneBucket() {
        DocumentStatus status = DocumentStatus.partition(
                CHECKLIST,
                List.of("police report"),
                List.of(),
                List.of(),
                List.of("Photos"));

        assertEquals(List.of("Police Report"), status.verified());
        assertEquals(List.of("Photos"), status.unverified());
        assertEquals(List.of("Repair Estimate", "Medical Records"), status.missing());
        assertEquals(List.of("Photos", "Repair Estimate", "Medical Records"), status.insufficient());
    }

    @Test
    void shouldPreferLeastFavourableStatus() {
        DocumentStatus status = DocumentStatus.partition(
                List.of("Police Report", "Photos"),
                List.of("Police Report", "Photos"),
                List.of("Photos"),
                List.of("Police-Report"),
                List.of());

        assertEquals(List.of(), status.verified());
        assertEquals(List.of("Photos"), status.unverified());
        assertEquals(List.of("Police Report"), status.missing());
    }

    @Test
    void shouldDeduplicateByNormalisedName() {
        assertEquals(List.of("Police Report", "Photos"),
                DocumentStatus.distinct(List.of("Police Report", " police-report ", "Photos", "", "PHOTOS")));
    }

    @Test
    void shouldMatchOnWholeWords() {
        assertTrue(DocumentStatus.matchesAny("Photos", List.of("Photos of the damage")));
        assertTrue(DocumentStatus.matchesAny("Driver's Licence Copy", List.of("drivers licence copy")));
        assertTrue(DocumentStatus.matchesAny("Police-Report", List.of("Police Report")));
        assertFalse(DocumentStatus.matchesAny("Photos", List.of("Police Report")));
        assertFalse(DocumentStatus.matchesAny("Photos", List.of("   ")));
        assertFalse(DocumentStatus.matchesAny("ID", List.of("Incident Report")));
        assertFalse(DocumentStatus.matchesAny("Incident Report", List.of("ID")));
    }

    @Test
    void shouldNotVerifyChecklistItemFromShortUnrelatedName() {
        DocumentStatus status = DocumentStatus.partition(
                List.of("Incident Report", "Photos"),
                List.of("ID"),
                List.of(),
                List.of(),
                List.of("ID", "Photos"));

        assertEquals(List.of(), status.verified());
        assertEquals(List.of("Photos"), status.unverified());
        assertEquals(List.of("Incident Report"), status.missing());
    }
}
