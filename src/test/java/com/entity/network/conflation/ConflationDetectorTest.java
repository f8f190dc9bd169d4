package com.entity.network.conflation;

import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.EntityRecord;
import com.entity.network.identity.IdentityAssigner;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConflationDetectorTest {

    private static final IdentityAssigner ASSIGNER = new IdentityAssigner();

    private static EntityRecord canonical(String surface, String normalized, EntityKind kind) {
        return EntityRecord.builder()
                .surfaceName(surface)
                .normalizedName(normalized)
                .kind(kind)
                .identifier(ASSIGNER.assign(normalized, kind))
                .mentionCount(1)
                .addDocument("D1")
                .build();
    }

    private final ConflationDetector detector = new ConflationDetector();

    @Nested
    @DisplayName("Type conflicts")
    class TypeConflictTests {

        @Test
        @DisplayName("New York as a location and an organization is flagged once with both ids")
        void testNewYork() {
            ConflationReport report = detector.detect(List.of(
                    canonical("New York", "new york", EntityKind.LOCATION),
                    canonical("New York", "new york", EntityKind.ORGANIZATION)));

            assertEquals(1, report.typeConflicts().size());
            TypeConflict conflict = report.typeConflicts().get(0);
            assertEquals("new york", conflict.normalizedName());
            assertEquals(Set.of(EntityKind.LOCATION, EntityKind.ORGANIZATION), conflict.kinds());
            assertTrue(conflict.identifiers().containsAll(List.of(
                    "ed7457cd-dc99-590b-9e1f-2418442d2930",
                    "54c3707b-8686-5f4a-a997-cf2ca1358cf0")));
            assertEquals(Severity.REVIEW, conflict.severity());
            assertFalse(report.hasResidualDuplicates());
            assertTrue(report.hasAdvisoryFindings());
        }

        @Test
        @DisplayName("Distinct names under distinct kinds are not conflicts")
        void testNoConflict() {
            ConflationReport report = detector.detect(List.of(
                    canonical("Palm Beach", "palm beach", EntityKind.LOCATION),
                    canonical("The FBI", "the fbi", EntityKind.ORGANIZATION)));
            assertTrue(report.typeConflicts().isEmpty());
        }
    }

    @Nested
    @DisplayName("Partial matches")
    class PartialMatchTests {

        @Test
        @DisplayName("A surname inside a full name is reported as advisory")
        void testSurname() {
            ConflationReport report = detector.detect(List.of(
                    canonical("Maxwell", "maxwell", EntityKind.PERSON),
                    canonical("Ghislaine Maxwell", "ghislaine maxwell", EntityKind.PERSON)));

            assertEquals(1, report.partialMatches().size());
            PartialMatch match = report.partialMatches().get(0);
            assertEquals("maxwell", match.shorterName());
            assertEquals("ghislaine maxwell", match.longerName());
            assertFalse(match.crossKind());
            assertEquals(Severity.ADVISORY, match.severity());
        }

        @Test
        @DisplayName("Substrings inside a word are not token aligned")
        void testTokenBoundary() {
            ConflationReport report = detector.detect(List.of(
                    canonical("Ann", "ann", EntityKind.PERSON),
                    canonical("Joanna Smith", "joanna smith", EntityKind.PERSON)));
            assertTrue(report.partialMatches().isEmpty());
        }

        @Test
        @DisplayName("Names shorter than the minimum length are skipped")
        void testMinimumLength() {
            List<EntityRecord> records = List.of(
                    canonical("NY", "ny", EntityKind.LOCATION),
                    canonical("NY Times", "ny times", EntityKind.ORGANIZATION));

            assertTrue(detector.detect(records).partialMatches().isEmpty());

            ConflationDetector lenient = new ConflationDetector(
                    EnumSet.allOf(ConflationCheck.class), 2, new NoOpMetricsService());
            assertEquals(1, lenient.detect(records).partialMatches().size());
        }

        @Test
        @DisplayName("Equal names never pair with each other")
        void testEqualNamesExcluded() {
            ConflationReport report = detector.detect(List.of(
                    canonical("New York", "new york", EntityKind.LOCATION),
                    canonical("New York", "new york", EntityKind.ORGANIZATION)));
            assertTrue(report.partialMatches().isEmpty());
        }

        @Test
        @DisplayName("Matches across kinds are counted")
        void testCrossKind() {
            ConflationReport report = detector.detect(List.of(
                    canonical("New York", "new york", EntityKind.LOCATION),
                    canonical("New York Times", "new york times", EntityKind.ORGANIZATION),
                    canonical("Mayor of New York", "mayor of new york", EntityKind.PERSON)));

            assertEquals(2, report.partialMatches().size());
            assertEquals(2, report.crossKindPartialMatches());
            assertEquals("mayor of new york", report.partialMatches().get(0).longerName());
        }

        @Test
        @DisplayName("Token containment helper respects whitespace bounds")
        void testContainsAsTokens() {
            assertTrue(ConflationDetector.containsAsTokens("ghislaine maxwell", "maxwell"));
            assertTrue(ConflationDetector.containsAsTokens("mayor of new york", "new york"));
            assertFalse(ConflationDetector.containsAsTokens("maxwells", "maxwell"));
        }
    }

    @Nested
    @DisplayName("Residual duplicates")
    class ResidualTests {

        @Test
        @DisplayName("Two records of one kind sharing a key are an invariant violation")
        void testResidualDuplicate() {
            ConflationReport report = detector.detect(List.of(
                    canonical("The FBI", "the fbi", EntityKind.ORGANIZATION),
                    canonical("THE FBI", "the fbi", EntityKind.ORGANIZATION)));

            assertTrue(report.hasResidualDuplicates());
            ResidualDuplicate duplicate = report.residualDuplicates().get(0);
            assertEquals(EntityKind.ORGANIZATION, duplicate.kind());
            assertEquals(2, duplicate.variants().size());
            assertEquals(Severity.INVARIANT_VIOLATION, duplicate.severity());

            DeduplicationInvariantViolationException ex = assertThrows(
                    DeduplicationInvariantViolationException.class, report::assertNoResidualDuplicates);
            assertEquals(1, ex.getResidualDuplicates().size());
            assertTrue(ex.getMessage().contains("the fbi"));
        }

        @Test
        @DisplayName("A clean set passes the assertion")
        void testCleanSet() {
            ConflationReport report = detector.detect(List.of(
                    canonical("The FBI", "the fbi", EntityKind.ORGANIZATION)));
            assertDoesNotThrow(report::assertNoResidualDuplicates);
            assertEquals(0, report.totalFindings());
            assertEquals(1, report.entitiesChecked());
        }
    }

    @Nested
    @DisplayName("Check selection")
    @ExtendWith(MockitoExtension.class)
    class SelectionTests {

        @Mock
        private MetricsService metrics;

        @Test
        @DisplayName("Only selected checks run and report metrics")
        void testSelectedChecks() {
            ConflationDetector typeOnly = new ConflationDetector(
                    EnumSet.of(ConflationCheck.TYPE_CONFLICT), 3, metrics);

            ConflationReport report = typeOnly.detect(List.of(
                    canonical("New York", "new york", EntityKind.LOCATION),
                    canonical("New York", "new york", EntityKind.ORGANIZATION),
                    canonical("New York Times", "new york times", EntityKind.ORGANIZATION)));

            assertEquals(Set.of(ConflationCheck.TYPE_CONFLICT), report.checksRun());
            assertEquals(1, report.typeConflicts().size());
            assertTrue(report.partialMatches().isEmpty());
            verify(metrics).recordConflationFindings("type_conflict", 1);
            verify(metrics, never()).recordConflationFindings(eq("partial_match"), anyInt());
            verify(metrics, never()).recordConflationFindings(eq("residual_variation"), anyInt());
        }

        @Test
        @DisplayName("Minimum length must be positive")
        void testInvalidMinimum() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ConflationDetector(EnumSet.allOf(ConflationCheck.class), 0, metrics));
        }
    }

    @Nested
    @DisplayName("ConflationCheck parsing")
    class ParseTests {

        @Test
        @DisplayName("Blank and all select every check")
        void testAll() {
            assertEquals(EnumSet.allOf(ConflationCheck.class), ConflationCheck.parseList(""));
            assertEquals(EnumSet.allOf(ConflationCheck.class), ConflationCheck.parseList(" ALL "));
        }

        @Test
        @DisplayName("Labels and enum names are accepted")
        void testList() {
            assertEquals(EnumSet.of(ConflationCheck.TYPE_CONFLICT, ConflationCheck.PARTIAL_MATCH),
                    ConflationCheck.parseList("type_conflict, PARTIAL_MATCH"));
        }

        @Test
        @DisplayName("Unknown checks are rejected")
        void testUnknown() {
            assertThrows(IllegalArgumentException.class, () -> ConflationCheck.parseList("fuzzy"));
        }
    }
}
