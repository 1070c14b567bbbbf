package io.github.cyfko.prereq.core.impl;

import io.github.cyfko.prereq.core.codec.TupleCodec;
import io.github.cyfko.prereq.core.config.EvaluationPolicy;
import io.github.cyfko.prereq.core.eval.EvaluationNode;
import io.github.cyfko.prereq.core.eval.EvaluationResult;
import io.github.cyfko.prereq.core.eval.NodeStatus;
import io.github.cyfko.prereq.core.exception.DepthExceededException;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.CourseRecord;
import io.github.cyfko.prereq.core.model.EnrollmentStatus;
import io.github.cyfko.prereq.core.model.Grade;
import io.github.cyfko.prereq.core.model.InMemoryStudentRecord;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.model.StudentRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link TreeWalkingEvaluator}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("TreeWalkingEvaluator Tests")
class TreeWalkingEvaluatorTest {

    private static final Course CS1331 = Course.of("CS 1331");
    private static final Course CS1301 = Course.of("CS 1301");
    private static final Course MATH1554 = Course.of("MATH 1554");
    private static final Course MATH1552 = Course.of("MATH 1552");
    private static final Course PHYS2211 = Course.of("PHYS 2211");

    private final TreeWalkingEvaluator evaluator = new TreeWalkingEvaluator();

    private static Prerequisites of(PrerequisiteSet root) {
        return Prerequisites.of(root);
    }

    @Nested
    @DisplayName("Basic semantics")
    class BasicSemantics {

        @Test
        @DisplayName("Should satisfy the empty sentinel for any record")
        void testEmptySentinel() {
            EvaluationResult result = evaluator.evaluate(Prerequisites.none(), StudentRecord.empty());

            assertTrue(result.satisfied());
            assertEquals(NodeStatus.NOT_APPLICABLE, result.status());
            assertEquals(NodeStatus.NOT_APPLICABLE, result.root().status());
            assertTrue(result.missing().isEmpty());
            assertTrue(evaluator.isSatisfied(Prerequisites.none(), StudentRecord.empty()));
        }

        @Test
        @DisplayName("Should require every child of an AND set")
        void testAnd() {
            // Given
            Prerequisites prereqs = of(PrerequisiteSet.and(CS1331, CS1301));
            StudentRecord record = InMemoryStudentRecord.builder().completed("CS 1331", Grade.C).build();

            // When
            EvaluationResult result = evaluator.evaluate(prereqs, record);

            // Then: CS 1301 is missing
            assertFalse(result.satisfied());
            assertEquals(NodeStatus.UNSATISFIED, result.status());
            assertEquals(List.of(CS1301), result.missing());
            assertFalse(evaluator.isSatisfied(prereqs, record));
        }

        @Test
        @DisplayName("Should require one child of an OR set")
        void testOr() {
            Prerequisites prereqs = of(PrerequisiteSet.or(CS1331, CS1301));
            StudentRecord record = InMemoryStudentRecord.builder().completed("CS 1301", Grade.B).build();

            EvaluationResult result = evaluator.evaluate(prereqs, record);

            assertTrue(result.satisfied());
            assertEquals(NodeStatus.SATISFIED, result.status());
            assertTrue(result.missing().isEmpty());
            assertTrue(evaluator.isSatisfied(prereqs, record));
        }

        @Test
        @DisplayName("Should evaluate nested grouping")
        void testNestedGrouping() {
            Prerequisites prereqs = of(PrerequisiteSet.and(PrerequisiteSet.or(CS1331, CS1301), MATH1554));
            StudentRecord record = InMemoryStudentRecord.builder()
                    .completed("CS 1301", Grade.B)
                    .completed("MATH 1554", Grade.A)
                    .build();

            assertTrue(evaluator.evaluate(prereqs, record).satisfied());
        }

        @Test
        @DisplayName("Should compare course ids case-insensitively against the record")
        void testCaseInsensitiveLookup() {
            StudentRecord record = InMemoryStudentRecord.builder().completed("cs 1331", Grade.A).build();

            assertTrue(evaluator.isSatisfied(of(PrerequisiteSet.and(CS1331)), record));
        }
    }

    @Nested
    @DisplayName("Grades")
    class Grades {

        @ParameterizedTest(name = "required {0}, recorded {1} -> {2}")
        @CsvSource({
                "C, D, false",
                "C, B, true",
                "C, C, true",
                "C, F, false",
                "D, A, true",
                "S, S, true",
                "S, A, false",
                "C, S, false",
                "T, T, true",
                "U, S, false"
        })
        @DisplayName("Should apply the grade scale")
        void testThreshold(String required, String recorded, boolean expected) {
            // Given: the stored tuple form, as consumed from the dataset
            Prerequisites prereqs = TupleCodec.decode(List.of(Map.of("id", "MATH 1554", "grade", required)));
            StudentRecord record = InMemoryStudentRecord.builder().completed("MATH 1554", recorded).build();

            // When / Then
            assertEquals(expected, evaluator.evaluate(prereqs, record).satisfied());
            assertEquals(expected, evaluator.isSatisfied(prereqs, record));
        }

        @Test
        @DisplayName("Should not let an ungraded completion meet a grade requirement")
        void testUngradedCompletion() {
            StudentRecord record = InMemoryStudentRecord.builder().completed("MATH 1554", (Grade) null).build();

            assertFalse(evaluator.isSatisfied(of(PrerequisiteSet.and(Course.of("MATH 1554", Grade.C))), record));
            assertTrue(evaluator.isSatisfied(of(PrerequisiteSet.and(MATH1554)), record));
        }
    }

    @Nested
    @DisplayName("Pending courses")
    class Pending {

        @Test
        @DisplayName("Should mark an in-progress course pending and still count it")
        void testInProgress() {
            Prerequisites prereqs = of(PrerequisiteSet.and(CS1331, MATH1554));
            StudentRecord record = InMemoryStudentRecord.builder()
                    .completed("CS 1331", Grade.A)
                    .inProgress("MATH 1554")
                    .build();

            EvaluationResult result = evaluator.evaluate(prereqs, record);

            assertTrue(result.satisfied());
            assertTrue(result.isPending());
            assertEquals(List.of(NodeStatus.SATISFIED, NodeStatus.PENDING),
                    result.root().children().stream().map(EvaluationNode::status).toList());
        }

        @Test
        @DisplayName("Should fail an in-progress course whose midterm grade is below the requirement")
        void testInProgressBelowGrade() {
            StudentRecord record = InMemoryStudentRecord.builder().inProgress("MATH 1554", Grade.D).build();

            EvaluationResult result = evaluator.evaluate(of(PrerequisiteSet.and(Course.of("MATH 1554", Grade.C))), record);

            assertEquals(NodeStatus.UNSATISFIED, result.status());
        }

        @Test
        @DisplayName("Should count planned courses only when concurrent or under the planning policy")
        void testPlanned() {
            StudentRecord record = InMemoryStudentRecord.builder().planned("MATH 1554").build();
            Prerequisites plain = of(PrerequisiteSet.and(MATH1554));
            Prerequisites concurrent = of(PrerequisiteSet.and(new Course("MATH 1554", null, true)));

            assertEquals(NodeStatus.UNSATISFIED, evaluator.evaluate(plain, record).status());
            assertEquals(NodeStatus.PENDING, evaluator.evaluate(concurrent, record).status());
            assertEquals(NodeStatus.PENDING,
                    new TreeWalkingEvaluator(EvaluationPolicy.planning()).evaluate(plain, record).status());
        }
    }

    @Nested
    @DisplayName("Explanation")
    class Explanation {

        @Test
        @DisplayName("Should explain every child of an unsatisfied AND set")
        void testAndExplainsAll() {
            Prerequisites prereqs = of(PrerequisiteSet.and(CS1331, CS1301, MATH1554));

            EvaluationResult result = evaluator.evaluate(prereqs, StudentRecord.empty());

            assertEquals(3, result.root().children().size());
            assertTrue(result.root().children().stream().allMatch(EvaluationNode::selected));
            assertEquals(List.of(CS1331, CS1301, MATH1554), result.missing());
        }

        @Test
        @DisplayName("Should prefer a completed branch over a pending one")
        void testOrPrefersCompleted() {
            Prerequisites prereqs = of(PrerequisiteSet.or(CS1331, CS1301, MATH1554));
            StudentRecord record = InMemoryStudentRecord.builder()
                    .inProgress("CS 1331")
                    .completed("CS 1301", Grade.B)
                    .completed("MATH 1554", Grade.A)
                    .build();

            EvaluationResult result = evaluator.evaluate(prereqs, record);

            assertEquals(NodeStatus.SATISFIED, result.status());
            assertEquals(List.of(false, true, false),
                    result.root().children().stream().map(EvaluationNode::selected).toList());
        }

        @Test
        @DisplayName("Should report an OR set as pending when only a pending branch holds")
        void testOrPending() {
            Prerequisites prereqs = of(PrerequisiteSet.or(CS1331, CS1301));
            StudentRecord record = InMemoryStudentRecord.builder().inProgress("CS 1301").build();

            EvaluationResult result = evaluator.evaluate(prereqs, record);

            assertTrue(result.satisfied());
            assertTrue(result.isPending());
            assertTrue(result.root().children().get(1).selected());
        }

        @Test
        @DisplayName("Should list the missing courses of the most nearly satisfied branch")
        void testMissingFollowsBestBranch() {
            // Given: (CS 1331 and CS 1301 and MATH 1554) or (MATH 1552 and PHYS 2211)
            Prerequisites prereqs = of(PrerequisiteSet.or(
                    PrerequisiteSet.and(CS1331, CS1301, MATH1554),
                    PrerequisiteSet.and(MATH1552, PHYS2211)));
            StudentRecord record = InMemoryStudentRecord.builder().completed("MATH 1552", Grade.B).build();

            // When
            EvaluationResult result = evaluator.evaluate(prereqs, record);

            // Then: the second branch is one course away, the first is three
            assertFalse(result.satisfied());
            assertEquals(List.of(PHYS2211), result.missing());
            assertFalse(result.root().children().get(0).selected());
            assertTrue(result.root().children().get(1).selected());
        }

        @Test
        @DisplayName("Should break ties between unsatisfied branches by catalog order")
        void testTieBreak() {
            EvaluationResult result = evaluator.evaluate(of(PrerequisiteSet.or(CS1331, CS1301)), StudentRecord.empty());

            assertEquals(List.of(CS1331), result.missing());
        }
    }

    @Nested
    @DisplayName("Depth guard")
    class DepthGuard {

        private Prerequisites nested(int depth) {
            PrerequisiteSet set = PrerequisiteSet.and(CS1331);
            for (int i = 0; i < depth; i++) {
                set = i % 2 == 0 ? PrerequisiteSet.or(set, CS1301) : PrerequisiteSet.and(set, CS1301);
            }
            return Prerequisites.of(set);
        }

        @Test
        @DisplayName("Should evaluate a tree at the maximum depth")
        void testAtLimit() {
            assertDoesNotThrow(() -> evaluator.evaluate(nested(10), StudentRecord.empty()));
        }

        @Test
        @DisplayName("Should raise DepthExceededException past the maximum depth")
        void testBeyondLimit() {
            assertThrows(DepthExceededException.class, () -> evaluator.evaluate(nested(11), StudentRecord.empty()));
            assertThrows(DepthExceededException.class, () -> evaluator.isSatisfied(nested(11), StudentRecord.empty()));
        }

        @Test
        @DisplayName("Should raise DepthExceededException for a 50-level tree")
        void testFiftyLevels() {
            DepthExceededException e = assertThrows(DepthExceededException.class,
                    () -> evaluator.evaluate(nested(50), StudentRecord.empty()));

            assertEquals(10, e.getMaxDepth());
        }

        @Test
        @DisplayName("Should honor a custom depth")
        void testCustomDepth() {
            TreeWalkingEvaluator shallow = new TreeWalkingEvaluator(new EvaluationPolicy(2, false));

            assertDoesNotThrow(() -> shallow.isSatisfied(nested(2), StudentRecord.empty()));
            assertThrows(DepthExceededException.class, () -> shallow.isSatisfied(nested(3), StudentRecord.empty()));
        }
    }

    @Nested
    @DisplayName("Student record collaborator")
    class Collaborator {

        @Mock
        private StudentRecord record;

        private AutoCloseable mocks;

        @BeforeEach
        void setUp() {
            mocks = MockitoAnnotations.openMocks(this);
            when(record.lookup(anyString())).thenReturn(Optional.empty());
        }

        @AfterEach
        void tearDown() throws Exception {
            mocks.close();
        }

        @Test
        @DisplayName("evaluate should visit every leaf")
        void testEvaluateVisitsAll() {
            evaluator.evaluate(of(PrerequisiteSet.and(CS1331, CS1301, MATH1554)), record);

            verify(record).lookup("CS 1331");
            verify(record).lookup("CS 1301");
            verify(record).lookup("MATH 1554");
        }

        @Test
        @DisplayName("isSatisfied should stop at the first failing AND child")
        void testIsSatisfiedShortCircuits() {
            assertFalse(evaluator.isSatisfied(of(PrerequisiteSet.and(CS1331, CS1301, MATH1554)), record));

            verify(record).lookup("CS 1331");
            verify(record, never()).lookup("CS 1301");
            verify(record, never()).lookup("MATH 1554");
        }

        @Test
        @DisplayName("isSatisfied should stop at the first holding OR child")
        void testIsSatisfiedShortCircuitsOr() {
            when(record.lookup("CS 1331")).thenReturn(Optional.of(new CourseRecord(EnrollmentStatus.COMPLETED, Grade.A)));

            assertTrue(evaluator.isSatisfied(of(PrerequisiteSet.or(CS1331, CS1301)), record));

            verify(record, never()).lookup("CS 1301");
        }
    }

    @Test
    @DisplayName("Should reject null arguments")
    void testNullArguments() {
        assertThrows(NullPointerException.class, () -> evaluator.evaluate(null, StudentRecord.empty()));
        assertThrows(NullPointerException.class, () -> evaluator.isSatisfied(Prerequisites.none(), null));
    }
}
