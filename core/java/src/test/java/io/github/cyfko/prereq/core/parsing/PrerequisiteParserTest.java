package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.exception.DepthExceededException;
import io.github.cyfko.prereq.core.exception.ParseException;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.Grade;
import io.github.cyfko.prereq.core.model.Operator;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PrerequisiteParser} and the grouping strategies.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("PrerequisiteParser Tests")
class PrerequisiteParserTest {

    private static final Course CS1331 = Course.of("CS 1331");
    private static final Course CS1301 = Course.of("CS 1301");
    private static final Course MATH1554 = Course.of("MATH 1554");

    private static ParseNode parse(String text) {
        return parse(text, GroupingPolicy.LEFT_TO_RIGHT);
    }

    private static ParseNode parse(String text, GroupingPolicy policy) {
        return new PrerequisiteParser(policy, 10).parse(PrerequisiteLexer.tokenize(text));
    }

    private static Prerequisites compile(String text, GroupingPolicy policy) {
        return PrerequisiteNormalizer.normalize(parse(text, policy));
    }

    @Nested
    @DisplayName("Course clauses")
    class CourseClauses {

        @Test
        @DisplayName("Should bind a grade clause to the preceding course")
        void testGradeBindsToCourse() {
            ParseNode node = parse("CS 1331 Minimum Grade of C");

            ParseNode.CourseNode course = assertInstanceOf(ParseNode.CourseNode.class, node);
            assertEquals(new Course("CS 1331", Grade.C, false), course.course());
            assertEquals(0, course.offset());
        }

        @Test
        @DisplayName("Should bind a grade clause to the last course only")
        void testGradeBindsToLastCourse() {
            ParseNode node = parse("CS 1331 and MATH 1554 minimum grade of B");

            ParseNode.BinaryNode and = assertInstanceOf(ParseNode.BinaryNode.class, node);
            assertEquals(Operator.AND, and.operator());
            assertEquals(CS1331, ((ParseNode.CourseNode) and.left()).course());
            assertEquals(Course.of("MATH 1554", Grade.B), ((ParseNode.CourseNode) and.right()).course());
        }

        @Test
        @DisplayName("Should accept grade and concurrency in either order")
        void testGradeAndConcurrency() {
            ParseNode first = parse("CS 1331 minimum grade of C [may be taken concurrently]");
            ParseNode second = parse("CS 1331 [may be taken concurrently] minimum grade of C");

            Course expected = new Course("CS 1331", Grade.C, true);
            assertEquals(expected, ((ParseNode.CourseNode) first).course());
            assertEquals(expected, ((ParseNode.CourseNode) second).course());
        }
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("Should honor parentheses over textual order")
        void testParenthesesTakePrecedence() {
            Prerequisites result = compile("(CS 1331 or CS 1301) and MATH 1554", GroupingPolicy.LEFT_TO_RIGHT);

            assertEquals(Prerequisites.of(PrerequisiteSet.and(PrerequisiteSet.or(CS1331, CS1301), MATH1554)), result);
        }

        @Test
        @DisplayName("Should group mixed connectives left to right by default")
        void testLeftToRight() {
            // Given: no parentheses, OR written first
            String text = "CS 1331 or CS 1301 and MATH 1554";

            // When
            Prerequisites result = compile(text, GroupingPolicy.LEFT_TO_RIGHT);

            // Then: ((CS 1331 or CS 1301) and MATH 1554)
            assertEquals(Prerequisites.of(PrerequisiteSet.and(PrerequisiteSet.or(CS1331, CS1301), MATH1554)), result);
        }

        @Test
        @DisplayName("Should let AND bind tighter when that policy is selected")
        void testAndBindsTighter() {
            Prerequisites result = compile("CS 1331 or CS 1301 and MATH 1554", GroupingPolicy.AND_BINDS_TIGHTER);

            assertEquals(Prerequisites.of(PrerequisiteSet.or(CS1331, PrerequisiteSet.and(CS1301, MATH1554))), result);
        }

        @Test
        @DisplayName("Should produce the same tree under both policies when only one operator is used")
        void testSingleOperatorIsPolicyIndependent() {
            String text = "CS 1331 or CS 1301 or MATH 1554";

            assertEquals(compile(text, GroupingPolicy.LEFT_TO_RIGHT), compile(text, GroupingPolicy.AND_BINDS_TIGHTER));
        }

        @ParameterizedTest
        @CsvSource({"left-to-right, LEFT_TO_RIGHT", "and_binds_tighter, AND_BINDS_TIGHTER"})
        @DisplayName("Should resolve grouping policies by name")
        void testNamedPolicy(String name, StandardGroupingPolicy expected) {
            assertSame(expected, GroupingPolicy.named(name));
        }

        @Test
        @DisplayName("Should reject an unknown grouping policy name")
        void testUnknownPolicyName() {
            assertThrows(IllegalArgumentException.class, () -> GroupingPolicy.named("precedence"));
        }

        @Test
        @DisplayName("Should reject operand and connective counts that do not line up")
        void testGroupShapeChecked() {
            ParseNode a = new ParseNode.CourseNode(CS1331, 0);

            assertThrows(IllegalArgumentException.class,
                    () -> GroupingPolicy.LEFT_TO_RIGHT.group(List.of(a, a), List.of()));
        }
    }

    @Nested
    @DisplayName("Grammar violations")
    class Violations {

        @Test
        @DisplayName("Should report an unclosed group")
        void testUnmatchedOpen() {
            ParseException e = assertThrows(ParseException.class, () -> parse("CS 1331 and ("));

            assertTrue(e.getMessage().contains("Unmatched '('"));
            assertEquals(12, e.getOffset());
            assertEquals("(", e.getSpan());
        }

        @Test
        @DisplayName("Should report a group missing its closing parenthesis")
        void testUnclosedGroupWithContent() {
            ParseException e = assertThrows(ParseException.class, () -> parse("(CS 1331 or CS 1301"));

            assertTrue(e.getMessage().contains("Unmatched '('"));
            assertEquals(0, e.getOffset());
        }

        @Test
        @DisplayName("Should report a stray closing parenthesis")
        void testUnmatchedClose() {
            ParseException e = assertThrows(ParseException.class, () -> parse("CS 1331)"));

            assertTrue(e.getMessage().contains("Unmatched ')'"));
            assertEquals(7, e.getOffset());
        }

        @Test
        @DisplayName("Should report a dangling trailing connective")
        void testDanglingConnective() {
            ParseException e = assertThrows(ParseException.class, () -> parse("CS 1331 and"));

            assertTrue(e.getMessage().contains("Dangling connective 'and'"));
            assertEquals(8, e.getOffset());
        }

        @Test
        @DisplayName("Should report a connective right before a closing parenthesis")
        void testConnectiveBeforeClose() {
            ParseException e = assertThrows(ParseException.class, () -> parse("(CS 1331 or) and MATH 1554"));

            assertTrue(e.getMessage().contains("Dangling connective 'or'"));
        }

        @Test
        @DisplayName("Should report a leading connective")
        void testLeadingConnective() {
            ParseException e = assertThrows(ParseException.class, () -> parse("and CS 1331"));

            assertTrue(e.getMessage().contains("Expected a course or '('"));
            assertEquals(0, e.getOffset());
        }

        @Test
        @DisplayName("Should report an empty parenthesized group")
        void testEmptyGroup() {
            ParseException e = assertThrows(ParseException.class, () -> parse("CS 1331 and ()"));

            assertTrue(e.getMessage().contains("Empty parenthesized group"));
            assertEquals(12, e.getOffset());
        }

        @Test
        @DisplayName("Should report two courses with no connective")
        void testMissingConnective() {
            ParseException e = assertThrows(ParseException.class, () -> parse("CS 1331 MATH 1554"));

            assertTrue(e.getMessage().contains("before course MATH 1554"));
            assertEquals(8, e.getOffset());
        }

        @Test
        @DisplayName("Should reject a grade clause applied to a group")
        void testGradeOnGroup() {
            ParseException e = assertThrows(ParseException.class,
                    () -> parse("(CS 1331 or CS 1301) minimum grade of C"));

            assertTrue(e.getMessage().contains("cannot apply to a group"));
        }

        @Test
        @DisplayName("Should reject a grade clause with no course")
        void testGradeWithoutCourse() {
            ParseException e = assertThrows(ParseException.class, () -> parse("minimum grade of C"));

            assertTrue(e.getMessage().contains("must directly follow a course"));
        }

        @Test
        @DisplayName("Should reject a second grade clause on one course")
        void testDuplicateGrade() {
            ParseException e = assertThrows(ParseException.class,
                    () -> parse("CS 1331 minimum grade of C minimum grade of B"));

            assertTrue(e.getMessage().contains("already has a minimum grade"));
        }
    }

    @Nested
    @DisplayName("Nesting limit")
    class Nesting {

        private String nested(int levels) {
            return "(".repeat(levels) + "CS 1331" + ")".repeat(levels);
        }

        @Test
        @DisplayName("Should accept nesting up to the limit")
        void testWithinLimit() {
            assertDoesNotThrow(() -> parse(nested(10)));
        }

        @Test
        @DisplayName("Should raise DepthExceededException past the limit")
        void testBeyondLimit() {
            DepthExceededException e = assertThrows(DepthExceededException.class, () -> parse(nested(11)));

            assertEquals(10, e.getMaxDepth());
        }

        @Test
        @DisplayName("Should raise DepthExceededException for a 50-level expression")
        void testFiftyLevels() {
            assertThrows(DepthExceededException.class, () -> parse(nested(50)));
        }

        @Test
        @DisplayName("Should reject a non-positive nesting limit")
        void testInvalidLimit() {
            assertThrows(IllegalArgumentException.class, () -> new PrerequisiteParser(GroupingPolicy.LEFT_TO_RIGHT, 0));
        }
    }
}
