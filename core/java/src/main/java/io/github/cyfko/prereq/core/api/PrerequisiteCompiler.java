package io.github.cyfko.prereq.core.api;

import io.github.cyfko.prereq.core.exception.DepthExceededException;
import io.github.cyfko.prereq.core.exception.LexException;
import io.github.cyfko.prereq.core.exception.NormalizationException;
import io.github.cyfko.prereq.core.exception.ParseException;
import io.github.cyfko.prereq.core.model.Prerequisites;

/**
 * Compiles free-form catalog prerequisite text into a canonical {@link Prerequisites} tree.
 *
 * <h2>Accepted Text</h2>
 * <pre>
 * expression   := term (connective term)*
 * term         := '(' expression ')' | courseClause
 * courseClause := COURSE [Minimum Grade of G] [may be taken concurrently]
 * connective   := 'and' | 'or' | ','
 * </pre>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * PrerequisiteCompiler compiler = new BasicPrerequisiteCompiler();
 *
 * compiler.parse("");                                        // Prerequisites.none()
 * compiler.parse("CS 1331 Minimum Grade of C");              // [and, {CS 1331, C}]
 * compiler.parse("(CS 1331 or CS 1301) and MATH 1554");      // [and, [or, CS 1331, CS 1301], MATH 1554]
 *
 * ParseOutcome outcome = compiler.tryParse("CS 1331 and (");  // Failed(ParseException), never throws
 * }</pre>
 *
 * <p>Implementations are stateless with respect to callers and safe to share between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.prereq.core.impl.BasicPrerequisiteCompiler
 */
public interface PrerequisiteCompiler {

    /**
     * Strict entry point for tests and ad hoc tooling.
     *
     * @param rawText catalog prerequisite text; {@code null} or blank yields {@link Prerequisites#none()}
     * @return the canonical prerequisites
     * @throws LexException           if unrecognized spans are present and not tolerated
     * @throws ParseException         on any grammar violation
     * @throws DepthExceededException if parentheses nest too deeply
     * @throws NormalizationException if an empty set survives normalization
     */
    Prerequisites parse(String rawText);

    /**
     * Batch entry point: never throws, converting every failure into {@link ParseOutcome.Failed}.
     *
     * @param rawText catalog prerequisite text
     * @return the outcome
     */
    ParseOutcome tryParse(String rawText);
}
