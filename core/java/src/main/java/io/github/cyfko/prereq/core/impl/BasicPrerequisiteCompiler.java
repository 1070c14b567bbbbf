package io.github.cyfko.prereq.core.impl;

import io.github.cyfko.prereq.core.api.ParseOutcome;
import io.github.cyfko.prereq.core.api.PrerequisiteCompiler;
import io.github.cyfko.prereq.core.cache.BoundedLRUCache;
import io.github.cyfko.prereq.core.config.CachePolicy;
import io.github.cyfko.prereq.core.config.ParserPolicy;
import io.github.cyfko.prereq.core.exception.DepthExceededException;
import io.github.cyfko.prereq.core.exception.LexException;
import io.github.cyfko.prereq.core.exception.ParseException;
import io.github.cyfko.prereq.core.exception.PrerequisiteException;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.parsing.ParseNode;
import io.github.cyfko.prereq.core.parsing.PrerequisiteLexer;
import io.github.cyfko.prereq.core.parsing.PrerequisiteNormalizer;
import io.github.cyfko.prereq.core.parsing.PrerequisiteParser;
import io.github.cyfko.prereq.core.parsing.TokenStream;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Default {@link PrerequisiteCompiler}: lexer, parser and normalizer run in sequence, with an optional
 * LRU cache keyed by the trimmed raw text.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li>{@link PrerequisiteLexer#tokenize(String)}: classify spans, collect every lexing error</li>
 *   <li>{@link PrerequisiteParser#parse(TokenStream)}: grammar check and grouping per {@link ParserPolicy#groupingPolicy()}</li>
 *   <li>{@link PrerequisiteNormalizer#normalize(ParseNode)}: flatten, deduplicate, collapse</li>
 *   <li>{@link Prerequisites#depth()}: the normalized tree must fit {@link ParserPolicy#maxNestingDepth()}, the bound
 *       the evaluator and the stored-form decoder apply by default</li>
 * </ol>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * PrerequisiteCompiler compiler = new BasicPrerequisiteCompiler();
 *
 * // Crawl that salvages partially recognized text, with a large cache
 * PrerequisiteCompiler crawl = new BasicPrerequisiteCompiler(ParserPolicy.relaxed(), CachePolicy.relaxed());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicPrerequisiteCompiler implements PrerequisiteCompiler {

    private static final Logger log = Logger.getLogger(BasicPrerequisiteCompiler.class.getName());

    private final ParserPolicy parserPolicy;
    private final CachePolicy cachePolicy;
    private final PrerequisiteParser parser;
    protected final BoundedLRUCache<String, Prerequisites> cache;

    public BasicPrerequisiteCompiler() {
        this(ParserPolicy.defaults(), CachePolicy.defaults());
    }

    public BasicPrerequisiteCompiler(ParserPolicy parserPolicy) {
        this(parserPolicy, CachePolicy.defaults());
    }

    /**
     * @param parserPolicy the parser limits and grouping strategy
     * @param cachePolicy  the cache settings
     * @throws IllegalArgumentException if either policy is null
     */
    public BasicPrerequisiteCompiler(ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.parserPolicy = parserPolicy;
        this.cachePolicy = cachePolicy;
        this.parser = new PrerequisiteParser(parserPolicy.groupingPolicy(), parserPolicy.maxNestingDepth());
        this.cache = cachePolicy.cacheEnabled()
                ? new BoundedLRUCache<>(cachePolicy.cacheSize())
                : null;
    }

    @Override
    public Prerequisites parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Prerequisites.none();
        }

        String text = rawText.trim();
        if (text.length() > parserPolicy.maxInputLength()) {
            throw new ParseException(String.format(
                    "Prerequisite text too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), parserPolicy.maxInputLength(), parserPolicy.policyName()));
        }

        return cache != null
                ? cache.computeIfAbsent(text, this::compile)
                : compile(text);
    }

    @Override
    public ParseOutcome tryParse(String rawText) {
        try {
            return ParseOutcome.parsed(parse(rawText));
        } catch (PrerequisiteException e) {
            return ParseOutcome.failed(e);
        } catch (RuntimeException e) {
            log.warning(() -> "Unexpected failure compiling prerequisites '" + rawText + "': " + e);
            return ParseOutcome.failed(new PrerequisiteException("Unexpected failure compiling prerequisites", e));
        }
    }

    private Prerequisites compile(String text) {
        long start = System.nanoTime();

        TokenStream tokens = PrerequisiteLexer.tokenize(text);
        if (tokens.hasErrors()) {
            if (!parserPolicy.tolerateLexErrors()) {
                throw new LexException(tokens.errors());
            }
            log.fine(() -> String.format("Ignoring %d unrecognized span(s) in '%s': %s",
                    tokens.errors().size(), text, tokens.errors()));
        }
        if (tokens.isEmpty()) {
            throw new ParseException("No course requirement found in prerequisite text");
        }

        Prerequisites result = PrerequisiteNormalizer.normalize(parser.parse(tokens));
        // mixed connectives inside one group add set levels that parenthesis counting does not see
        if (result.depth() > parserPolicy.maxNestingDepth()) {
            throw new DepthExceededException(parserPolicy.maxNestingDepth());
        }

        log.fine(() -> String.format("Compiled prerequisites in %d us: %s",
                (System.nanoTime() - start) / 1_000, result));
        return result;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * @return map containing cache statistics (size, maxSize) or {@code enabled=false} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
                "enabled", true,
                "size", cache.size(),
                "maxSize", cachePolicy.cacheSize()
        );
    }
}
