package io.github.cyfko.prereq.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.prereq.core.api.EligibilityEvaluator;
import io.github.cyfko.prereq.core.api.PrerequisiteCompiler;
import io.github.cyfko.prereq.core.batch.PrerequisiteBatchParser;
import io.github.cyfko.prereq.core.config.EvaluationPolicy;
import io.github.cyfko.prereq.core.config.ParserPolicy;
import io.github.cyfko.prereq.core.impl.BasicPrerequisiteCompiler;
import io.github.cyfko.prereq.core.impl.TreeWalkingEvaluator;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.parsing.GroupingPolicy;
import io.github.cyfko.prereq.jpa.json.PrerequisitesModule;
import io.github.cyfko.prereq.spring.service.PrerequisiteService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PrereqAutoConfiguration}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("PrereqAutoConfiguration Tests")
class PrereqAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PrereqAutoConfiguration.class, JacksonAutoConfiguration.class));

    @Test
    @DisplayName("Should register the engine beans with default policies")
    void testDefaults() {
        contextRunner.run(context -> {
            assertEquals(1, context.getBeansOfType(PrerequisiteCompiler.class).size());
            assertEquals(1, context.getBeansOfType(EligibilityEvaluator.class).size());
            assertEquals(1, context.getBeansOfType(PrerequisiteBatchParser.class).size());
            assertEquals(1, context.getBeansOfType(PrerequisiteService.class).size());
            assertEquals(1, context.getBeansOfType(PrerequisitesModule.class).size());

            BasicPrerequisiteCompiler compiler = (BasicPrerequisiteCompiler) context.getBean(PrerequisiteCompiler.class);
            assertEquals(10, compiler.getParserPolicy().maxNestingDepth());
            assertSame(GroupingPolicy.LEFT_TO_RIGHT, compiler.getParserPolicy().groupingPolicy());
            assertEquals(1000, compiler.getCacheStats().get("maxSize"));
        });
    }

    @Test
    @DisplayName("Should bind prereq.* properties")
    void testProperties() {
        contextRunner
                .withPropertyValues(
                        "prereq.parser.grouping=and-binds-tighter",
                        "prereq.parser.tolerate-lex-errors=true",
                        "prereq.evaluation.count-planned-as-pending=true",
                        "prereq.cache.enabled=false",
                        "prereq.batch.parallelism=3")
                .run(context -> {
                    BasicPrerequisiteCompiler compiler = (BasicPrerequisiteCompiler) context.getBean(PrerequisiteCompiler.class);
                    ParserPolicy policy = compiler.getParserPolicy();
                    assertSame(GroupingPolicy.AND_BINDS_TIGHTER, policy.groupingPolicy());
                    assertTrue(policy.tolerateLexErrors());
                    assertEquals(Map.of("enabled", false), compiler.getCacheStats());

                    TreeWalkingEvaluator evaluator = (TreeWalkingEvaluator) context.getBean(EligibilityEvaluator.class);
                    assertEquals(EvaluationPolicy.planning(), evaluator.getPolicy());

                    assertEquals(3, context.getBean(PrereqProperties.class).effectiveParallelism());
                    assertEquals(
                            Prerequisites.of(PrerequisiteSet.or(Course.of("CS 1331"),
                                    PrerequisiteSet.and(Course.of("CS 1301"), Course.of("MATH 1554")))),
                            context.getBean(PrerequisiteService.class).parse("CS 1331 or CS 1301 and MATH 1554"));
                });
    }

    @Test
    @DisplayName("Should fail to start on an unknown grouping policy")
    void testInvalidGrouping() {
        contextRunner
                .withPropertyValues("prereq.parser.grouping=precedence")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should back off when the application defines its own compiler")
    void testUserCompiler() {
        contextRunner
                .withUserConfiguration(CustomCompilerConfiguration.class)
                .run(context -> {
                    assertSame(CustomCompilerConfiguration.COMPILER, context.getBean(PrerequisiteCompiler.class));
                    assertEquals(1, context.getBeansOfType(PrerequisiteService.class).size());
                });
    }

    @Test
    @DisplayName("Should register the tuple form with Spring's ObjectMapper")
    void testJacksonModule() {
        contextRunner.run(context -> {
            ObjectMapper mapper = context.getBean(ObjectMapper.class);
            Prerequisites prereqs = context.getBean(PrerequisiteService.class).parse("CS 1331 or CS 1301");

            assertEquals("[\"or\",{\"id\":\"CS 1331\"},{\"id\":\"CS 1301\"}]", mapper.writeValueAsString(prereqs));
            assertEquals(prereqs, mapper.readValue("[\"or\",{\"id\":\"CS 1331\"},{\"id\":\"CS 1301\"}]", Prerequisites.class));
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomCompilerConfiguration {
        static final PrerequisiteCompiler COMPILER = new BasicPrerequisiteCompiler(ParserPolicy.strict());

        @Bean
        PrerequisiteCompiler customCompiler() {
            return COMPILER;
        }
    }
}
