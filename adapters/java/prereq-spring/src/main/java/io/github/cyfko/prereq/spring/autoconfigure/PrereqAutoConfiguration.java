package io.github.cyfko.prereq.spring.autoconfigure;

import io.github.cyfko.prereq.core.api.EligibilityEvaluator;
import io.github.cyfko.prereq.core.api.PrerequisiteCompiler;
import io.github.cyfko.prereq.core.batch.PrerequisiteBatchParser;
import io.github.cyfko.prereq.core.impl.BasicPrerequisiteCompiler;
import io.github.cyfko.prereq.core.impl.TreeWalkingEvaluator;
import io.github.cyfko.prereq.jpa.json.PrerequisitesModule;
import io.github.cyfko.prereq.spring.service.PrerequisiteService;
import io.github.cyfko.prereq.spring.service.impl.PrerequisiteServiceImpl;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(before = JacksonAutoConfiguration.class)
@ConditionalOnClass(PrerequisiteCompiler.class)
@EnableConfigurationProperties(PrereqProperties.class)
public class PrereqAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PrerequisiteCompiler prerequisiteCompiler(PrereqProperties properties) {
        return new BasicPrerequisiteCompiler(properties.toParserPolicy(), properties.toCachePolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public EligibilityEvaluator eligibilityEvaluator(PrereqProperties properties) {
        return new TreeWalkingEvaluator(properties.toEvaluationPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public PrerequisiteBatchParser prerequisiteBatchParser(PrerequisiteCompiler compiler, PrereqProperties properties) {
        return new PrerequisiteBatchParser(compiler, properties.effectiveParallelism());
    }

    /** Picked up by Spring Boot's Jackson auto-configuration. */
    @Bean
    @ConditionalOnClass(name = "com.fasterxml.jackson.databind.ObjectMapper")
    @ConditionalOnMissingBean
    public PrerequisitesModule prerequisitesModule() {
        return new PrerequisitesModule();
    }

    @Bean
    @ConditionalOnMissingBean
    public PrerequisiteService prerequisiteService(PrerequisiteCompiler compiler,
                                                   EligibilityEvaluator evaluator,
                                                   PrerequisiteBatchParser batchParser) {
        return new PrerequisiteServiceImpl(compiler, evaluator, batchParser);
    }
}
