package com.babeltest.config;

import com.babeltest.core.executor.ExecutorFactory;
import com.babeltest.core.ir.IrJson;
import com.babeltest.core.ir.IrLoader;
import com.babeltest.core.ir.IrValidator;
import com.babeltest.core.resolve.TargetRegistrar;
import com.babeltest.core.resolve.TargetRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

@Configuration
public class BabelTestConfig {

    private static final Logger log = LoggerFactory.getLogger(BabelTestConfig.class);

    /** Mapper for IR files and the runtime protocol; Boot's auto-configured mapper backs off. */
    @Bean
    public ObjectMapper irObjectMapper() {
        return IrJson.newMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Targets come from registrar beans plus any {@link TargetRegistrar} service
     * registrations on the classpath.
     */
    @Bean
    public TargetRegistry targetRegistry(ObjectProvider<TargetRegistrar> registrarBeans) {
        List<TargetRegistrar> registrars = new ArrayList<>(registrarBeans.orderedStream().toList());
        ServiceLoader.load(TargetRegistrar.class, Thread.currentThread().getContextClassLoader())
                .forEach(registrars::add);
        TargetRegistry registry = TargetRegistry.of(registrars);
        log.debug("Target registry ready: {} registrar(s), modules {}", registrars.size(), registry.modulePaths());
        return registry;
    }

    @Bean
    public ExecutorFactory executorFactory(TargetRegistry targetRegistry, BabelTestProperties properties,
                                           ObjectMapper irObjectMapper) {
        return new ExecutorFactory(targetRegistry, properties.toSettings(), properties.getRuntimes(), irObjectMapper);
    }

    @Bean
    public IrLoader irLoader(ObjectMapper irObjectMapper) {
        return new IrLoader(irObjectMapper);
    }

    @Bean
    public IrValidator irValidator() {
        return new IrValidator();
    }
}
