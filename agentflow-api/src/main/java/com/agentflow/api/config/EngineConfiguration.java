package com.agentflow.api.config;

import com.agentflow.core.condition.ConditionEvaluator;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.core.repository.StepExecutionRepository;
import com.agentflow.core.repository.WorkflowRepository;
import com.agentflow.core.validation.StepConfigSchemaRegistry;
import com.agentflow.core.validation.WorkflowValidator;
import com.agentflow.engine.execution.EngineSettings;
import com.agentflow.engine.execution.ExecutionEngine;
import com.agentflow.engine.execution.ExecutionPlanCache;
import com.agentflow.engine.health.EngineHealthIndicator;
import com.agentflow.engine.health.StoreProbe;
import com.agentflow.engine.lifecycle.GracefulShutdownHandler;
import com.agentflow.engine.metrics.MetricsConfiguration;
import com.agentflow.engine.persistence.InMemoryExecutionRepository;
import com.agentflow.engine.persistence.InMemoryStepExecutionRepository;
import com.agentflow.engine.persistence.InMemoryWorkflowRepository;
import com.agentflow.engine.persistence.jdbc.JdbcExecutionRepository;
import com.agentflow.engine.persistence.jdbc.JdbcStepExecutionRepository;
import com.agentflow.engine.persistence.jdbc.JdbcStoreProbe;
import com.agentflow.engine.persistence.jdbc.JdbcWorkflowRepository;
import com.agentflow.engine.service.WorkflowManager;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.engine.state.StateManager;
import com.agentflow.engine.state.StoreRetrier;
import com.agentflow.recovery.RecoveryEngine;
import com.agentflow.recovery.RecoveryReport;
import com.agentflow.scheduler.TimerScheduler;
import com.agentflow.worker.HttpStepExecutor;
import com.agentflow.worker.StepExecutorRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Wires the engine: store, state manager, timers, executors, engine, facade and recovery.
 *
 * The store is selected by {@code agentflow.store.type}. The engine stays closed for dispatch
 * until the recovery pass has run on application start.
 */
@Configuration
@Import(MetricsConfiguration.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StoreRetrier storeRetrier(AgentflowProperties properties) {
        return properties.store().retry().toRetrier();
    }

    @Bean
    public EngineSettings engineSettings(AgentflowProperties properties) {
        return properties.engine().toSettings();
    }

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public WorkflowValidator workflowValidator(AgentflowProperties properties, ConditionEvaluator conditions) {
        return new WorkflowValidator(properties.validation().toLimits(),
            StepConfigSchemaRegistry.withDefaults(), conditions);
    }

    @Bean
    public ExecutionPlanCache executionPlanCache(ConditionEvaluator conditions) {
        return new ExecutionPlanCache(conditions);
    }

    @Bean
    public StateManager stateManager(ExecutionRepository executionRepository,
                                     StepExecutionRepository stepRepository,
                                     StoreRetrier retrier,
                                     Clock clock) {
        return new StateManager(executionRepository, stepRepository, retrier, clock);
    }

    @Bean(initMethod = "start")
    public TimerScheduler timerScheduler() {
        return new TimerScheduler();
    }

    @Bean
    public StepExecutorRegistry stepExecutorRegistry(AgentflowProperties properties, ObjectMapper objectMapper) {
        StepExecutorRegistry registry = new StepExecutorRegistry();
        properties.agents().forEach((name, agent) -> {
            if (agent.url() == null) {
                throw new IllegalStateException("agentflow.agents." + name + ".url is required");
            }
            registry.register(name, new HttpStepExecutor(name, agent.url(), agent.connectTimeout(), objectMapper));
        });
        return registry;
    }

    @Bean
    public ExecutionEngine executionEngine(StateManager stateManager,
                                           StepExecutorRegistry executors,
                                           TimerScheduler timers,
                                           ConditionEvaluator conditions,
                                           ExecutionPlanCache plans,
                                           EngineSettings settings,
                                           ObjectMapper objectMapper,
                                           Clock clock) {
        return new ExecutionEngine(stateManager, executors, timers, conditions, plans, settings, objectMapper, clock);
    }

    @Bean
    public WorkflowService workflowService(WorkflowRepository workflowRepository,
                                           ExecutionRepository executionRepository,
                                           StepExecutionRepository stepRepository,
                                           WorkflowValidator validator,
                                           ExecutionEngine engine,
                                           ExecutionPlanCache plans,
                                           EngineSettings settings,
                                           StoreRetrier retrier,
                                           Clock clock) {
        return new WorkflowManager(workflowRepository, executionRepository, stepRepository, validator,
            engine, plans, settings, retrier, clock);
    }

    @Bean(destroyMethod = "stop")
    public RecoveryEngine recoveryEngine(StateManager stateManager, ExecutionEngine engine,
                                         AgentflowProperties properties) {
        return new RecoveryEngine(stateManager, engine, properties.recovery().sweepInterval());
    }

    @Bean
    public EngineHealthIndicator engineHealthIndicator(StoreProbe storeProbe, ExecutionEngine engine) {
        return new EngineHealthIndicator(storeProbe, engine);
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(ExecutionEngine engine, TimerScheduler timers) {
        return new GracefulShutdownHandler(engine, timers);
    }

    @Bean
    public EngineStarter engineStarter(RecoveryEngine recovery, ExecutionEngine engine,
                                       AgentflowProperties properties) {
        return new EngineStarter(recovery, engine, properties.recovery().enabled());
    }

    /**
     * Opens the engine once the application is ready, after the recovery pass when enabled.
     * A failed pass leaves the engine closed, so readiness keeps reporting unavailable.
     */
    public static class EngineStarter {

        private final RecoveryEngine recovery;
        private final ExecutionEngine engine;
        private final boolean recoveryEnabled;

        EngineStarter(RecoveryEngine recovery, ExecutionEngine engine, boolean recoveryEnabled) {
            this.recovery = recovery;
            this.engine = engine;
            this.recoveryEnabled = recoveryEnabled;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void onReady() {
            if (!recoveryEnabled) {
                log.warn("Recovery disabled, opening engine without resuming unfinished executions");
                engine.open();
                return;
            }
            try {
                RecoveryReport report = recovery.start();
                log.info("Engine open after recovery in {} ms", report.duration().toMillis());
            } catch (RuntimeException e) {
                log.error("Recovery pass failed, engine stays closed", e);
            }
        }
    }

    // ========== Store ==========

    @Configuration
    @ConditionalOnProperty(name = "agentflow.store.type", havingValue = "jdbc", matchIfMissing = true)
    public static class JdbcStoreConfiguration {

        @Bean
        public WorkflowRepository workflowRepository(JdbcTemplate jdbcTemplate,
                                                     TransactionTemplate transactionTemplate,
                                                     ObjectMapper objectMapper) {
            return new JdbcWorkflowRepository(jdbcTemplate, transactionTemplate, objectMapper);
        }

        @Bean
        public ExecutionRepository executionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcExecutionRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public StepExecutionRepository stepExecutionRepository(JdbcTemplate jdbcTemplate,
                                                               ObjectMapper objectMapper) {
            return new JdbcStepExecutionRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public StoreProbe storeProbe(JdbcTemplate jdbcTemplate) {
            return new JdbcStoreProbe(jdbcTemplate);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "agentflow.store.type", havingValue = "memory")
    public static class InMemoryStoreConfiguration {

        @Bean
        public InMemoryStepExecutionRepository stepExecutionRepository() {
            return new InMemoryStepExecutionRepository();
        }

        @Bean
        public InMemoryExecutionRepository executionRepository(InMemoryStepExecutionRepository steps) {
            return new InMemoryExecutionRepository(steps);
        }

        @Bean
        public InMemoryWorkflowRepository workflowRepository(InMemoryExecutionRepository executions) {
            return new InMemoryWorkflowRepository(executions);
        }

        @Bean
        public StoreProbe storeProbe() {
            return StoreProbe.inMemory();
        }
    }
}
