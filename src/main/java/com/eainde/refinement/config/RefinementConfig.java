package com.eainde.refinement.config;

import com.eainde.refinement.RefinementOrchestrator;
import com.eainde.refinement.dispatch.RegenerationStrategy;
import com.eainde.refinement.dispatch.RepairDispatcher;
import com.eainde.refinement.dispatch.SectionVerifier;
import com.eainde.refinement.dispatch.SurgicalEditStrategy;
import com.eainde.refinement.event.LoggingEventListener;
import com.eainde.refinement.llm.ClasspathPromptService;
import com.eainde.refinement.llm.LlmRegenerationStrategy;
import com.eainde.refinement.llm.LlmSectionVerifier;
import com.eainde.refinement.llm.LlmSurgicalEditStrategy;
import com.eainde.refinement.llm.PromptService;
import com.eainde.refinement.model.OperationMode;
import com.eainde.refinement.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring wiring of the refinement loop.
 *
 * <p>The host application supplies a langchain4j {@link ChatModel}; everything
 * else is built here from {@code refinement.*} properties:</p>
 * <pre>
 * refinement.max-iterations=3
 * refinement.max-tokens=15000
 * refinement.timeout-ms=300000
 * refinement.section-lock-after-edits=2
 * refinement.plateau-epsilon=0.02
 * refinement.max-concurrent-repairs=3
 * refinement.modes.full-auto.accept-threshold=0.85
 * refinement.modes.full-auto.good-enough-threshold=0.75
 * refinement.modes.semi-auto.accept-threshold=0.90
 * refinement.modes.semi-auto.good-enough-threshold=0.85
 * </pre>
 */
@Log4j2
@Configuration
@Import(RefinementOrchestrator.class)
public class RefinementConfig {

    // ── Limits ──────────────────────────────────────────────────────────

    @Value("${refinement.max-iterations:3}")
    private int maxIterations;

    @Value("${refinement.max-tokens:15000}")
    private long maxTokens;

    @Value("${refinement.timeout-ms:300000}")
    private long timeoutMs;

    @Value("${refinement.section-lock-after-edits:2}")
    private int sectionLockAfterEdits;

    @Value("${refinement.plateau-epsilon:0.02}")
    private double plateauEpsilon;

    @Value("${refinement.max-concurrent-repairs:3}")
    private int maxConcurrentRepairs;

    // ── Mode thresholds ─────────────────────────────────────────────────

    @Value("${refinement.modes.full-auto.accept-threshold:0.85}")
    private double fullAutoAcceptThreshold;

    @Value("${refinement.modes.full-auto.good-enough-threshold:0.75}")
    private double fullAutoGoodEnoughThreshold;

    @Value("${refinement.modes.semi-auto.accept-threshold:0.90}")
    private double semiAutoAcceptThreshold;

    @Value("${refinement.modes.semi-auto.good-enough-threshold:0.85}")
    private double semiAutoGoodEnoughThreshold;

    // =========================================================================
    //  Core
    // =========================================================================

    @Bean
    public RefinementSettings refinementSettings() {
        RefinementSettings settings = RefinementSettings.builder()
                .maxIterations(maxIterations)
                .maxTokens(maxTokens)
                .timeoutMs(timeoutMs)
                .sectionLockAfterEdits(sectionLockAfterEdits)
                .plateauEpsilon(plateauEpsilon)
                .maxConcurrentRepairs(maxConcurrentRepairs)
                .modeThresholds(OperationMode.FULL_AUTO,
                        new ModeThresholds(fullAutoAcceptThreshold, fullAutoGoodEnoughThreshold))
                .modeThresholds(OperationMode.SEMI_AUTO,
                        new ModeThresholds(semiAutoAcceptThreshold, semiAutoGoodEnoughThreshold))
                .build();
        log.info("Refinement settings: {}", settings);
        return settings;
    }

    /**
     * Bounded pool for concurrent section repairs. Shut down with the context.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService refinementRepairPool(RefinementSettings settings) {
        return Executors.newFixedThreadPool(settings.getMaxConcurrentRepairs(),
                new CustomizableThreadFactory("refinement-repair-"));
    }

    @Bean
    public Clock refinementClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RepairDispatcher repairDispatcher(SurgicalEditStrategy surgicalEditStrategy,
                                             RegenerationStrategy regenerationStrategy,
                                             SectionVerifier sectionVerifier,
                                             ExecutorService refinementRepairPool) {
        return new RepairDispatcher(surgicalEditStrategy, regenerationStrategy, sectionVerifier,
                new MdcAwareExecutor(refinementRepairPool));
    }

    @Bean
    public LoggingEventListener loggingEventListener(ObjectProvider<ObjectMapper> objectMapper) {
        return new LoggingEventListener(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    // =========================================================================
    //  Language-model collaborators
    // =========================================================================

    @Bean
    public PromptService refinementPromptService() {
        return new ClasspathPromptService();
    }

    @Bean
    public SurgicalEditStrategy surgicalEditStrategy(ChatModel chatModel, PromptService refinementPromptService) {
        return new LlmSurgicalEditStrategy(chatModel, refinementPromptService);
    }

    @Bean
    public RegenerationStrategy regenerationStrategy(ChatModel chatModel, PromptService refinementPromptService) {
        return new LlmRegenerationStrategy(chatModel, refinementPromptService);
    }

    @Bean
    public SectionVerifier sectionVerifier(ChatModel chatModel,
                                           PromptService refinementPromptService,
                                           ObjectProvider<ObjectMapper> objectMapper) {
        return new LlmSectionVerifier(chatModel, refinementPromptService, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
