package com.eainde.refinement.dispatch;

import com.eainde.refinement.batch.MergedTask;
import com.eainde.refinement.config.RefinementConfigurationException;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.RefinementAction;
import com.eainde.refinement.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Routes merged tasks to a repair strategy, verifies the result, and fans a
 * whole batch out over a bounded executor.
 *
 * <h3>Failure handling</h3>
 * Everything a strategy or the verifier can do wrong (throw, report
 * {@code success=false}, return blank text, score outside [0, 1]) becomes a failed
 * {@link RepairOutcome} carrying the section's prior content. Only a
 * {@link RefinementConfigurationException} escapes to the caller.
 *
 * <pre>
 * RepairDispatcher dispatcher = new RepairDispatcher(editStrategy, regenerationStrategy, verifier, executor);
 * List&lt;RepairOutcome&gt; outcomes = dispatcher.dispatchBatch(batch, document);
 * </pre>
 */
public class RepairDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RepairDispatcher.class);

    private final Map<RefinementAction, RepairStrategy> strategies;
    private final SectionVerifier verifier;
    private final Executor executor;

    public RepairDispatcher(SurgicalEditStrategy surgicalEditStrategy,
                            RegenerationStrategy regenerationStrategy,
                            SectionVerifier verifier,
                            Executor executor) {
        this(strategyTable(surgicalEditStrategy, regenerationStrategy), verifier, executor);
    }

    RepairDispatcher(Map<RefinementAction, RepairStrategy> strategies,
                     SectionVerifier verifier,
                     Executor executor) {
        if (verifier == null || executor == null) {
            throw new RefinementConfigurationException("RepairDispatcher requires a verifier and an executor");
        }
        EnumMap<RefinementAction, RepairStrategy> table = new EnumMap<>(RefinementAction.class);
        table.putAll(strategies);
        for (RefinementAction action : RefinementAction.values()) {
            if (table.get(action) == null) {
                throw new RefinementConfigurationException("No repair strategy registered for " + action);
            }
        }
        this.strategies = Collections.unmodifiableMap(table);
        this.verifier = verifier;
        this.executor = executor;
    }

    // =========================================================================
    //  Batch
    // =========================================================================

    /**
     * Runs every merged task concurrently and waits for all of them.
     *
     * @return one outcome per task, in batch order
     * @throws RefinementConfigurationException if any worker hit a configuration error
     */
    public List<RepairOutcome> dispatchBatch(List<MergedTask> batch, Document document) {
        List<CompletableFuture<RepairOutcome>> futures = new ArrayList<>(batch.size());
        for (MergedTask task : batch) {
            futures.add(submit(task, document));
        }

        // Wait for every worker before looking at individual results
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(e -> null)
                .join();

        List<RepairOutcome> outcomes = new ArrayList<>(batch.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(collect(futures.get(i), batch.get(i), document));
        }
        return outcomes;
    }

    // =========================================================================
    //  Single task
    // =========================================================================

    /**
     * Repairs and verifies one merged task on the calling thread.
     */
    public RepairOutcome dispatch(MergedTask task, Document document) {
        Section section = document.section(task.sectionId())
                .orElseThrow(() -> new RefinementConfigurationException(
                        "Task targets unknown section: " + task.sectionId()));
        long start = System.nanoTime();

        RepairResult result;
        try {
            result = strategies.get(task.action()).repair(task, section, document);
        } catch (RefinementConfigurationException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Repair of section {} ({}) threw: {}", task.sectionId(), task.action(), e.getMessage(), e);
            return RepairOutcome.failed(task.sectionId(), task.action(), section.content(),
                    0, elapsedMs(start), describe(e));
        }

        if (result == null) {
            log.warn("Repair of section {} ({}) returned no result", task.sectionId(), task.action());
            return RepairOutcome.failed(task.sectionId(), task.action(), section.content(),
                    0, elapsedMs(start), "Strategy returned no result");
        }
        long repairTokens = Math.max(0, result.tokensUsed());
        if (!result.success()) {
            log.warn("Repair of section {} ({}) failed: {}", task.sectionId(), task.action(), result.errorMessage());
            return RepairOutcome.failed(task.sectionId(), task.action(), section.content(),
                    repairTokens, elapsedMs(start),
                    result.errorMessage() != null ? result.errorMessage() : "Strategy reported failure");
        }
        if (result.content() == null || result.content().isBlank()) {
            log.warn("Repair of section {} ({}) returned blank content", task.sectionId(), task.action());
            return RepairOutcome.failed(task.sectionId(), task.action(), section.content(),
                    repairTokens, elapsedMs(start), "Strategy returned blank content");
        }

        VerificationResult verification;
        try {
            verification = verifier.verify(task.issues(), result.content());
        } catch (RefinementConfigurationException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Verification of section {} threw: {}", task.sectionId(), e.getMessage(), e);
            return RepairOutcome.failed(task.sectionId(), task.action(), section.content(),
                    repairTokens, elapsedMs(start), "Verification failed: " + describe(e));
        }
        if (verification == null || !verification.hasValidScore()) {
            log.warn("Verification of section {} returned an invalid score: {}", task.sectionId(), verification);
            long verifierTokens = verification != null ? Math.max(0, verification.tokensUsed()) : 0;
            return RepairOutcome.failed(task.sectionId(), task.action(), section.content(),
                    repairTokens + verifierTokens, elapsedMs(start), "Verification returned an invalid score");
        }

        RepairOutcome outcome = new RepairOutcome(
                task.sectionId(),
                task.action(),
                true,
                result.content(),
                repairTokens + Math.max(0, verification.tokensUsed()),
                elapsedMs(start),
                verification.score(),
                verification.issuesResolved(),
                verification.issuesRemaining(),
                result.diffSummary(),
                null);
        log.debug("Section {} repaired via {}: score={}, tokens={}",
                task.sectionId(), task.action(), outcome.score(), outcome.tokensUsed());
        return outcome;
    }

    // =========================================================================
    //  Internal Helpers
    // =========================================================================

    private CompletableFuture<RepairOutcome> submit(MergedTask task, Document document) {
        try {
            return CompletableFuture.supplyAsync(() -> dispatch(task, document), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Repair of section {} could not be scheduled: {}", task.sectionId(), e.getMessage());
            return CompletableFuture.completedFuture(RepairOutcome.failed(task.sectionId(), task.action(),
                    currentContent(task, document), 0, 0, "Repair could not be scheduled"));
        }
    }

    private RepairOutcome collect(CompletableFuture<RepairOutcome> future, MergedTask task, Document document) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RefinementConfigurationException configError) {
                throw configError;
            }
            log.warn("Worker for section {} failed: {}", task.sectionId(), cause.getMessage(), cause);
            return RepairOutcome.failed(task.sectionId(), task.action(), currentContent(task, document),
                    0, 0, describe(cause));
        }
    }

    private static Map<RefinementAction, RepairStrategy> strategyTable(SurgicalEditStrategy surgicalEditStrategy,
                                                                      RegenerationStrategy regenerationStrategy) {
        if (surgicalEditStrategy == null || regenerationStrategy == null) {
            throw new RefinementConfigurationException("Both repair strategies are required");
        }
        Map<RefinementAction, RepairStrategy> table = new EnumMap<>(RefinementAction.class);
        table.put(RefinementAction.SURGICAL_EDIT, new SurgicalEditAdapter(surgicalEditStrategy));
        table.put(RefinementAction.REGENERATE_SECTION, new RegenerationAdapter(regenerationStrategy));
        return table;
    }

    private static String currentContent(MergedTask task, Document document) {
        return document.section(task.sectionId()).map(Section::content).orElse("");
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
