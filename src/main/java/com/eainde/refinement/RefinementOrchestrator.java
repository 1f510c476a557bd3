package com.eainde.refinement;

import com.eainde.refinement.batch.MergedTask;
import com.eainde.refinement.batch.TaskBatcher;
import com.eainde.refinement.budget.BudgetMonitor;
import com.eainde.refinement.budget.BudgetStatus;
import com.eainde.refinement.config.ModeThresholds;
import com.eainde.refinement.config.RefinementConfigurationException;
import com.eainde.refinement.config.RefinementSettings;
import com.eainde.refinement.convergence.ConvergenceSignal;
import com.eainde.refinement.convergence.ConvergenceTracker;
import com.eainde.refinement.dispatch.RepairDispatcher;
import com.eainde.refinement.dispatch.RepairOutcome;
import com.eainde.refinement.event.RefinementEvent;
import com.eainde.refinement.event.RefinementEventListener;
import com.eainde.refinement.lock.LockReason;
import com.eainde.refinement.lock.SectionLockRegistry;
import com.eainde.refinement.model.Document;
import com.eainde.refinement.model.OperationMode;
import com.eainde.refinement.model.RefinementPlan;
import com.eainde.refinement.model.RefinementTask;
import com.eainde.refinement.status.BestEffortResult;
import com.eainde.refinement.status.BestEffortSelector;
import com.eainde.refinement.status.RefinementStatus;
import com.eainde.refinement.status.StatusResolver;
import com.eainde.refinement.status.TerminationReason;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs the targeted refinement loop over one document.
 *
 * <h3>Per iteration:</h3>
 * <pre>
 * batch      tasks of unlocked sections, merged per section, critical first
 * dispatch   one concurrent repair + verification per section, joined
 * apply      verified content replaces the section (new Document instance)
 * score      mean of each target section's latest verified score
 * lock       edit counter per dispatched section; regression locks immediately
 * budget     token overrun warns once; time is checked before the next batch
 * </pre>
 *
 * <h3>Stops when:</h3>
 * <ul>
 *   <li>the aggregate reaches the mode's accept threshold ({@code converged})</li>
 *   <li>every target section is locked ({@code all_sections_locked})</li>
 *   <li>{@code maxIterations} iterations ran ({@code max_iterations})</li>
 *   <li>the time budget is spent ({@code timeout})</li>
 * </ul>
 *
 * <h3>Usage:</h3>
 * <pre>
 * RefinementResult result = orchestrator.refine(document, plan, event -&gt; ui.push(event));
 * if (result.status() == RefinementStatus.ESCALATED) { ... }
 * </pre>
 *
 * A {@link RefinementConfigurationException} for malformed input is the only
 * exception this class throws; failed repairs end up in the result instead.
 */
@Log4j2
@Component
public class RefinementOrchestrator {

    public static final String MDC_RUN_ID = "refinementRunId";
    public static final String MDC_ITERATION = "iteration";

    private final RefinementSettings settings;
    private final RepairDispatcher dispatcher;
    private final Clock clock;
    private final TaskBatcher batcher = new TaskBatcher();
    private final BudgetMonitor budgetMonitor;
    private final StatusResolver statusResolver;
    private final BestEffortSelector bestEffortSelector = new BestEffortSelector();

    public RefinementOrchestrator(RefinementSettings settings, RepairDispatcher dispatcher, Clock clock) {
        this.settings = settings;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.budgetMonitor = new BudgetMonitor(settings);
        this.statusResolver = new StatusResolver(settings);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public RefinementResult refine(Document document, RefinementPlan plan) {
        return refine(document, plan, RefinementEventListener.NO_OP);
    }

    /**
     * @param document initial document
     * @param plan     accepted tasks, mode and baseline score
     * @param listener receives progress events; may be null
     * @throws RefinementConfigurationException for malformed input
     */
    public RefinementResult refine(Document document, RefinementPlan plan, RefinementEventListener listener) {
        validate(document, plan);
        RefinementEventListener events = listener != null ? listener : RefinementEventListener.NO_OP;

        MDC.put(MDC_RUN_ID, UUID.randomUUID().toString().substring(0, 8));
        try {
            return run(new RunState(document, plan, events));
        } finally {
            MDC.remove(MDC_ITERATION);
            MDC.remove(MDC_RUN_ID);
        }
    }

    // =========================================================================
    //  Loop
    // =========================================================================

    private RefinementResult run(RunState state) {
        RefinementPlan plan = state.plan;
        ModeThresholds thresholds = settings.thresholdsFor(plan.operationMode());
        List<String> targets = new ArrayList<>(plan.targetSections());

        log.info("Refinement started — {} tasks on {} sections, mode={}, baseline={}",
                plan.tasks().size(), targets.size(), plan.operationMode().wireName(), plan.initialScore());
        emit(state, new RefinementEvent.RefinementStarted(targets, plan.operationMode()));

        if (plan.isEmpty()) {
            return finishTrivial(state);
        }

        SectionLockRegistry locks = new SectionLockRegistry(targets, settings.getSectionLockAfterEdits());
        ConvergenceTracker tracker = new ConvergenceTracker(settings.getPlateauEpsilon(), plan.initialScore());
        targets.forEach(id -> state.sectionScores.put(id, plan.initialScore()));

        ConvergenceSignal signal = ConvergenceSignal.none();
        TerminationReason reason;

        while (true) {
            if (state.iteration >= settings.getMaxIterations()) {
                reason = TerminationReason.MAX_ITERATIONS;
                break;
            }
            if (!budgetMonitor.hasTimeLeft(state.elapsedMs())) {
                log.warn("Time budget of {}ms spent after {} iterations", settings.getTimeoutMs(), state.iteration);
                reason = TerminationReason.TIMEOUT;
                break;
            }
            List<MergedTask> batch = batcher.partition(plan.tasks(), locks, state.document);
            if (batch.isEmpty()) {
                reason = TerminationReason.ALL_SECTIONS_LOCKED;
                break;
            }

            int iteration = state.iteration + 1;
            MDC.put(MDC_ITERATION, String.valueOf(iteration));
            IterationRecord record = runIteration(state, iteration, batch);
            state.iteration = iteration;

            // Locks: one attempt per dispatched section, then regressions
            for (RepairOutcome outcome : record.outcomes()) {
                if (locks.recordAttempt(outcome.sectionId())) {
                    emit(state, new RefinementEvent.SectionLocked(outcome.sectionId(), LockReason.MAX_EDITS));
                }
            }
            signal = tracker.update(state.history);
            for (String sectionId : signal.regressedSections()) {
                if (locks.lockForRegression(sectionId)) {
                    emit(state, new RefinementEvent.SectionLocked(sectionId, LockReason.REGRESSION));
                }
            }

            log.info("Iteration {} complete — score={}, tokens={}, locked={}",
                    iteration, record.aggregateScore(), record.tokensUsed(), locks.lockedSections());
            emit(state, new RefinementEvent.IterationCompleted(iteration, record.aggregateScore()));
            emit(state, new RefinementEvent.BatchCompleted(iteration));
            MDC.remove(MDC_ITERATION);

            checkTokenBudget(state);

            if (locks.allLocked()) {
                reason = TerminationReason.ALL_SECTIONS_LOCKED;
                break;
            }
            if (thresholds.accepts(record.aggregateScore())) {
                reason = TerminationReason.CONVERGED;
                break;
            }
        }

        return finish(state, reason, signal, locks);
    }

    private IterationRecord runIteration(RunState state, int iteration, List<MergedTask> batch) {
        List<String> sections = batch.stream().map(MergedTask::sectionId).toList();
        emit(state, new RefinementEvent.BatchStarted(iteration, sections));
        log.info("Iteration {} — dispatching {} sections: {}", iteration, batch.size(), sections);

        long iterationStart = clock.millis();
        List<RepairOutcome> outcomes = dispatcher.dispatchBatch(batch, state.document);

        // Apply on the orchestrator thread, after the whole batch has joined
        long tokens = 0;
        for (RepairOutcome outcome : outcomes) {
            tokens += outcome.tokensUsed();
            if (outcome.success()) {
                state.document = state.document.withSectionContent(outcome.sectionId(), outcome.content());
                state.sectionScores.put(outcome.sectionId(), outcome.score());
                state.latestSuccess.put(outcome.sectionId(), outcome);
            }
        }
        state.tokensUsed += tokens;

        IterationRecord record = new IterationRecord(
                iteration,
                aggregate(state.sectionScores),
                outcomes,
                tokens,
                clock.millis() - iterationStart,
                state.document);
        state.history.add(record);

        for (RepairOutcome outcome : outcomes) {
            emit(state, new RefinementEvent.VerificationResult(
                    outcome.sectionId(), outcome.action(), outcome.success(), outcome.score()));
        }
        return record;
    }

    private void checkTokenBudget(RunState state) {
        BudgetStatus budget = budgetMonitor.check(state.tokensUsed, state.elapsedMs());
        if (budget.tokenWarning() && !state.budgetWarned) {
            state.budgetWarned = true;
            log.warn("Token budget exceeded (advisory) — used {} of {}, continuing",
                    state.tokensUsed, budgetMonitor.getMaxTokens());
            emit(state, new RefinementEvent.BudgetWarning(state.tokensUsed, budgetMonitor.getMaxTokens()));
        }
    }

    // =========================================================================
    //  Terminal
    // =========================================================================

    private RefinementResult finish(RunState state, TerminationReason reason,
                                    ConvergenceSignal signal, SectionLockRegistry locks) {
        RefinementPlan plan = state.plan;
        double finalScore = state.history.isEmpty()
                ? plan.initialScore()
                : state.history.get(state.history.size() - 1).aggregateScore();
        BudgetStatus budget = budgetMonitor.check(state.tokensUsed, state.elapsedMs());

        ModeThresholds thresholds = settings.thresholdsFor(plan.operationMode());
        RefinementStatus status = statusResolver.resolve(
                finalScore, plan.operationMode(), reason, signal.plateaued(), budget.nearExhaustion());
        List<RefinementTask> unresolved = unresolvedTasks(state);

        Document content = state.document;
        BestEffortResult bestEffort = null;
        if (status == RefinementStatus.BEST_EFFORT && plan.operationMode() == OperationMode.FULL_AUTO) {
            bestEffort = bestEffortSelector.select(state.history, unresolved, thresholds).orElse(null);
            if (bestEffort != null) {
                content = bestEffort.document();
                finalScore = bestEffort.bestScore();
                // Status must describe the score that is returned
                RefinementStatus selectedStatus = statusResolver.resolve(
                        finalScore, plan.operationMode(), reason, signal.plateaued(), budget.nearExhaustion());
                if (selectedStatus != status) {
                    log.info("Best-effort iteration {} scores {} — status {} -> {}",
                            bestEffort.selectedIteration(), finalScore, status.wireName(), selectedStatus.wireName());
                    status = selectedStatus;
                }
            }
        }

        if (status == RefinementStatus.ESCALATED) {
            int unresolvedIssues = unresolved.stream().mapToInt(t -> t.sourceIssues().size()).sum();
            log.info("Escalation triggered — reason={}, score={}, goodEnough={}: requires human review",
                    reason.wireName(), finalScore, thresholds.goodEnoughThreshold());
            emit(state, new RefinementEvent.EscalationTriggered(
                    reason, finalScore, thresholds.goodEnoughThreshold(), unresolvedIssues));
        }

        emit(state, new RefinementEvent.RefinementCompleted(finalScore, status, state.iteration, reason));

        long durationMs = state.elapsedMs();
        log.info("Refinement complete — status={}, reason={}, score={}, iterations={}, tokens={}, duration={}ms",
                status.wireName(), reason.wireName(), finalScore, state.iteration, state.tokensUsed, durationMs);

        return new RefinementResult(
                content,
                status,
                state.iteration,
                state.tokensUsed,
                durationMs,
                finalScore,
                reason,
                state.history,
                locks.lockedSections(),
                unresolved,
                bestEffort);
    }

    /**
     * Empty plan: nothing to repair, one no-op iteration scored 1.0.
     */
    private RefinementResult finishTrivial(RunState state) {
        state.iteration = 1;
        IterationRecord record = new IterationRecord(1, 1.0, List.of(), 0, 0, state.document);
        state.history.add(record);
        emit(state, new RefinementEvent.IterationCompleted(1, 1.0));
        emit(state, new RefinementEvent.RefinementCompleted(
                1.0, RefinementStatus.ACCEPTED, 1, TerminationReason.NO_TASKS));

        log.info("Refinement complete — no tasks, document accepted as-is");
        return new RefinementResult(
                state.document,
                RefinementStatus.ACCEPTED,
                1,
                0,
                state.elapsedMs(),
                1.0,
                TerminationReason.NO_TASKS,
                state.history,
                Set.of(),
                List.of(),
                null);
    }

    // =========================================================================
    //  Internal Helpers
    // =========================================================================

    private void validate(Document document, RefinementPlan plan) {
        if (document == null) {
            throw new RefinementConfigurationException("Document is required");
        }
        if (plan == null) {
            throw new RefinementConfigurationException("Refinement plan is required");
        }
        for (RefinementTask task : plan.tasks()) {
            if (!document.contains(task.sectionId())) {
                throw new RefinementConfigurationException("Task targets unknown section: " + task.sectionId());
            }
        }
    }

    /**
     * A task is unresolved while its section has no verified repair, or the
     * latest verified repair still reports remaining issues.
     */
    private List<RefinementTask> unresolvedTasks(RunState state) {
        return state.plan.tasks().stream()
                .filter(task -> {
                    RepairOutcome latest = state.latestSuccess.get(task.sectionId());
                    return latest == null || latest.issuesRemaining() > 0;
                })
                .toList();
    }

    private static double aggregate(Map<String, Double> sectionScores) {
        return sectionScores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private void emit(RunState state, RefinementEvent event) {
        try {
            state.listener.onEvent(event);
        } catch (Exception e) {
            log.warn("Refinement event listener failed on {} — ignoring: {}",
                    event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    /**
     * Mutable bookkeeping of one run. Touched by the orchestrator thread only.
     */
    private final class RunState {

        final RefinementPlan plan;
        final RefinementEventListener listener;
        final long startMs;
        final List<IterationRecord> history = new ArrayList<>();
        final Map<String, Double> sectionScores = new LinkedHashMap<>();
        final Map<String, RepairOutcome> latestSuccess = new HashMap<>();
        Document document;
        int iteration;
        long tokensUsed;
        boolean budgetWarned;

        RunState(Document document, RefinementPlan plan, RefinementEventListener listener) {
            this.document = document;
            this.plan = plan;
            this.listener = listener;
            this.startMs = clock.millis();
        }

        long elapsedMs() {
            return clock.millis() - startMs;
        }
    }
}
