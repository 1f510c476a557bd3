package com.eainde.refinement.config;

import com.eainde.refinement.model.OperationMode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable configuration of a refinement run.
 *
 * Built once at startup and passed by reference to every component; nothing in
 * the loop reads configuration from anywhere else.
 *
 * <pre>
 * RefinementSettings settings = RefinementSettings.builder()
 *         .maxIterations(3)
 *         .timeoutMs(300_000)
 *         .sectionLockAfterEdits(2)
 *         .modeThresholds(OperationMode.SEMI_AUTO, new ModeThresholds(0.90, 0.85))
 *         .build();
 * </pre>
 */
@Getter
@ToString
public final class RefinementSettings {

    public static final int    DEFAULT_MAX_ITERATIONS          = 3;
    public static final long   DEFAULT_MAX_TOKENS              = 15_000;
    public static final long   DEFAULT_TIMEOUT_MS              = 300_000;
    public static final int    DEFAULT_SECTION_LOCK_AFTER_EDITS = 2;
    public static final double DEFAULT_PLATEAU_EPSILON         = 0.02;
    public static final int    DEFAULT_MAX_CONCURRENT_REPAIRS  = 3;

    /** Share of the time budget after which a run counts as near exhaustion. */
    public static final double NEAR_EXHAUSTION_RATIO = 0.8;

    private final int maxIterations;
    private final long maxTokens;
    private final long timeoutMs;
    private final int sectionLockAfterEdits;
    private final double plateauEpsilon;
    private final int maxConcurrentRepairs;
    @Getter(AccessLevel.NONE)
    private final Map<OperationMode, ModeThresholds> modeThresholds;

    private RefinementSettings(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.maxTokens = builder.maxTokens;
        this.timeoutMs = builder.timeoutMs;
        this.sectionLockAfterEdits = builder.sectionLockAfterEdits;
        this.plateauEpsilon = builder.plateauEpsilon;
        this.maxConcurrentRepairs = builder.maxConcurrentRepairs;
        this.modeThresholds = Collections.unmodifiableMap(new EnumMap<>(builder.modeThresholds));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RefinementSettings defaults() {
        return builder().build();
    }

    public ModeThresholds thresholdsFor(OperationMode mode) {
        return modeThresholds.get(mode);
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .maxIterations(maxIterations)
                .maxTokens(maxTokens)
                .timeoutMs(timeoutMs)
                .sectionLockAfterEdits(sectionLockAfterEdits)
                .plateauEpsilon(plateauEpsilon)
                .maxConcurrentRepairs(maxConcurrentRepairs);
        modeThresholds.forEach(builder::modeThresholds);
        return builder;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static final class Builder {

        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private long maxTokens = DEFAULT_MAX_TOKENS;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private int sectionLockAfterEdits = DEFAULT_SECTION_LOCK_AFTER_EDITS;
        private double plateauEpsilon = DEFAULT_PLATEAU_EPSILON;
        private int maxConcurrentRepairs = DEFAULT_MAX_CONCURRENT_REPAIRS;
        private final Map<OperationMode, ModeThresholds> modeThresholds = new EnumMap<>(OperationMode.class);

        private Builder() {
            modeThresholds.put(OperationMode.FULL_AUTO, new ModeThresholds(0.85, 0.75));
            modeThresholds.put(OperationMode.SEMI_AUTO, new ModeThresholds(0.90, 0.85));
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxTokens(long maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder sectionLockAfterEdits(int sectionLockAfterEdits) {
            this.sectionLockAfterEdits = sectionLockAfterEdits;
            return this;
        }

        public Builder plateauEpsilon(double plateauEpsilon) {
            this.plateauEpsilon = plateauEpsilon;
            return this;
        }

        public Builder maxConcurrentRepairs(int maxConcurrentRepairs) {
            this.maxConcurrentRepairs = maxConcurrentRepairs;
            return this;
        }

        public Builder modeThresholds(OperationMode mode, ModeThresholds thresholds) {
            if (mode == null || thresholds == null) {
                throw new RefinementConfigurationException("Mode thresholds require a mode and a value");
            }
            this.modeThresholds.put(mode, thresholds);
            return this;
        }

        public RefinementSettings build() {
            if (maxIterations < 1) {
                throw new RefinementConfigurationException("maxIterations must be >= 1, was " + maxIterations);
            }
            if (maxTokens < 1) {
                throw new RefinementConfigurationException("maxTokens must be >= 1, was " + maxTokens);
            }
            if (timeoutMs < 1) {
                throw new RefinementConfigurationException("timeoutMs must be >= 1, was " + timeoutMs);
            }
            if (sectionLockAfterEdits < 1) {
                throw new RefinementConfigurationException(
                        "sectionLockAfterEdits must be >= 1, was " + sectionLockAfterEdits);
            }
            if (plateauEpsilon < 0.0 || plateauEpsilon > 1.0 || Double.isNaN(plateauEpsilon)) {
                throw new RefinementConfigurationException("plateauEpsilon must be within [0, 1], was " + plateauEpsilon);
            }
            if (maxConcurrentRepairs < 1) {
                throw new RefinementConfigurationException(
                        "maxConcurrentRepairs must be >= 1, was " + maxConcurrentRepairs);
            }
            for (OperationMode mode : OperationMode.values()) {
                if (!modeThresholds.containsKey(mode)) {
                    throw new RefinementConfigurationException("Missing thresholds for mode " + mode.wireName());
                }
            }
            return new RefinementSettings(this);
        }
    }
}
