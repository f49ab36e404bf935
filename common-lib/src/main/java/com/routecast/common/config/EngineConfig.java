package com.routecast.common.config;

/**
 * Immutable configuration of the routing engine, passed in at construction.
 *
 * <p>Defaults ({@link #defaults()}):
 * <pre>
 *   lookbackPeriods       4       minPeriodsForSwitch  2
 *   switchThresholdPct    5.0     ensembleSize         3
 *   highCutoffPct         20.0    mediumCutoffPct      50.0
 *   highVarianceCapPct    10.0    mediumVariancePct    25.0
 *   lowVariancePct        50.0    newRouteVariancePct  100.0
 *   zeroActualPenaltyPct  999.0   horizonStep          0.2
 *   varianceMethod        CONFIDENCE
 *   defaultModelId        HISTORICAL_BASELINE
 * </pre>
 *
 * <p>{@code zeroActualPenaltyPct} is the finite error assigned when a model
 * forecast a nonzero quantity for a period in which nothing shipped. It takes part
 * in rolling averages, so its magnitude affects model ranking.
 */
public record EngineConfig(
    int            lookbackPeriods,
    int            minPeriodsForSwitch,
    double         switchThresholdPct,
    int            ensembleSize,
    double         highCutoffPct,
    double         mediumCutoffPct,
    double         highVarianceCapPct,
    double         mediumVariancePct,
    double         lowVariancePct,
    double         newRouteVariancePct,
    double         zeroActualPenaltyPct,
    double         horizonStep,
    VarianceMethod varianceMethod,
    String         defaultModelId
) {

    public static final String DEFAULT_MODEL_ID = "HISTORICAL_BASELINE";

    public EngineConfig {
        require(lookbackPeriods >= 1, "lookbackPeriods must be >= 1");
        require(minPeriodsForSwitch >= 1, "minPeriodsForSwitch must be >= 1");
        require(switchThresholdPct >= 0.0, "switchThresholdPct must be >= 0");
        require(ensembleSize >= 1, "ensembleSize must be >= 1");
        require(highCutoffPct > 0.0 && highCutoffPct < mediumCutoffPct,
                "cutoffs must satisfy 0 < highCutoffPct < mediumCutoffPct");
        require(highVarianceCapPct >= 0.0 && mediumVariancePct >= 0.0
                && lowVariancePct >= 0.0 && newRouteVariancePct >= 0.0,
                "variance percentages must be >= 0");
        require(Double.isFinite(zeroActualPenaltyPct) && zeroActualPenaltyPct > 0.0,
                "zeroActualPenaltyPct must be finite and > 0");
        require(horizonStep >= 0.0, "horizonStep must be >= 0");
        require(varianceMethod != null, "varianceMethod must not be null");
        require(defaultModelId != null && !defaultModelId.isBlank(), "defaultModelId must not be blank");
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .lookbackPeriods(lookbackPeriods)
            .minPeriodsForSwitch(minPeriodsForSwitch)
            .switchThresholdPct(switchThresholdPct)
            .ensembleSize(ensembleSize)
            .highCutoffPct(highCutoffPct)
            .mediumCutoffPct(mediumCutoffPct)
            .highVarianceCapPct(highVarianceCapPct)
            .mediumVariancePct(mediumVariancePct)
            .lowVariancePct(lowVariancePct)
            .newRouteVariancePct(newRouteVariancePct)
            .zeroActualPenaltyPct(zeroActualPenaltyPct)
            .horizonStep(horizonStep)
            .varianceMethod(varianceMethod)
            .defaultModelId(defaultModelId);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static final class Builder {
        private int            lookbackPeriods      = 4;
        private int            minPeriodsForSwitch  = 2;
        private double         switchThresholdPct   = 5.0;
        private int            ensembleSize         = 3;
        private double         highCutoffPct        = 20.0;
        private double         mediumCutoffPct      = 50.0;
        private double         highVarianceCapPct   = 10.0;
        private double         mediumVariancePct    = 25.0;
        private double         lowVariancePct       = 50.0;
        private double         newRouteVariancePct  = 100.0;
        private double         zeroActualPenaltyPct = 999.0;
        private double         horizonStep          = 0.2;
        private VarianceMethod varianceMethod       = VarianceMethod.CONFIDENCE;
        private String         defaultModelId       = DEFAULT_MODEL_ID;

        private Builder() {}

        public Builder lookbackPeriods(int v)          { this.lookbackPeriods = v; return this; }
        public Builder minPeriodsForSwitch(int v)      { this.minPeriodsForSwitch = v; return this; }
        public Builder switchThresholdPct(double v)    { this.switchThresholdPct = v; return this; }
        public Builder ensembleSize(int v)             { this.ensembleSize = v; return this; }
        public Builder highCutoffPct(double v)         { this.highCutoffPct = v; return this; }
        public Builder mediumCutoffPct(double v)       { this.mediumCutoffPct = v; return this; }
        public Builder highVarianceCapPct(double v)    { this.highVarianceCapPct = v; return this; }
        public Builder mediumVariancePct(double v)     { this.mediumVariancePct = v; return this; }
        public Builder lowVariancePct(double v)        { this.lowVariancePct = v; return this; }
        public Builder newRouteVariancePct(double v)   { this.newRouteVariancePct = v; return this; }
        public Builder zeroActualPenaltyPct(double v)  { this.zeroActualPenaltyPct = v; return this; }
        public Builder horizonStep(double v)           { this.horizonStep = v; return this; }
        public Builder varianceMethod(VarianceMethod v){ this.varianceMethod = v; return this; }
        public Builder defaultModelId(String v)        { this.defaultModelId = v; return this; }

        public EngineConfig build() {
            return new EngineConfig(lookbackPeriods, minPeriodsForSwitch, switchThresholdPct, ensembleSize,
                                    highCutoffPct, mediumCutoffPct, highVarianceCapPct, mediumVariancePct,
                                    lowVariancePct, newRouteVariancePct, zeroActualPenaltyPct, horizonStep,
                                    varianceMethod, defaultModelId);
        }
    }
}
