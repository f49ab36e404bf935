package com.routecast.common.ensemble;

import com.routecast.common.model.Period;
import com.routecast.common.model.RollingError;
import com.routecast.common.model.Route;
import com.routecast.common.model.RouteObservation;
import com.routecast.common.provider.ForecastAttempt;
import com.routecast.common.provider.ModelInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Blends the top-K historically best models of a route into one forecast.
 *
 * <ol>
 *   <li>Take the first {@code ensembleSize} real models of the route's rolling ranking;
 *       earlier {@code ENSEMBLE_n} entries are skipped.</li>
 *   <li>Invoke each; keep only OK values (exceptions, NaN, infinite and negative
 *       values are excluded, never averaged in as zero).</li>
 *   <li>Emit the arithmetic mean under the synthetic id {@code ENSEMBLE_n}.</li>
 *   <li>If every member fails, fall back to the assigned model's own forecast.</li>
 * </ol>
 */
public class EnsembleFallback {

    private static final Logger log = LoggerFactory.getLogger(EnsembleFallback.class);

    private final ModelInvoker invoker;
    private final int ensembleSize;

    public EnsembleFallback(ModelInvoker invoker, int ensembleSize) {
        if (ensembleSize < 1) {
            throw new IllegalArgumentException("ensembleSize must be >= 1, got " + ensembleSize);
        }
        this.invoker      = invoker;
        this.ensembleSize = ensembleSize;
    }

    /**
     * @param ranking         the route's rolling ranking, best first
     * @param assignedModelId the route's assigned model, used when every member fails
     */
    public EnsembleResult blend(Route route, List<RollingError> ranking, String assignedModelId,
                                List<RouteObservation> history, Period target) {
        List<String> contributors = new ArrayList<>();
        double sum = 0.0;
        List<RollingError> members = ranking.stream()
            .filter(r -> !ModelInvoker.isEnsembleId(r.modelId()))
            .limit(ensembleSize)
            .toList();
        for (RollingError member : members) {
            ForecastAttempt attempt = invoker.invoke(member.modelId(), route, history, target);
            if (attempt.isValid()) {
                contributors.add(member.modelId());
                sum += attempt.value();
            }
        }
        if (!contributors.isEmpty()) {
            double mean = sum / contributors.size();
            log.debug("ENSEMBLE_BLENDED route={} period={} members={} forecast={}",
                      route, target, contributors, mean);
            return new EnsembleResult(ModelInvoker.ensembleId(contributors.size()), mean,
                                      List.copyOf(contributors), false);
        }

        log.warn("ENSEMBLE_EMPTY route={} period={} - falling back to assigned model {}",
                 route, target, assignedModelId);
        if (assignedModelId == null) {
            return EnsembleResult.failed();
        }
        ForecastAttempt fallback = invoker.invoke(assignedModelId, route, history, target);
        if (!fallback.hasUsableValue()) {
            return EnsembleResult.failed();
        }
        return new EnsembleResult(assignedModelId, fallback.clampedValue(), List.of(assignedModelId), true);
    }
}
