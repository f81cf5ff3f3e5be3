package com.phillippitts.modeestimator.service;

import com.phillippitts.modeestimator.config.properties.ModeEstimatorProperties;
import com.phillippitts.modeestimator.core.ModeEstimator;
import com.phillippitts.modeestimator.domain.ModeResult;
import com.phillippitts.modeestimator.exception.ContractViolationException;
import com.phillippitts.modeestimator.exception.SequenceTooLargeException;
import com.phillippitts.modeestimator.service.metrics.ModeMetrics;
import com.phillippitts.modeestimator.util.SequencePreview;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Application-facing entry point to the core {@link ModeEstimator}.
 *
 * <p>Responsibilities on top of the core:
 * <ul>
 *   <li>Resolve omitted flags from {@link ModeEstimatorProperties}</li>
 *   <li>Reject oversized sequences and inapplicable flags</li>
 *   <li>Log estimates and record {@link ModeMetrics}</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
@Service
public class ModeEstimationService {

    private static final Logger LOG = LogManager.getLogger(ModeEstimationService.class);

    private final ModeEstimator estimator;
    private final ModeEstimatorProperties props;
    private final ModeMetrics metrics;

    public ModeEstimationService(ModeEstimator estimator, ModeEstimatorProperties props, ModeMetrics metrics) {
        this.estimator = Objects.requireNonNull(estimator);
        this.props = Objects.requireNonNull(props);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Runs one estimate.
     *
     * @param operation operation to run (must not be null)
     * @param values sequence with {@code null} marking missing entries (must not be null)
     * @param removeMissing drop missing entries first, or null for the configured default
     * @param firstKnown first-known policy for {@link ModeOperation#FIRST}, or null for the
     *                   configured default; must be null for other operations
     * @return estimate, possibly {@link ModeResult.Unknown}
     * @throws ContractViolationException on null arguments, inapplicable flags or mixed element types
     * @throws SequenceTooLargeException if the sequence exceeds the configured maximum
     */
    public <T> ModeResult<T> estimate(ModeOperation operation, List<? extends T> values,
                                      Boolean removeMissing, Boolean firstKnown) {
        try {
            validate(operation, values, firstKnown);
        } catch (ContractViolationException e) {
            metrics.incrementRejected("contract_violation");
            throw e;
        }

        boolean remove = removeMissing == null ? props.isRemoveMissing() : removeMissing;
        boolean first = firstKnown == null ? props.isFirstKnown() : firstKnown;

        long start = System.nanoTime();
        ModeResult<T> result;
        try {
            result = switch (operation) {
                case FIRST -> estimator.modeFirst(values, remove, first);
                case ALL -> estimator.modeAll(values, remove);
                case SINGLE -> estimator.modeSingle(values, remove);
            };
        } catch (ContractViolationException e) {
            metrics.incrementRejected("contract_violation");
            LOG.warn("Rejected {} estimate: {}", operation.tag(), e.getMessage());
            throw e;
        }
        metrics.recordLatency(operation.tag(), System.nanoTime() - start);
        metrics.recordOutcome(operation.tag(), result.isDetermined());

        if (LOG.isDebugEnabled()) {
            LOG.debug("Estimated {} over {}: {}", operation.tag(),
                    SequencePreview.of(values, props.getLogPreviewLength()),
                    result.isDetermined() ? result.values() : SequencePreview.MISSING);
        }
        return result;
    }

    private void validate(ModeOperation operation, List<?> values, Boolean firstKnown) {
        if (operation == null) {
            throw new ContractViolationException("operation", "must not be null");
        }
        if (values == null) {
            throw new ContractViolationException("values", "must not be null");
        }
        if (firstKnown != null && operation != ModeOperation.FIRST) {
            throw new ContractViolationException("firstKnown",
                    "applies only to the first operation, not " + operation.tag());
        }
        if (values.size() > props.getMaxSequenceLength()) {
            metrics.incrementRejected("too_large");
            LOG.warn("Rejected {} estimate: {} values exceed limit {}",
                    operation.tag(), values.size(), props.getMaxSequenceLength());
            throw new SequenceTooLargeException(values.size(), props.getMaxSequenceLength());
        }
    }
}
