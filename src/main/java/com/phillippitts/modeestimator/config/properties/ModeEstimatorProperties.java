package com.phillippitts.modeestimator.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the mode estimation service.
 *
 * <p>The flag defaults apply only when a request omits the flag; the core estimator itself
 * never reads configuration.
 *
 * <p>Note: Bean created via {@link com.phillippitts.modeestimator.ModeEstimatorApplication}.
 */
@Validated
@ConfigurationProperties(prefix = "mode.estimator")
public class ModeEstimatorProperties {

    /** Drop missing entries before estimating when a request does not say. */
    private final boolean removeMissing;

    /** Accept the first value known to be a mode in modeFirst when a request does not say. */
    private final boolean firstKnown;

    /** Maximum number of values accepted per request (security cap). */
    @Positive
    private final int maxSequenceLength;

    /** Number of values rendered when an input sequence is logged. */
    @PositiveOrZero
    private final int logPreviewLength;

    @ConstructorBinding
    public ModeEstimatorProperties(Boolean removeMissing, Boolean firstKnown, Integer maxSequenceLength,
                                   Integer logPreviewLength) {
        this.removeMissing = removeMissing != null && removeMissing;
        this.firstKnown = firstKnown == null || firstKnown;

        int max = maxSequenceLength == null ? 1_000_000 : maxSequenceLength;
        if (max <= 0) {
            throw new IllegalArgumentException("mode.estimator.max-sequence-length must be positive");
        }
        this.maxSequenceLength = max;

        int preview = logPreviewLength == null ? 20 : logPreviewLength;
        if (preview < 0) {
            throw new IllegalArgumentException("mode.estimator.log-preview-length must be >= 0");
        }
        this.logPreviewLength = preview;
    }

    public boolean isRemoveMissing() {
        return removeMissing;
    }

    public boolean isFirstKnown() {
        return firstKnown;
    }

    public int getMaxSequenceLength() {
        return maxSequenceLength;
    }

    public int getLogPreviewLength() {
        return logPreviewLength;
    }
}
