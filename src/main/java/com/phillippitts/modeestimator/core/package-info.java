/**
 * Ambiguity-aware mode estimation over sequences with missing entries.
 *
 * <p>Dependency order:
 * <ul>
 *   <li>{@link com.phillippitts.modeestimator.core.FrequencyTable} - distinct-value counts in
 *       first-appearance order, with missing entries counted separately</li>
 *   <li>{@link com.phillippitts.modeestimator.core.AmbiguityResolver} - worst-case check of a
 *       candidate against missing values</li>
 *   <li>{@link com.phillippitts.modeestimator.core.ModeEstimator} - {@code modeFirst},
 *       {@code modeAll} and {@code modeSingle}</li>
 * </ul>
 *
 * <p>This package has no Spring dependencies and performs no I/O. All operations are pure.
 *
 * @since 1.0
 */
package com.phillippitts.modeestimator.core;
