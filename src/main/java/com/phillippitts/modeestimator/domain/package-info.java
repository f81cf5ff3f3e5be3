/**
 * Domain models representing estimator results.
 *
 * <p>All domain models are immutable records that validate themselves in their
 * compact constructors.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.modeestimator.domain.ModeResult} - Known value, set of modes,
 *       or unknown when missing entries make the answer undeterminable</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.modeestimator.domain;
