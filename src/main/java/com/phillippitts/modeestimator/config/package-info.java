/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.modeestimator.config.ModeEstimatorConfig} - Core estimator bean</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code mode.estimator.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.modeestimator.config;
