/**
 * Service layer wrapping the core estimator.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.metrics} - Micrometer instrumentation of estimates</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans ({@code @Service}, {@code @Component})</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @see com.phillippitts.modeestimator.service.ModeEstimationService
 * @since 1.0
 */
package com.phillippitts.modeestimator.service;
