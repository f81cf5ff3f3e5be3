/**
 * Presentation layer: REST controllers and HTTP error mapping.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code /api/mode/*} endpoints</li>
 *   <li>{@code presentation.exception} - Domain exception to HTTP status mapping</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.modeestimator.presentation;
