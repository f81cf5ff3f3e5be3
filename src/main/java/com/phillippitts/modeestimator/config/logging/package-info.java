/**
 * Logging infrastructure: request-scoped MDC values for Log4j 2 patterns.
 *
 * @see com.phillippitts.modeestimator.config.logging.MdcFilter
 */
package com.phillippitts.modeestimator.config.logging;
