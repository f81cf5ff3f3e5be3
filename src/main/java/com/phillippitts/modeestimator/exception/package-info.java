/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.modeestimator.exception.ModeEstimatorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.modeestimator.exception.ContractViolationException} - Thrown when
 *       a caller passes a null sequence, null options, or an inapplicable flag</li>
 *   <li>{@link com.phillippitts.modeestimator.exception.IncomparableElementsException} - Thrown when
 *       a sequence mixes element types that cannot be compared by equality</li>
 *   <li>{@link com.phillippitts.modeestimator.exception.SequenceTooLargeException} - Thrown when
 *       a request carries more values than the configured limit</li>
 * </ul>
 *
 * <p>An undetermined mode is not an error. Operations return
 * {@link com.phillippitts.modeestimator.domain.ModeResult#unknown()} for empty input,
 * all-missing input, or ties that missing values could break.
 *
 * @see com.phillippitts.modeestimator.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.modeestimator.exception;
