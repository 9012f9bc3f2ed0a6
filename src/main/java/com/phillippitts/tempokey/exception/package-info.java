/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.tempokey.exception.TempoKeyException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.tempokey.exception.InvalidRequestException} - Bad or missing
 *       caller input; never cached</li>
 *   <li>{@link com.phillippitts.tempokey.exception.ProviderUnavailableException} - One preview
 *       provider failed; converted into a failed candidate by the resolver</li>
 *   <li>{@link com.phillippitts.tempokey.exception.DetectionUnavailableException} - The
 *       estimation service failed; retryable, never replaced by a synthesized value</li>
 *   <li>{@link com.phillippitts.tempokey.exception.TrackNotFoundException} - Unknown track or
 *       missing record</li>
 *   <li>{@link com.phillippitts.tempokey.exception.PermissionDeniedException} - Caller lacks a
 *       required role</li>
 * </ul>
 *
 * <p>"No preview found" and "identity mismatch" are not exceptions; they are states carried by
 * {@link com.phillippitts.tempokey.domain.ResolutionStatus}.
 *
 * @see com.phillippitts.tempokey.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.tempokey.exception;
