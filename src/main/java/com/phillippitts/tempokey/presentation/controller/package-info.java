/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.tempokey.presentation.controller.TempoController}
 *       - tempo/key reads by track id, by track descriptor and by ISRC batch; ingest; selection</li>
 *   <li>{@link com.phillippitts.tempokey.presentation.controller.BulkController}
 *       - bulk batch preparation, NDJSON stream read-back and polling</li>
 *   <li>{@link com.phillippitts.tempokey.presentation.controller.AdminController}
 *       - cache invalidation, preview refresh and mismatch review</li>
 * </ul>
 *
 * <p>Controllers only extract parameters, delegate to the service layer and convert results to
 * DTOs. Exceptions are left to {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.tempokey.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.tempokey.presentation.controller;
