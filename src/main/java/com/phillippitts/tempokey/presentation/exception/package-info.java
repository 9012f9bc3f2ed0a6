/**
 * Translation of domain exceptions into JSON error bodies and HTTP status codes.
 *
 * @since 1.0
 */
package com.phillippitts.tempokey.presentation.exception;
