/**
 * Request and response bodies of the REST API. Wire field names are kept stable for existing
 * consumers.
 */
package com.phillippitts.tempokey.presentation.dto;
