package dev.leaddispatch.model;

/**
 * Why an external lookup produced no usable response.
 */
public enum LookupFailure {
    TIMEOUT,
    HTTP_ERROR,
    TRANSPORT,
    MALFORMED_RESPONSE
}
