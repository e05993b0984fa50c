package com.motif.integration.service.pipeline;

/**
 * Lifecycle of one annotation request.
 */
public enum AnnotationStatus {
    AWAITING_READINESS,
    ANNOTATION_READY,
    SUCCESS,
    FAILURE
}
