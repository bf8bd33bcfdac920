package com.github.dimitryivaniuta.governance.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String SUBJECT_MDC_KEY = "subject";

    /** Request attribute holding the {@code AdmissionResult} of an admitted request. */
    public static final String ADMISSION_ATTRIBUTE = "governance.admission";
}
