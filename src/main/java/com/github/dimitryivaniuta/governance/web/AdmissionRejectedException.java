package com.github.dimitryivaniuta.governance.web;

import com.github.dimitryivaniuta.governance.governor.AdmissionResult;
import lombok.Getter;

/**
 * Raised by {@link GovernanceInterceptor} when the governor turns a request away;
 * translated to 401 / 403 / 429 by {@link GlobalExceptionHandler}.
 */
@Getter
public class AdmissionRejectedException extends RuntimeException {

    private final AdmissionResult result;

    public AdmissionRejectedException(AdmissionResult result) {
        super(result.message());
        this.result = result;
    }
}
