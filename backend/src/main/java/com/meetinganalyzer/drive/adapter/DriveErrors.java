package com.meetinganalyzer.drive.adapter;

import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class DriveErrors {

    private DriveErrors() {
    }

    static PipelineException translate(String operation, String objectId, RuntimeException exception) {
        if (exception instanceof PipelineException pipelineException) {
            return pipelineException;
        }
        ErrorKind kind = isTransient(exception) ? ErrorKind.TRANSIENT_TRANSFER : ErrorKind.RETRIEVAL_FAILED;
        return new PipelineException(kind, operation + " failed for " + objectId + ": " + exception.getMessage(), exception);
    }

    static boolean isTransient(RuntimeException exception) {
        if (exception instanceof ResourceAccessException) {
            return true;
        }
        if (exception instanceof RestClientResponseException responseException) {
            HttpStatusCode status = responseException.getStatusCode();
            return status.is5xxServerError() || status.value() == 408 || status.value() == 429;
        }
        return false;
    }
}
