package com.zakat.hawl.domain.exception;

public class DetectionRunInProgressException extends HawlEngineException {

    public DetectionRunInProgressException() {
        super("DETECTION_IN_PROGRESS", "A Hawl detection run is already in progress");
    }
}
