package com.emissions.error;

public class DatasetComputeException extends EmissionsQueryException {

    public DatasetComputeException(String message) {
        super(ErrorKind.DATASET_COMPUTE, message);
    }

    public DatasetComputeException(String message, Throwable cause) {
        super(ErrorKind.DATASET_COMPUTE, message, cause);
    }
}
