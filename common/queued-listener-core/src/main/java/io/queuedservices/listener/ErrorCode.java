package io.queuedservices.listener;

/**
 * Fine-grained failure codes. Each code belongs to exactly one {@link ErrorKind}.
 */
public enum ErrorCode {
    NULL_ARGUMENT(ErrorKind.INVALID_ARGUMENT),
    EMPTY_CONNECTION_STRING(ErrorKind.INVALID_ARGUMENT),
    BLANK_QUEUE_NAME(ErrorKind.INVALID_ARGUMENT),
    CONTRACT_MISMATCH(ErrorKind.INVALID_ARGUMENT),
    NO_ENDPOINT(ErrorKind.CONFIGURATION_ERROR),
    AMBIGUOUS_ENDPOINT(ErrorKind.CONFIGURATION_ERROR),
    MALFORMED_CONNECTION_STRING(ErrorKind.CONFIGURATION_ERROR),
    MISSING_PARAMETER(ErrorKind.CONFIGURATION_ERROR),
    MISSING_CREDENTIAL(ErrorKind.CONFIGURATION_ERROR),
    DECRYPTION_FAILED(ErrorKind.CONFIGURATION_ERROR);

    private final ErrorKind kind;

    ErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
