package com.openforge.scanmate.task;

/**
 * Thrown by {@link OperationScope#start} when an operation of the same kind
 * is still outstanding in that scope.
 */
public class OperationBusyException extends GatewayException {

    private final OperationKind operationKind;

    public OperationBusyException(OperationKind operationKind) {
        super(ErrorKind.VALIDATION,
                "A %s request is already in progress".formatted(operationKind.name().toLowerCase()));
        this.operationKind = operationKind;
    }

    public OperationKind operationKind() {
        return operationKind;
    }
}
