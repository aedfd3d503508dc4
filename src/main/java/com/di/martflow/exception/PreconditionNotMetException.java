package com.di.martflow.exception;

/** An operation was requested while the warehouse is not in the phase it requires. */
public class PreconditionNotMetException extends MartFlowException {

    public PreconditionNotMetException(String message) {
        super(ErrorCategory.PRECONDITION_NOT_MET, message);
    }
}
