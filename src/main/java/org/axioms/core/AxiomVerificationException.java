package org.axioms.core;

/**
 * 本库所有异常的公共父类。均为非受检异常。
 */
public class AxiomVerificationException extends RuntimeException {

    public AxiomVerificationException(String message) {
        super(message);
    }

    public AxiomVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
