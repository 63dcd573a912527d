package io.packscan.ast.signature;

/**
 * The actual arguments of a call site do not fit a signature.
 */
public class SignatureBindingException extends Exception {

    public SignatureBindingException(String message) {
        super(message);
    }
}
