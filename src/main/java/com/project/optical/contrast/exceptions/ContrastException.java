package com.project.optical.contrast.exceptions;

/** Domain-specific exception for measurement errors. */
public class ContrastException extends RuntimeException {
    public ContrastException(String message) { super(message); }
    public ContrastException(String message, Throwable cause) { super(message, cause); }
}
