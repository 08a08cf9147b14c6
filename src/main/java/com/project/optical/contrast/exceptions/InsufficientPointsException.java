package com.project.optical.contrast.exceptions;

/** A polygon or poly-line was given fewer vertices than it needs. */
public class InsufficientPointsException extends ContrastException {
    public InsufficientPointsException(String message) { super(message); }
}
