package org.buildlens.analyzer.common;

public class InvalidArgumentsException extends InvalidCodeException {

    public InvalidArgumentsException(String message) {
        super(message);
    }

    public InvalidArgumentsException(String message, Location location) {
        super(message, location);
    }
}
