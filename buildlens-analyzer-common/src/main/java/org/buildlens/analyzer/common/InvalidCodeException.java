package org.buildlens.analyzer.common;

/**
 * Error in the build file itself: syntax errors, operators applied to values of the wrong type,
 * a root file that does not start with a project declaration.
 */
public class InvalidCodeException extends RuntimeException {
    private final Location location;

    public InvalidCodeException(String message) {
        this(message, null);
    }

    public InvalidCodeException(String message, Location location) {
        super(location == null ? message : location + ": " + message);
        this.location = location;
    }

    /**
     * @return the position of the offending code, or <code>null</code> when not known
     */
    public Location getLocation() {
        return location;
    }
}
