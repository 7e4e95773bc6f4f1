/**
 *
 */
package org.marinedata.edna.utils;

/**
 * This exception is thrown when a command's parameters are invalid.  The processor framework reports it
 * along with the command usage.
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -2406738553174930658L;

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
