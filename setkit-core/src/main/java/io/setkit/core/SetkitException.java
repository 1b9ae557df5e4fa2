package io.setkit.core;

/**
 * Unchecked failure raised when setkit cannot read its configuration.
 */
public class SetkitException extends RuntimeException {

    public SetkitException(String message, Throwable cause) {
        super(message, cause);
    }

}
