package de.bsommerfeld.mindshare.db;

/**
 * Thrown when the backing store cannot be reached, read or written.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
