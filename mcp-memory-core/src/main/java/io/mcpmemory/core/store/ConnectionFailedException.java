package io.mcpmemory.core.store;

public class ConnectionFailedException extends StoreException {

    public ConnectionFailedException(String message) {
        super(message);
    }

    public ConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
