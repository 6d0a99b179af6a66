package io.mcpmemory.core.store;

public class NotFoundException extends StoreException {

    public NotFoundException(String message) {
        super(message);
    }
}
