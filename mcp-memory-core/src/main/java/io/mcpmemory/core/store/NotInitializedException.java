package io.mcpmemory.core.store;

public class NotInitializedException extends StoreException {

    public NotInitializedException() {
        super("store not initialized");
    }
}
