package io.mcpmemory.core.namespace;

import java.io.IOException;

@FunctionalInterface
public interface DimensionListener {

    void onDimensionDiscovered(int dimension) throws IOException;
}
