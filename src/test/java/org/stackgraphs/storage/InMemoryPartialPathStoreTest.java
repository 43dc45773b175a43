package org.stackgraphs.storage;

import org.stackgraphs.storage.api.IPartialPathStore;
import org.junit.jupiter.api.Tag;

@Tag("unit")
class InMemoryPartialPathStoreTest extends AbstractPartialPathStoreTest {

    @Override
    protected IPartialPathStore createStore() {
        return new InMemoryPartialPathStore();
    }
}
