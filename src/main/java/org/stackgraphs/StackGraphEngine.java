package org.stackgraphs;

import com.typesafe.config.Config;
import org.stackgraphs.config.ConfigLoader;
import org.stackgraphs.index.NameResolver;
import org.stackgraphs.index.StackGraphIndexer;
import org.stackgraphs.storage.PartialPathStoreFactory;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a path database, an indexer and a resolver from one configuration tree.
 * <p>
 * The indexer writes to and the resolver reads from the same store. Closing the engine closes
 * the store.
 */
public final class StackGraphEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StackGraphEngine.class);

    private final IPartialPathStore store;
    private final StackGraphIndexer indexer;
    private final NameResolver resolver;

    private StackGraphEngine(IPartialPathStore store, StackGraphIndexer indexer, NameResolver resolver) {
        this.store = store;
        this.indexer = indexer;
        this.resolver = resolver;
    }

    /**
     * Creates the engine from a resolved configuration containing the {@code stack-graphs} block.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static StackGraphEngine create(Config config) {
        Config root = config.getConfig(ConfigLoader.ROOT_PATH);
        IPartialPathStore store = PartialPathStoreFactory.create(root.getConfig("storage"));
        try {
            StackGraphIndexer indexer = new StackGraphIndexer(store, root.getConfig("indexer"));
            NameResolver resolver = NameResolver.fromConfig(store, root.getConfig("stitcher"));
            log.info("Stack graph engine started with {}", store.getClass().getSimpleName());
            return new StackGraphEngine(store, indexer, resolver);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    public IPartialPathStore store() {
        return store;
    }

    public StackGraphIndexer indexer() {
        return indexer;
    }

    public NameResolver resolver() {
        return resolver;
    }

    @Override
    public void close() {
        store.close();
        log.debug("Stack graph engine closed");
    }
}
