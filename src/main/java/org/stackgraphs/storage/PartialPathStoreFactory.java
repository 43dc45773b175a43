package org.stackgraphs.storage;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the configured {@link IPartialPathStore} via reflection.
 * <p>
 * Configuration:
 * <pre>
 * storage {
 *   className = "org.stackgraphs.storage.H2PartialPathStore"
 *   options {
 *     jdbcUrl = "jdbc:h2:./data/stack-graphs"
 *   }
 * }
 * </pre>
 * The implementation must have a public constructor taking a {@link Config}.
 */
public final class PartialPathStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(PartialPathStoreFactory.class);

    private static final String DEFAULT_CLASS_NAME = InMemoryPartialPathStore.class.getName();

    private PartialPathStoreFactory() {
    }

    /**
     * @param storageConfig the {@code storage} block
     * @throws IllegalArgumentException if the class cannot be found, has the wrong type, or has no
     *                                  {@code (Config)} constructor
     */
    public static IPartialPathStore create(Config storageConfig) {
        String className = storageConfig.hasPath("className")
            ? storageConfig.getString("className")
            : DEFAULT_CLASS_NAME;
        Config options = storageConfig.hasPath("options")
            ? storageConfig.getConfig("options")
            : ConfigFactory.empty();
        try {
            Class<?> storeClass = Class.forName(className);
            IPartialPathStore store = (IPartialPathStore) storeClass
                .getDeclaredConstructor(Config.class)
                .newInstance(options);
            log.debug("Created path database {}", className);
            return store;
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException(
                "Path database class not found: " + className
                    + ". Make sure the class exists and is in the classpath.", e);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException(
                "Path database class must implement IPartialPathStore: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                "Path database must have public constructor(Config): " + className, e);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                "Failed to instantiate path database: " + className + ". Error: " + e.getMessage(), e);
        }
    }
}
