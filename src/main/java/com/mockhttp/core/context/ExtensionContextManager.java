package com.mockhttp.core.context;

import com.mockhttp.MockServer;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * Manages ExtensionContext.Store operations for the mock server of each test method.
 */
public final class ExtensionContextManager {

    private ExtensionContextManager() {
        // utility class
    }

    public static class MethodLevelStore {
        private static final String SERVER_KEY = "mockServer";

        private final ExtensionContext.Store store;

        public MethodLevelStore(ExtensionContext context) {
            this.store = context.getStore(ExtensionContext.Namespace.create(MockServer.class, context.getUniqueId()));
        }

        public void putServer(MockServer server) {
            store.put(SERVER_KEY, server);
        }

        public MockServer getServer() {
            return store.get(SERVER_KEY, MockServer.class);
        }

        public MockServer removeServer() {
            return store.remove(SERVER_KEY, MockServer.class);
        }
    }
}
