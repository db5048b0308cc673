package com.mockhttp;

import com.mockhttp.core.context.ExtensionContextManager;
import com.mockhttp.core.resolver.TestContextResolver;
import org.junit.jupiter.api.extension.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JUnit 5 extension that handles the {@link MockServer} lifecycle per test.
 * The test declares its endpoints on the injected server and starts it; after the test the
 * server is stopped, call counts are verified and every collected failure fails the test.
 */
public class MockHttpExtension implements BeforeEachCallback, AfterEachCallback, ParameterResolver {

    private static final Logger logger = LoggerFactory.getLogger(MockHttpExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        MockHttp annotation = TestContextResolver.findMockHttpAnnotation(context);
        MockServer server = annotation != null && annotation.port() > 0
                ? new MockServer(annotation.port())
                : new MockServer();

        new ExtensionContextManager.MethodLevelStore(context).putServer(server);
        logger.debug("Created mock server for {}", TestContextResolver.getTestName(context));
    }

    @Override
    public void afterEach(ExtensionContext context) {
        MockServer server = new ExtensionContextManager.MethodLevelStore(context).removeServer();
        if (server == null) {
            return;
        }
        logger.debug("Verifying mock server for {}", TestContextResolver.getTestName(context));
        server.close();
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
            throws ParameterResolutionException {
        return parameterContext.getParameter().getType() == MockServer.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
            throws ParameterResolutionException {
        MockServer server = new ExtensionContextManager.MethodLevelStore(extensionContext).getServer();
        if (server == null) {
            throw new ParameterResolutionException("No mock server available for "
                    + TestContextResolver.getTestName(extensionContext));
        }
        return server;
    }
}
