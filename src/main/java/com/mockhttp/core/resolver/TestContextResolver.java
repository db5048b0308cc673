package com.mockhttp.core.resolver;

import com.mockhttp.MockHttp;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * Resolves test context information for the MockHttp extension.
 */
public final class TestContextResolver {

    private TestContextResolver() {
        // utility class
    }

    public static MockHttp findMockHttpAnnotation(ExtensionContext context) {
        // Check method-level annotation first
        MockHttp methodAnnotation = context.getTestMethod()
                .map(method -> method.getAnnotation(MockHttp.class))
                .orElse(null);
        if (methodAnnotation != null) {
            return methodAnnotation;
        }

        // Then the class and its enclosing classes, for @Nested tests
        Class<?> testClass = context.getRequiredTestClass();
        while (testClass != null) {
            MockHttp classAnnotation = testClass.getAnnotation(MockHttp.class);
            if (classAnnotation != null) {
                return classAnnotation;
            }
            testClass = testClass.getEnclosingClass();
        }
        return null;
    }

    public static String getTestName(ExtensionContext context) {
        String className = context.getRequiredTestClass().getSimpleName();
        return context.getTestMethod()
                .map(method -> className + "." + method.getName())
                .orElse(className);
    }
}
