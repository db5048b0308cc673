package com.mockhttp;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Gives each test its own {@link MockServer}, injected as a test method parameter.
 * After the test the server is closed: call counts are verified and every collected
 * failure fails the test.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@ExtendWith(MockHttpExtension.class)
public @interface MockHttp {
    /**
     * Static port to listen on. 0 uses the {@code mockhttp.port} system property, or any free port.
     */
    int port() default 0;
}
