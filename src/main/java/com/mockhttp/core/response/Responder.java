package com.mockhttp.core.response;

/**
 * One response-construction step. A scenario applies its responders, in declaration
 * order, to a {@link ResponseRecorder}.
 */
@FunctionalInterface
public interface Responder {

    void respond(ResponseWriter writer);
}
