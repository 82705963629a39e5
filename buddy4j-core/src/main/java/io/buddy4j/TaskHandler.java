package io.buddy4j;

import io.buddy4j.core.dispatch.HandlerRequest;
import io.buddy4j.core.dispatch.HandlerResult;

/**
 * A specialized worker the supervisor dispatches requests to. At most one request per handler runs at
 * a time.
 */
public interface TaskHandler {
    String name();

    HandlerResult handle(HandlerRequest request) throws Exception;
}
