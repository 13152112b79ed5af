package com.arbor.tree;

import java.util.List;

/**
 * Callable wrapped by a {@link Handler}; receives the arguments of the current call.
 */
@FunctionalInterface
public interface HandlerFunction {

    Object apply(List<Object> args) throws Exception;
}
