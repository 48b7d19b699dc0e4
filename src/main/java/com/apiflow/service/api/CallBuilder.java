package com.apiflow.service.api;

import com.apiflow.model.BoundCall;
import com.apiflow.model.CallDescriptor;
import com.apiflow.model.CallResult;
import com.apiflow.model.ResolvedMethod;
import java.util.Map;

/**
 * Builds and executes calls against any service described by an interface document.
 */
public interface CallBuilder {

    /**
     * Walks the descriptor's dot-path against the service's method tree.
     *
     * @throws com.apiflow.exception.MethodNotFoundException if a segment is absent.
     */
    ResolvedMethod resolve(CallDescriptor descriptor);

    /**
     * Sanitizes the arguments (binary to base64, dates to wire strings, recursively) and checks them
     * against the method's parameters.
     *
     * @throws com.apiflow.exception.BadArgumentException on unknown, missing or mistyped arguments.
     */
    BoundCall bind(ResolvedMethod method, Map<String, Object> arguments);

    /**
     * Executes the call through the retry executor. With {@code iterate} set the result is always an
     * element iterator: the items of every page, or the response itself when it is a single object.
     * Without it the raw response is returned as is.
     *
     * @param limit Maximum number of elements to yield, {@code null} for no limit.
     */
    CallResult run(BoundCall call, boolean iterate, Integer limit);

    /**
     * Resolves, binds and runs a descriptor in one go.
     */
    default CallResult call(CallDescriptor descriptor) {
        ResolvedMethod method = resolve(descriptor);
        BoundCall call = bind(method, descriptor.getArguments());
        return run(call, descriptor.isIterate(), descriptor.getLimit());
    }
}
