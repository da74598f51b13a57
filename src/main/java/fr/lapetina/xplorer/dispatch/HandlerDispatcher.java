package fr.lapetina.xplorer.dispatch;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.routing.RouteEntry;

/**
 * Dispatch policy deciding on which thread a handler runs.
 * <p>
 * Implementations block the caller until the handler completed, whatever thread
 * actually ran it. Exceptions thrown by the handler are rethrown to the caller.
 */
public interface HandlerDispatcher {

    /**
     * Runs the entry's handler and returns its response.
     *
     * @throws InterruptedException    if the caller was interrupted while waiting
     * @throws AffinityReentryException if an affinity handler is dispatched from the affinity thread
     * @throws DispatchTimeoutException if the handler did not complete in time
     */
    Response dispatch(RouteEntry entry, Request request) throws InterruptedException;
}
