package fr.lapetina.xplorer.dispatch;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.routing.RouteEntry;

/**
 * Runs every handler on the calling thread, ignoring the affinity flag.
 * Used by routers that have no dispatcher of their own and no parent providing one.
 */
public final class InlineDispatcher implements HandlerDispatcher {

    public static final InlineDispatcher INSTANCE = new InlineDispatcher();

    private InlineDispatcher() {
    }

    @Override
    public Response dispatch(RouteEntry entry, Request request) {
        return HandlerInvocation.invoke(entry, request);
    }
}
