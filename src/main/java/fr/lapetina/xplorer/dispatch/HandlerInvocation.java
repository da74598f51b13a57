package fr.lapetina.xplorer.dispatch;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.routing.RouteEntry;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

/**
 * Calls a handler with the logging context of the request it serves.
 */
final class HandlerInvocation {

    static final String MDC_PATH = "path";
    static final String MDC_TRANSPORT = "transport";

    private HandlerInvocation() {
    }

    static Response invoke(RouteEntry entry, Request request) {
        String previousPath = MDC.get(MDC_PATH);
        String previousTransport = MDC.get(MDC_TRANSPORT);
        MDC.put(MDC_PATH, request.path());
        String transport = request.metadata().get("transport");
        if (transport != null) {
            MDC.put(MDC_TRANSPORT, transport);
        }
        try {
            return entry.handler().handle(request);
        } finally {
            restore(MDC_PATH, previousPath);
            restore(MDC_TRANSPORT, previousTransport);
        }
    }

    /**
     * Runs the handler and completes {@code future} with its outcome.
     * Fatal JVM errors are propagated after the future was completed.
     */
    static void complete(CompletableFuture<Response> future, RouteEntry entry, Request request) {
        try {
            future.complete(invoke(entry, request));
        } catch (Throwable t) {
            future.completeExceptionally(t);
            if (t instanceof VirtualMachineError vme) {
                throw vme;
            }
        }
    }

    private static void restore(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }
}
