package fr.lapetina.xplorer.dispatch;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.routing.RouteEntry;

import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot carrying one affinity call.
 *
 * Mutable and reused by the Disruptor; never accessed outside the dispatcher.
 */
public final class DispatchEvent {

    private RouteEntry entry;
    private Request request;
    private CompletableFuture<Response> resultFuture;

    public void clear() {
        this.entry = null;
        this.request = null;
        this.resultFuture = null;
    }

    public void initialize(RouteEntry entry, Request request, CompletableFuture<Response> resultFuture) {
        this.entry = entry;
        this.request = request;
        this.resultFuture = resultFuture;
    }

    public RouteEntry getEntry() {
        return entry;
    }

    public Request getRequest() {
        return request;
    }

    public CompletableFuture<Response> getResultFuture() {
        return resultFuture;
    }

    @Override
    public String toString() {
        return "DispatchEvent{path=" + (entry != null ? entry.path() : null) + "}";
    }
}
