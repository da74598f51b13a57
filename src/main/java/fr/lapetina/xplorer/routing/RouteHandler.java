package fr.lapetina.xplorer.routing;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;

/**
 * Endpoint handler: a function from {@link Request} to {@link Response}.
 */
@FunctionalInterface
public interface RouteHandler {

    Response handle(Request request);
}
