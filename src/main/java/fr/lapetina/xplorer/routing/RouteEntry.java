package fr.lapetina.xplorer.routing;

import fr.lapetina.xplorer.domain.model.ParameterInfo;

import java.util.List;
import java.util.Objects;

/**
 * A registered endpoint. Owned by exactly one {@link Router}.
 *
 * @param path                 path relative to the owning router
 * @param description          human readable description used by the index
 * @param parameters           descriptive parameter metadata
 * @param runsOnAffinityThread whether the handler must run on the affinity thread
 * @param handler              the endpoint function
 */
public record RouteEntry(
        String path,
        String description,
        List<ParameterInfo> parameters,
        boolean runsOnAffinityThread,
        RouteHandler handler
) {
    public RouteEntry {
        Objects.requireNonNull(path, "Path is required");
        Objects.requireNonNull(handler, "Handler is required");
        description = description != null ? description : "";
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public static RouteEntry of(String path, RouteHandler handler) {
        return new RouteEntry(path, "", List.of(), true, handler);
    }
}
