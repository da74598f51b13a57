package fr.lapetina.xplorer.routing;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Self-description of a router.
 * <p>
 * A shallow entry for a mounted router only carries {@code path}, {@code description}
 * and {@code endpointCount}; {@code endpoints} and {@code routers} are then {@code null}
 * and left out of the JSON document.
 *
 * @param path          {@code /} for a root router, else the absolute mount prefix
 * @param description   router description
 * @param endpointCount number of endpoints reachable through this router, recursively
 * @param endpoints     direct endpoints
 * @param routers       mounted routers, {@code null} when there are none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouterInfo(
        String path,
        String description,
        int endpointCount,
        List<EndpointInfo> endpoints,
        List<RouterInfo> routers
) {
    public RouterInfo {
        endpoints = endpoints != null ? List.copyOf(endpoints) : null;
        routers = routers != null ? List.copyOf(routers) : null;
    }

    static RouterInfo summary(String path, String description, int endpointCount) {
        return new RouterInfo(path, description, endpointCount, null, null);
    }
}
