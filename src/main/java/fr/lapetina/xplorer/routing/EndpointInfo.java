package fr.lapetina.xplorer.routing;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.xplorer.domain.model.ParameterInfo;

import java.util.List;

/**
 * Self-description of a single endpoint, as listed by the index.
 *
 * @param path             absolute path, including every mount prefix
 * @param description      endpoint description
 * @param parameters       parameter metadata, omitted from JSON when empty
 * @param runsOnMainThread whether the handler runs on the affinity thread
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EndpointInfo(
        String path,
        String description,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ParameterInfo> parameters,
        boolean runsOnMainThread
) {
    static EndpointInfo from(String absolutePath, RouteEntry entry) {
        return new EndpointInfo(absolutePath, entry.description(), entry.parameters(),
                entry.runsOnAffinityThread());
    }
}
