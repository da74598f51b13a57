package fr.lapetina.xplorer.routing;

import fr.lapetina.xplorer.domain.model.ParameterInfo;
import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;

import java.util.List;
import java.util.Locale;

/**
 * API index and discovery endpoint, registered at {@code /} of a router.
 * <p>
 * {@code depth=shallow} summarizes mounted routers by path, description and
 * endpoint count; any other value ({@code full} by default, {@code deep} accepted)
 * includes their endpoints recursively.
 */
public final class IndexEndpoint implements RouteHandler {

    public static final String PATH = Router.ROOT_PATH;
    public static final String DEPTH_PARAM = "depth";
    public static final String SHALLOW = "shallow";

    static final String DESCRIPTION = "API index and discovery. Lists all available endpoints and "
            + "sub-routers with their descriptions. Use depth=shallow to only show sub-router "
            + "summaries instead of their full endpoints.";

    static final ParameterInfo DEPTH = ParameterInfo.optional(
            DEPTH_PARAM,
            "Level of detail for sub-routers. 'full' recursively includes all sub-router endpoints, "
                    + "'shallow' only shows sub-router path/description/count.",
            "full", "full", "shallow");

    private final Router router;

    private IndexEndpoint(Router router) {
        this.router = router;
    }

    /**
     * Registers the index at {@code /} of {@code router}. The index reads a frozen
     * table only and runs off the affinity thread.
     */
    public static void register(Router router) {
        router.register(PATH, DESCRIPTION, List.of(DEPTH), false, new IndexEndpoint(router));
    }

    static void register(Router router, boolean subRouter) {
        if (subRouter) {
            router.register(PATH, "Lists the endpoints of this router.", List.of(DEPTH), false,
                    new IndexEndpoint(router));
        } else {
            register(router);
        }
    }

    @Override
    public Response handle(Request request) {
        boolean deep = request.queryParam(DEPTH_PARAM)
                .map(depth -> !depth.toLowerCase(Locale.ROOT).equals(SHALLOW))
                .orElse(true);
        return Response.json(router.routerInfo(deep));
    }
}
