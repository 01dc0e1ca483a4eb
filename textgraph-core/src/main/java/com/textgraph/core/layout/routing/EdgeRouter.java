package com.textgraph.core.layout.routing;

import com.textgraph.core.layout.RoutedEdge;

import java.util.List;

/**
 * Strategy that computes orthogonal paths for the edges of a placed diagram.
 *
 * <p>Routers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()} from configuration or the command line.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>self-loops are left out of the result;</li>
 *   <li>consecutive waypoints share a row or a column;</li>
 *   <li>the first waypoint touches the source box and the last one the target box;</li>
 *   <li>a path that cannot be found is replaced by a direct orthogonal route, never an error.</li>
 * </ul>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.textgraph.core.layout.routing.EdgeRouter}
 *
 * @see RoutingContext
 * @see RoutedEdge
 */
public interface EdgeRouter {

    /**
     * Returns unique identifier for this router.
     *
     * <p>Used for selecting the router in configuration. Lowercase (e.g., "grid").
     *
     * @return unique router identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this router.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Routes every edge of the context.
     *
     * @param context placed boxes and the graph they came from
     * @return routed edges in edge declaration order
     * @throws IllegalStateException if an edge endpoint has no placed box
     */
    List<RoutedEdge> route(RoutingContext context);
}
