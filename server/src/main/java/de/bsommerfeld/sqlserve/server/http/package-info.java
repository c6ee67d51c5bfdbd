/**
 * JSON-over-HTTP surface on top of the JDK's {@code com.sun.net.httpserver}.
 *
 * <pre>
 *   request ──► ServeHttpServer (fixed worker pool)
 *                   │
 *                   ▼
 *               ServeHandler ──► RequestPath.parse
 *                   │
 *         ┌─────────┴──────────┐
 *         ▼                    ▼
 *   AddressResolver       MetadataRegistry.build(true)   (index only)
 *     │ stale/missing prefix ──► 302 + Link preload
 *     ▼
 *   QueryService ──► JsonResponder ──► 200 / 400 / 404
 * </pre>
 *
 * <h2>Status codes</h2>
 * <ul>
 * <li>200: rows, cacheable for a year</li>
 * <li>302: canonical redirect, cacheable</li>
 * <li>400: the engine rejected the query</li>
 * <li>404: unknown database, table, row or path shape</li>
 * <li>500: anything else, logged with stack trace</li>
 * </ul>
 */
package de.bsommerfeld.sqlserve.server.http;
