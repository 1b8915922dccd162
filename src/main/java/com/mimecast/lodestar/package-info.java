/**
 * Lodestar resolves where Matrix servers and homeservers live.
 *
 * <p>Two paths are provided:
 * <ul>
 *   <li>{@link com.mimecast.lodestar.server.ServerResolver} - server name to connect address and Host header
 *   <br>via IP literals, the server well-known document and {@code _matrix._tcp} SRV records.</li>
 *   <li>{@link com.mimecast.lodestar.client.ClientWellKnownResolver} - account domain to a validated
 *   <br>client-server API base URL via the client well-known document.</li>
 * </ul>
 *
 * <p>HTTP and DNS access go through {@link com.mimecast.lodestar.http.WellKnownHttpClient}
 * <br>and {@link com.mimecast.lodestar.dns.DnsClient} so backends can be swapped.
 */
package com.mimecast.lodestar;
