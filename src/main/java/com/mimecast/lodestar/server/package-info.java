/**
 * Server name resolution for server-server federation.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>IP literal, with or without port.</li>
 *   <li>Host with explicit port.</li>
 *   <li>Delegation through {@code https://<name>/.well-known/matrix/server}.</li>
 *   <li>SRV record {@code _matrix._tcp.<host>}.</li>
 *   <li>The host itself on port 8448.</li>
 * </ol>
 *
 * <p>Only a connect failure on the well-known request is fatal.
 * <br>Every other failure degrades to the next step.
 *
 * @see com.mimecast.lodestar.server.ServerResolver
 */
package com.mimecast.lodestar.server;
