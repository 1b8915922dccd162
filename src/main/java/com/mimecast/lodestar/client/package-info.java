/**
 * Client-server API discovery through {@code /.well-known/matrix/client}.
 */
package com.mimecast.lodestar.client;
