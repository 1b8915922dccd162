package com.mimecast.lodestar.http;

import java.io.IOException;

/**
 * Well-known HTTP client.
 * <p>Minimal GET capability consumed by the resolvers.
 * <p>Implementations must be safe for concurrent use by multiple resolutions.
 *
 * @see OkHttpWellKnownClient
 */
public interface WellKnownHttpClient {

    /**
     * Performs a GET request.
     * <p>Any response, whatever its status, is returned.
     * <br>Transport failures are thrown, connect-level ones must remain recognisable
     * by {@link com.mimecast.lodestar.exception.ErrorClassifier#isConnectFailure(Throwable)}.
     *
     * @param url Absolute URL string.
     * @return HttpResult instance.
     * @throws IOException Transport failure.
     */
    HttpResult get(String url) throws IOException;
}
