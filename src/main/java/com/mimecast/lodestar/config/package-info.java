/**
 * Configuration foundation and discovery settings.
 *
 * <p>Configuration files are JSON5 and read leniently.
 * <br><b>Example:</b>
 * <pre>
 * {
 *   scheme: "https",
 *   connectTimeout: 10,
 *   readTimeout: 10,
 *   cacheDirectory: "/var/cache/lodestar"
 * }
 * </pre>
 */
package com.mimecast.lodestar.config;
