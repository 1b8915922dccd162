/**
 * HTTP access for well-known lookups.
 */
package com.mimecast.lodestar.http;
