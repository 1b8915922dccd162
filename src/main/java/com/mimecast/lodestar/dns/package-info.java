/**
 * DNS access for SRV and address lookups.
 */
package com.mimecast.lodestar.dns;
