/**
 * Global configuration and component factories.
 */
package com.mimecast.lodestar.main;
