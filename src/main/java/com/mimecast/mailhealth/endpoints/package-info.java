/**
 * HTTP endpoint serving metrics, the status page and health.
 *
 * <p>Built on the JDK {@link com.sun.net.httpserver.HttpServer} with Micrometer's Prometheus registry
 * doing the exposition.
 */
package com.mimecast.mailhealth.endpoints;
