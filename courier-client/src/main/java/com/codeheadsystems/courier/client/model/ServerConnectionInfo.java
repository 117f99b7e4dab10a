package com.codeheadsystems.courier.client.model;

import java.net.URI;

/**
 * Network location of a courier account server.
 *
 * @param endpoint base URL of the server, e.g. {@code http://host:8080}
 */
public record ServerConnectionInfo(URI endpoint) {
}
