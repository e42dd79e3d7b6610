package com.sunorcnys.http;

import java.io.IOException;

/**
 * The only way the core talks to the network.
 */
@FunctionalInterface
public interface HttpTransport {

    ApiResponse send(ApiRequest request) throws IOException, InterruptedException;
}
