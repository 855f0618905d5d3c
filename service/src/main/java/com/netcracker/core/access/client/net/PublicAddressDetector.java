package com.netcracker.core.access.client.net;

import com.netcracker.core.access.configuration.AccessManagerConfig;
import com.netcracker.core.access.service.AccessManagerException;
import com.netcracker.core.access.service.rules.RuleMatcher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Detects the caller's public address by asking external echo services in order.
 */
@ApplicationScoped
@Slf4j
public class PublicAddressDetector {
    private final HttpClient httpClient;
    private final List<String> services;
    private final Duration timeout;

    @Inject
    public PublicAddressDetector(AccessManagerConfig config) {
        this(HttpClient.newBuilder().connectTimeout(config.publicIp().timeout()).build(),
                config.publicIp().services(),
                config.publicIp().timeout());
    }

    PublicAddressDetector(HttpClient httpClient, List<String> services, Duration timeout) {
        this.httpClient = httpClient;
        this.services = List.copyOf(services);
        this.timeout = timeout;
    }

    public String detect() {
        for (String service : services) {
            try {
                HttpRequest request = HttpRequest.newBuilder(URI.create(service))
                        .timeout(timeout)
                        .header("User-Agent", "nsg-access-manager")
                        .GET()
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                String body = response.body() == null ? "" : response.body().trim();
                if (response.statusCode() / 100 == 2 && RuleMatcher.isHostAddress(body)) {
                    log.info("Detected public IP {} via {}", body, service);
                    return body;
                }
                log.warn("Address service {} answered with status {} and {} characters", service, response.statusCode(), body.length());
            } catch (IOException e) {
                log.warn("Address service {} failed: {}", service, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AccessManagerException("Interrupted while detecting public IP", e);
            }
        }
        throw new AccessManagerException("Could not detect public IP from any of " + services
                + ". Use --ip to provide it manually.");
    }
}
