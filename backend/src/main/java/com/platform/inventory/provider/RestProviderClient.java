package com.platform.inventory.provider;

import com.platform.inventory.error.ConnectivityException;
import com.platform.inventory.model.Provider;
import com.platform.inventory.model.RemoteInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Provider client for agents exposing a small JSON API.
 * 
 * GET {endpoint}/health     - any 2xx means reachable
 * GET {endpoint}/instances  - array of objects with at least a "name" field
 */
@Slf4j
public class RestProviderClient implements ProviderClient {
    
    public static final String TYPE = "rest";
    
    private static final ParameterizedTypeReference<List<Map<String, Object>>> INSTANCE_LIST =
        new ParameterizedTypeReference<>() {};
    
    private final Provider provider;
    private final RestTemplate restTemplate;
    
    public RestProviderClient(Provider provider, RestTemplate restTemplate) {
        this.provider = provider;
        this.restTemplate = restTemplate;
    }
    
    @Override
    public void checkConnection() {
        exchange("/health", new ParameterizedTypeReference<String>() {});
        log.debug("Provider {} is reachable", provider.name());
    }
    
    @Override
    public List<RemoteInstance> listInstances() {
        List<Map<String, Object>> body = exchange("/instances", INSTANCE_LIST);
        if (body == null) {
            return List.of();
        }
        
        List<RemoteInstance> instances = new ArrayList<>(body.size());
        for (Map<String, Object> item : body) {
            Object name = item.get("name");
            if (name == null || name.toString().isBlank()) {
                log.warn("Provider {} returned an instance without a name, ignoring it: {}", provider.name(), item);
                continue;
            }
            Object status = item.get("status");
            instances.add(new RemoteInstance(name.toString(), status != null ? status.toString() : null, item));
        }
        return instances;
    }
    
    private <T> T exchange(String path, ParameterizedTypeReference<T> type) {
        String url = stripTrailingSlash(provider.endpoint()) + path;
        try {
            ResponseEntity<T> response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), type);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED) || e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                throw ConnectivityException.unauthorized(provider.name(),
                    String.format("Provider %s rejected credentials (%s)", provider.name(), e.getStatusCode()));
            }
            throw ConnectivityException.unreachable(provider.name(),
                String.format("Provider %s returned %s for %s", provider.name(), e.getStatusCode(), path), e);
        } catch (RestClientException e) {
            throw ConnectivityException.unreachable(provider.name(),
                String.format("Provider %s unreachable at %s: %s", provider.name(), url, e.getMessage()), e);
        }
    }
    
    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (provider.apiToken() != null && !provider.apiToken().isBlank()) {
            headers.setBearerAuth(provider.apiToken());
        }
        return headers;
    }
    
    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
