package com.platform.inventory.provider;

import com.platform.inventory.error.ConnectivityException;
import com.platform.inventory.error.ErrorCode;
import com.platform.inventory.model.Provider;
import com.platform.inventory.model.RemoteInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestProviderClientTest {
    
    private static final Provider PROVIDER = new Provider(1L, "pve-1", "rest", "http://agent.local/api/", "tok", "active");
    
    private MockRestServiceServer server;
    private RestProviderClient client;
    
    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestProviderClient(PROVIDER, restTemplate);
    }
    
    @Test
    @DisplayName("Should parse instances and skip entries without a name")
    void shouldListInstances() {
        server.expect(requestTo("http://agent.local/api/instances"))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
            .andRespond(withSuccess("""
                [
                  {"name": "web-1", "status": "running", "ip": null},
                  {"status": "running"},
                  {"name": "db-1", "status": "stopped"}
                ]
                """, MediaType.APPLICATION_JSON));
        
        List<RemoteInstance> instances = client.listInstances();
        
        assertThat(instances).extracting(RemoteInstance::name).containsExactly("web-1", "db-1");
        assertThat(instances.get(0).status()).isEqualTo("running");
        server.verify();
    }
    
    @Test
    @DisplayName("Should report rejected credentials as an authentication failure")
    void shouldMapUnauthorized() {
        server.expect(requestTo("http://agent.local/api/health"))
            .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        
        assertThatThrownBy(() -> client.checkConnection())
            .isInstanceOf(ConnectivityException.class)
            .extracting(e -> ((ConnectivityException) e).getErrorCode())
            .isEqualTo(ErrorCode.PROVIDER_AUTH_FAILED);
    }
    
    @Test
    @DisplayName("Should report server errors as unreachable")
    void shouldMapServerError() {
        server.expect(requestTo("http://agent.local/api/instances"))
            .andRespond(withServerError());
        
        assertThatThrownBy(() -> client.listInstances())
            .isInstanceOf(ConnectivityException.class)
            .extracting(e -> ((ConnectivityException) e).getErrorCode())
            .isEqualTo(ErrorCode.PROVIDER_UNREACHABLE);
    }
}
