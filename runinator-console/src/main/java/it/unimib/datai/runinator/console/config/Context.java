package it.unimib.datai.runinator.console.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One named console environment: where to listen for gossip, or a fixed endpoint that skips discovery.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Context {
    private String gossipBind;
    private String gossipPort;
    private String endpoint;
    private Integer requestTimeoutSeconds;

    public String getGossipBind() {
        return gossipBind;
    }

    public void setGossipBind(String gossipBind) {
        this.gossipBind = gossipBind;
    }

    public String getGossipPort() {
        return gossipPort;
    }

    public void setGossipPort(String gossipPort) {
        this.gossipPort = gossipPort;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public Integer getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(Integer requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
}
