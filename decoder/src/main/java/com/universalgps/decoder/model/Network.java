package com.universalgps.decoder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Network endpoint the unit connected from. All components are nullable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Network(
    @JsonProperty("remote_ipv4") String remoteIpv4,
    @JsonProperty("remote_ipv6") String remoteIpv6,
    @JsonProperty("remote_port") Integer remotePort,
    @JsonProperty("mac") String mac
) {
}
