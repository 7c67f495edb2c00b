package com.universalgps.generators;

/**
 * A message as the gateway would publish it.
 *
 * @param routingKey routing key, {@code gps.<imei>}
 * @param payload UTF-8 JSON document
 */
public record GatewayMessage(String routingKey, byte[] payload) {
}
