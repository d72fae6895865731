package com.gnovoa.livematch.positions;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "positions")
public record PositionProperties(String zonesResource) {
    public PositionProperties {
        if (zonesResource == null || zonesResource.isBlank()) zonesResource = "classpath:position-zones.json";
    }
}
