package com.gnovoa.livematch.access;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "viewers")
public record ViewerProperties(Duration linkTtl) {
    public ViewerProperties {
        if (linkTtl == null || linkTtl.isNegative() || linkTtl.isZero()) linkTtl = Duration.ofHours(24);
    }
}
