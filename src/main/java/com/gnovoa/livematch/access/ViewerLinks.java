package com.gnovoa.livematch.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issued viewer codes. A code is scoped to one match and expires after the configured TTL;
 * expired codes are dropped when they are looked up or when a new code is issued.
 */
public final class ViewerLinks {

    private static final Logger log = LoggerFactory.getLogger(ViewerLinks.class);

    private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();
    private static final int CODE_LENGTH = 10;

    private final ConcurrentHashMap<String, ViewerLink> links = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final Duration ttl;

    public ViewerLinks(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public ViewerLink issue(String matchId, String createdBy) {
        Instant now = clock.instant();
        links.values().removeIf(l -> !now.isBefore(l.expiresAt()));
        ViewerLink link;
        do {
            link = new ViewerLink(newCode(), matchId, now.plus(ttl), createdBy);
        } while (links.putIfAbsent(link.code(), link) != null);
        log.info("Viewer link issued for match {} by {}, valid until {}", matchId, createdBy, link.expiresAt());
        return link;
    }

    /** The link behind {@code code} if it is still valid for {@code matchId}. */
    public Optional<ViewerLink> resolve(String code, String matchId) {
        if (code == null) return Optional.empty();
        ViewerLink link = links.get(code);
        if (link == null) return Optional.empty();
        Instant now = clock.instant();
        if (!now.isBefore(link.expiresAt())) {
            links.remove(code, link);
            return Optional.empty();
        }
        return link.grants(matchId, now) ? Optional.of(link) : Optional.empty();
    }

    private String newCode() {
        char[] code = new char[CODE_LENGTH];
        for (int i = 0; i < code.length; i++) code[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        return new String(code);
    }
}
