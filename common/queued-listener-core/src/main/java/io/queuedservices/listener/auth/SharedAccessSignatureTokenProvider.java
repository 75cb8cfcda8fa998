package io.queuedservices.listener.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Issues shared access signature tokens signed with HMAC-SHA256 over the url-encoded audience and the
 * expiry, in the form
 * {@code SharedAccessSignature sr=<audience>&sig=<signature>&se=<expiry>&skn=<keyName>}.
 * Tokens are cached per audience until {@link #REFRESH_MARGIN} before they expire.
 */
public final class SharedAccessSignatureTokenProvider implements TokenProvider {

    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(1);
    static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);
    private static final String ALGORITHM = "HmacSHA256";

    private final String keyName;
    private final String sharedAccessKey;
    private final Duration tokenTimeToLive;
    private final Clock clock;
    private final Map<String, SecurityToken> cache = new ConcurrentHashMap<>();

    public SharedAccessSignatureTokenProvider(String keyName, String sharedAccessKey) {
        this(keyName, sharedAccessKey, DEFAULT_TOKEN_TTL, Clock.systemUTC());
    }

    public SharedAccessSignatureTokenProvider(String keyName, String sharedAccessKey, Duration tokenTimeToLive, Clock clock) {
        if (keyName == null || keyName.isBlank()) {
            throw new IllegalArgumentException("keyName must not be null or blank");
        }
        if (sharedAccessKey == null || sharedAccessKey.isEmpty()) {
            throw new IllegalArgumentException("sharedAccessKey must not be null or empty");
        }
        Objects.requireNonNull(tokenTimeToLive, "tokenTimeToLive");
        if (tokenTimeToLive.compareTo(REFRESH_MARGIN) <= 0) {
            throw new IllegalArgumentException("tokenTimeToLive must be longer than " + REFRESH_MARGIN);
        }
        this.keyName = keyName;
        this.sharedAccessKey = sharedAccessKey;
        this.tokenTimeToLive = tokenTimeToLive;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String keyName() {
        return keyName;
    }

    /**
     * Shared access key used for signing. Never logged.
     */
    public String sharedAccessKey() {
        return sharedAccessKey;
    }

    @Override
    public String identity() {
        return keyName;
    }

    @Override
    public SecurityToken getToken(String audience) {
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience must not be null or blank");
        }
        Instant now = clock.instant();
        return cache.compute(audience, (key, cached) ->
            cached != null && now.isBefore(cached.expiresAt().minus(REFRESH_MARGIN)) ? cached : issue(key, now));
    }

    private SecurityToken issue(String audience, Instant now) {
        Instant expiresAt = now.plus(tokenTimeToLive);
        long expiry = expiresAt.getEpochSecond();
        String encodedAudience = URLEncoder.encode(audience, StandardCharsets.UTF_8);
        String signature = sign(encodedAudience + "\n" + expiry);
        String token = "SharedAccessSignature sr=" + encodedAudience
            + "&sig=" + URLEncoder.encode(signature, StandardCharsets.UTF_8)
            + "&se=" + expiry
            + "&skn=" + keyName;
        return new SecurityToken(token, audience, Instant.ofEpochSecond(expiry));
    }

    private String sign(String stringToSign) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(sharedAccessKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] raw = mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(raw);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to sign shared access signature", ex);
        }
    }

    @Override
    public String toString() {
        return "SharedAccessSignatureTokenProvider[keyName=" + keyName + ", ttl=" + tokenTimeToLive + "]";
    }
}
