package com.ottoai.analysis.webhook;

import com.ottoai.analysis.config.AnalysisProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Authenticity check for inbound completion webhooks.
 *
 * signature = lowercase hex HMAC-SHA256(secret, "{timestamp}." + rawBody)
 *
 * The timestamp is epoch milliseconds and must lie within the tolerance of
 * the local clock in either direction. Pure and local: no I/O, no state.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    /** Why a request was rejected; also used as the metric tag. */
    public enum Verdict {
        VALID,
        NO_SECRET,
        MISSING_SIGNATURE,
        MISSING_TIMESTAMP,
        BAD_TIMESTAMP,
        STALE_TIMESTAMP,
        BAD_SIGNATURE;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Clock    clock;
    private final Duration tolerance;

    @Autowired
    public WebhookSignatureVerifier(Clock clock, AnalysisProperties properties) {
        this(clock, properties.getWebhook().getSignatureTolerance());
    }

    WebhookSignatureVerifier(Clock clock, Duration tolerance) {
        this.clock     = clock;
        this.tolerance = tolerance;
    }

    public boolean verify(byte[] rawBody, String signature, String timestamp, String secret) {
        return check(rawBody, signature, timestamp, secret) == Verdict.VALID;
    }

    public Verdict check(byte[] rawBody, String signature, String timestamp, String secret) {
        if (secret == null || secret.isBlank())       return Verdict.NO_SECRET;
        if (signature == null || signature.isBlank()) return Verdict.MISSING_SIGNATURE;
        if (timestamp == null || timestamp.isBlank()) return Verdict.MISSING_TIMESTAMP;

        long sentAtMillis;
        try {
            sentAtMillis = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            return Verdict.BAD_TIMESTAMP;
        }
        // Bounds on the sender's timestamp, so extreme values cannot overflow.
        long now = clock.millis();
        long toleranceMillis = tolerance.toMillis();
        if (sentAtMillis < now - toleranceMillis || sentAtMillis > now + toleranceMillis) {
            return Verdict.STALE_TIMESTAMP;
        }

        // Signed over the header exactly as received.
        byte[] expected = sign(rawBody == null ? new byte[0] : rawBody, timestamp, secret)
                .getBytes(StandardCharsets.US_ASCII);
        byte[] presented = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, presented) ? Verdict.VALID : Verdict.BAD_SIGNATURE;
    }

    /** Lowercase hex signature for a body and timestamp. */
    public static String sign(byte[] rawBody, String timestamp, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            mac.update((timestamp + ".").getBytes(StandardCharsets.UTF_8));
            mac.update(rawBody);
            return HexFormat.of().formatHex(mac.doFinal());
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
