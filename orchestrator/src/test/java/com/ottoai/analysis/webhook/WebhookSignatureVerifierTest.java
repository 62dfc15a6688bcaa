package com.ottoai.analysis.webhook;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.ottoai.analysis.webhook.WebhookSignatureVerifier.Verdict;
import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final Instant NOW    = Instant.parse("2026-03-01T12:00:00Z");
    private static final String  SECRET = "whsec-test";
    private static final byte[]  BODY   =
            "{\"external_job_id\":\"ext-1\",\"status\":\"completed\"}".getBytes(StandardCharsets.UTF_8);

    private final WebhookSignatureVerifier verifier =
            new WebhookSignatureVerifier(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5));

    @Test
    void validSignatureAndFreshTimestamp_accepted() {
        String ts = String.valueOf(NOW.toEpochMilli());

        assertThat(verifier.verify(BODY, WebhookSignatureVerifier.sign(BODY, ts, SECRET), ts, SECRET)).isTrue();
    }

    @Test
    void uppercaseHexSignature_accepted() {
        String ts = String.valueOf(NOW.toEpochMilli());
        String sig = WebhookSignatureVerifier.sign(BODY, ts, SECRET).toUpperCase();

        assertThat(verifier.check(BODY, sig, ts, SECRET)).isEqualTo(Verdict.VALID);
    }

    @Test
    void knownVector_matchesHmacOfTimestampDotBody() {
        String sig = WebhookSignatureVerifier.sign("{}".getBytes(StandardCharsets.UTF_8), "1700000000000", "key");

        assertThat(sig).isEqualTo("36a72f4525d3323bd0f238fe82098164fb77b1e42288ff8e07b074c686178ad3");
    }

    @Test
    void tamperedBody_rejected() {
        String ts = String.valueOf(NOW.toEpochMilli());
        String sig = WebhookSignatureVerifier.sign(BODY, ts, SECRET);
        byte[] tampered = "{\"external_job_id\":\"ext-2\",\"status\":\"completed\"}".getBytes(StandardCharsets.UTF_8);

        assertThat(verifier.check(tampered, sig, ts, SECRET)).isEqualTo(Verdict.BAD_SIGNATURE);
    }

    @Test
    void wrongSecret_rejected() {
        String ts = String.valueOf(NOW.toEpochMilli());

        assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, ts, "other"), ts, SECRET))
                .isEqualTo(Verdict.BAD_SIGNATURE);
    }

    @Test
    void timestampOutsideTolerance_rejectedInBothDirections() {
        String old    = String.valueOf(NOW.minus(Duration.ofMinutes(6)).toEpochMilli());
        String future = String.valueOf(NOW.plus(Duration.ofMinutes(6)).toEpochMilli());

        assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, old, SECRET), old, SECRET))
                .isEqualTo(Verdict.STALE_TIMESTAMP);
        assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, future, SECRET), future, SECRET))
                .isEqualTo(Verdict.STALE_TIMESTAMP);
    }

    @Test
    void timestampAtToleranceEdge_accepted() {
        String edge = String.valueOf(NOW.minus(Duration.ofMinutes(5)).toEpochMilli());

        assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, edge, SECRET), edge, SECRET))
                .isEqualTo(Verdict.VALID);
    }

    @Test
    void extremeTimestamps_rejectedAsStale() {
        // now - ts == Long.MIN_VALUE, where Math.abs would stay negative
        String wrapping = String.valueOf(Long.MIN_VALUE + NOW.toEpochMilli());

        for (String ts : new String[] {wrapping, String.valueOf(Long.MIN_VALUE), String.valueOf(Long.MAX_VALUE)}) {
            assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, ts, SECRET), ts, SECRET))
                    .isEqualTo(Verdict.STALE_TIMESTAMP);
        }
    }

    @Test
    void timestampHeader_signedExactlyAsReceived() {
        String ts     = String.valueOf(NOW.toEpochMilli());
        String padded = " " + ts + " ";

        assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, padded, SECRET), padded, SECRET))
                .isEqualTo(Verdict.VALID);
        assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, ts, SECRET), padded, SECRET))
                .isEqualTo(Verdict.BAD_SIGNATURE);
    }

    @Test
    void missingOrMalformedHeaders_rejected() {
        String ts = String.valueOf(NOW.toEpochMilli());
        String sig = WebhookSignatureVerifier.sign(BODY, ts, SECRET);

        assertThat(verifier.check(BODY, null, ts, SECRET)).isEqualTo(Verdict.MISSING_SIGNATURE);
        assertThat(verifier.check(BODY, sig, null, SECRET)).isEqualTo(Verdict.MISSING_TIMESTAMP);
        assertThat(verifier.check(BODY, sig, "yesterday", SECRET)).isEqualTo(Verdict.BAD_TIMESTAMP);
    }

    @Test
    void blankSecret_rejectsEverything() {
        String ts = String.valueOf(NOW.toEpochMilli());

        assertThat(verifier.check(BODY, WebhookSignatureVerifier.sign(BODY, ts, " "), ts, " "))
                .isEqualTo(Verdict.NO_SECRET);
        assertThat(verifier.verify(BODY, "abc", ts, null)).isFalse();
    }
}
