package in.mechmate.infrastructure.push;

import in.mechmate.application.port.output.PushTransport;
import in.mechmate.domain.model.PushResult;
import in.mechmate.domain.model.PushSubscription;
import nl.martijndwars.webpush.Notification;
import nl.martijndwars.webpush.PushService;
import org.apache.http.HttpResponse;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Security;
import java.security.spec.InvalidKeySpecException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Web Push (RFC 8030 / 8291) transport authenticated with VAPID keys.
 *
 * Without all three VAPID settings the transport reports itself unconfigured
 * and every send fails without touching the network.
 *
 * Failure classification:
 * - 404 / 410, undecodable subscription keys, or an error mentioning "invalid" → PERMANENTLY_INVALID
 * - any other non-2xx, timeout, I/O error, crypto provider fault → TRANSIENT_FAILURE
 *
 * A timed-out request is cancelled so its async client and socket are released.
 */
public final class WebPushTransport implements PushTransport {
    private static final Logger log = LoggerFactory.getLogger(WebPushTransport.class);

    private final PushService pushService;   // null when not configured
    private final String publicKey;
    private final Duration timeout;

    public WebPushTransport(String publicKey, String privateKey, String subject, Duration timeout) {
        this.publicKey = publicKey;
        this.timeout = timeout;

        if (isBlank(publicKey) || isBlank(privateKey) || isBlank(subject)) {
            log.warn("[PUSH] Push notifications not configured. VAPID keys missing from environment variables.");
            this.pushService = null;
            return;
        }

        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        try {
            this.pushService = new PushService(publicKey, privateKey, subject);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Invalid VAPID key pair", e);
        }
        log.info("[PUSH] Web push initialized (subject={}, timeout={}s)", subject, timeout.getSeconds());
    }

    @Override
    public boolean isConfigured() {
        return pushService != null;
    }

    @Override
    public String publicKey() {
        return publicKey;
    }

    @Override
    public PushResult send(PushSubscription subscription, String jsonPayload) {
        if (pushService == null) {
            return PushResult.transientFailure(0, "VAPID keys not configured");
        }

        Future<HttpResponse> pending;
        try {
            Notification notification = new Notification(
                subscription.endpoint(),
                subscription.p256dhKey(),
                subscription.authKey(),
                jsonPayload.getBytes(StandardCharsets.UTF_8));
            pending = pushService.sendAsync(notification);
        } catch (Exception e) {
            return classifySetupFailure(e);
        }

        try {
            HttpResponse response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return classify(response.getStatusLine().getStatusCode(), response.getStatusLine().getReasonPhrase());
        } catch (TimeoutException e) {
            // Cancelling closes the per-request async client
            pending.cancel(true);
            return PushResult.transientFailure(0, "timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return PushResult.transientFailure(0, "interrupted");
        } catch (ExecutionException e) {
            return classifyFailure(e.getCause() != null ? e.getCause() : e);
        }
    }

    static PushResult classify(int statusCode, String reason) {
        if (statusCode >= 200 && statusCode < 300) {
            return PushResult.delivered(statusCode);
        }
        if (statusCode == 404 || statusCode == 410 || mentionsInvalid(reason)) {
            return PushResult.permanentlyInvalid(statusCode, reason);
        }
        return PushResult.transientFailure(statusCode, reason);
    }

    /**
     * Failure while encrypting or signing, before any request was sent.
     */
    static PushResult classifySetupFailure(Exception error) {
        if (error instanceof InvalidKeySpecException || error instanceof InvalidKeyException) {
            return PushResult.permanentlyInvalid(0, "invalid subscription keys: " + error.getMessage());
        }
        if (error instanceof GeneralSecurityException) {
            // Missing provider or algorithm is a server fault, never the subscriber's
            log.error("[PUSH] Crypto setup failure: {}", error.getMessage(), error);
            return PushResult.transientFailure(0, "crypto failure: " + error.getMessage());
        }
        return classifyFailure(error);
    }

    static PushResult classifyFailure(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (message.contains("410") || mentionsInvalid(message)) {
            return PushResult.permanentlyInvalid(0, message);
        }
        return PushResult.transientFailure(0, message);
    }

    private static boolean mentionsInvalid(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains("invalid");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
