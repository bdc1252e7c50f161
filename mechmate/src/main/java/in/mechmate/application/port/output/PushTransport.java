package in.mechmate.application.port.output;

import in.mechmate.domain.model.PushResult;
import in.mechmate.domain.model.PushSubscription;

/**
 * Push channel to subscribed clients.
 *
 * Implementations must bound every call with a timeout and must not throw:
 * every failure is reported as a {@link PushResult}.
 */
public interface PushTransport {

    /**
     * False when credentials are missing; nothing can be delivered.
     */
    boolean isConfigured();

    /**
     * Public application server key handed to browsers when they subscribe.
     */
    String publicKey();

    PushResult send(PushSubscription subscription, String jsonPayload);
}
