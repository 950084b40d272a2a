package com.keystone.auth.oauth2;

import com.keystone.auth.Authenticator;
import com.keystone.events.EventBus;
import com.keystone.observability.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One OAuth2 grant flow. Implementations perform the network exchange; this class checks the
 * config and carries the interactive events.
 * <p>
 * An interactive flow dispatches {@link Authenticator#BLOCKING_RESPONSE_REQUIRED} through
 * {@link #requestBlockingResponse(String, String)} and waits for the handler to return.
 */
public abstract class OAuth2Adapter {

    /** Event types relayed to the owning authenticator. */
    public static final List<String> EVENT_TYPES = List.of(
            Authenticator.BLOCKING_RESPONSE_REQUIRED,
            Authenticator.BLOCKING_RESPONSE_OK,
            Authenticator.BLOCKING_RESPONSE_FAILED);

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final OAuth2Authentication authInfo;
    private final List<String> requiredFields;
    private final EventBus events;

    protected OAuth2Adapter(OAuth2Authentication authInfo, List<String> requiredFields) {
        if (authInfo == null) {
            throw new IllegalArgumentException("authInfo must not be null");
        }
        this.authInfo = authInfo;
        this.requiredFields = List.copyOf(requiredFields);
        String owner = getClass().getSimpleName();
        this.events = new EventBus(owner.isEmpty() ? getClass().getName() : owner, EVENT_TYPES);
    }

    public OAuth2Authentication authInfo() {
        return authInfo;
    }

    public EventBus events() {
        return events;
    }

    /**
     * Verifies that every required field is set.
     *
     * @throws OAuth2MisconfigurationException naming the missing fields
     */
    public void checkConfigReadiness() {
        List<String> missing = requiredFields.stream()
                .filter(field -> !authInfo.hasField(field))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new OAuth2MisconfigurationException(
                    getClass().getName() + ": Missing " + String.join(", ", missing));
        }
    }

    /**
     * Runs the grant and returns the token response.
     *
     * @throws com.keystone.auth.InteractionInterruptedException if the user aborts a prompt
     */
    public abstract TokenResponse exchangeTokens(TraceContext trace);

    /** Dispatches a blocking-response request to whoever handles the authenticator's events. */
    protected void requestBlockingResponse(String kind, String url) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", kind);
        details.put("url", url);
        events.dispatch(Authenticator.BLOCKING_RESPONSE_REQUIRED, details);
    }

    /** Turns the whitespace-separated resource URLs into the comma-separated request form. */
    protected static String resourceUrlsForRequest(String resourceUrls) {
        return resourceUrls == null ? null : String.join(",", resourceUrls.trim().split("\\s+"));
    }
}
