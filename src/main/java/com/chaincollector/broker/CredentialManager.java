package com.chaincollector.broker;

import com.chaincollector.exception.CredentialsException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.PermissionException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the broker credentials and the lazily built {@link KiteConnect} client.
 *
 * <p>The client is built on first use from the current {@link ProviderCredentials} snapshot.
 * When the snapshot is incomplete the environment is consulted again, so credentials exported
 * after startup are picked up without a restart. A failed build, an auth-class error reported
 * by the provider, or the SDK session-expiry hook marks the manager auth-failed: no further
 * build is attempted until {@link #updateCredentials} is called with a rebuild.
 *
 * <p>Client construction and credential swaps are serialized by one lock. Reads of the current
 * snapshot and client are lock-free.
 */
public class CredentialManager {

    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    private static final List<String> AUTH_MARKERS =
            List.of("auth", "token", "unauthorized", "forbidden", "expired");

    private final UnaryOperator<String> environment;
    private final String apiKeyEnv;
    private final String accessTokenEnv;
    private final KiteClientFactory clientFactory;

    private final ReentrantLock clientLock = new ReentrantLock();

    private volatile ProviderCredentials credentials;
    private volatile KiteConnect client;
    private volatile boolean authFailed;
    private volatile String authFailureReason;

    public CredentialManager(
            ProviderCredentials initial,
            UnaryOperator<String> environment,
            String apiKeyEnv,
            String accessTokenEnv,
            KiteClientFactory clientFactory) {
        this.credentials = initial != null ? initial : ProviderCredentials.empty();
        this.environment = environment;
        this.apiKeyEnv = apiKeyEnv;
        this.accessTokenEnv = accessTokenEnv;
        this.clientFactory = clientFactory;
    }

    /**
     * Builds the client if possible.
     *
     * @return the client, or empty when credentials are still missing or auth has failed
     * @throws CredentialsException when the client build itself fails
     */
    public Optional<KiteConnect> ensureClient() {
        KiteConnect current = client;
        if (current != null) {
            return Optional.of(current);
        }
        if (authFailed) {
            return Optional.empty();
        }
        clientLock.lock();
        try {
            if (client != null) {
                return Optional.of(client);
            }
            if (!credentials.isComplete() && !discoverFromEnvironment()) {
                return Optional.empty();
            }
            client = build(credentials);
            return Optional.of(client);
        } finally {
            clientLock.unlock();
        }
    }

    /**
     * The client, building it first if needed.
     *
     * @throws CredentialsException when no client can be produced
     */
    public KiteConnect requireClient() {
        return ensureClient().orElseThrow(() -> new CredentialsException(authFailed
                ? "Kite authentication failed: " + authFailureReason
                : "Kite credentials not configured (set " + apiKeyEnv + " and " + accessTokenEnv + ")"));
    }

    /**
     * Applies new credentials. Blank arguments keep the current values.
     *
     * @param rebuild drop the current client and auth-failed state, then build again
     */
    public void updateCredentials(String apiKey, String accessToken, boolean rebuild) {
        clientLock.lock();
        try {
            credentials = credentials.withUpdates(apiKey, accessToken);
            if (!rebuild) {
                log.info("Credentials updated, client rebuild deferred");
                return;
            }
            authFailed = false;
            authFailureReason = null;
            client = null;
        } finally {
            clientLock.unlock();
        }
        ensureClient();
    }

    public void markAuthFailed(String reason) {
        if (!authFailed) {
            log.warn("Kite authentication marked failed: {}", reason);
        }
        authFailureReason = reason;
        authFailed = true;
        client = null;
    }

    public boolean isAuthFailed() {
        return authFailed;
    }

    public boolean hasClient() {
        return client != null;
    }

    public ProviderCredentials getCredentials() {
        return credentials;
    }

    /**
     * True for errors that mean the session or key is no longer valid: Kite token and permission
     * exceptions anywhere in the cause chain, or a message naming an auth condition.
     */
    public static boolean isAuthError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TokenException || t instanceof PermissionException) {
                return true;
            }
            String message = t instanceof KiteException ? ((KiteException) t).message : t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : AUTH_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    // ---- Private helpers ----

    private boolean discoverFromEnvironment() {
        String apiKey = environment.apply(apiKeyEnv);
        String accessToken = environment.apply(accessTokenEnv);
        ProviderCredentials refreshed = credentials.withUpdates(apiKey, accessToken);
        if (!refreshed.isComplete()) {
            return false;
        }
        credentials = refreshed.toBuilder().discovered(true).build();
        log.info("Discovered Kite credentials from environment (late init): {}", credentials);
        return true;
    }

    private KiteConnect build(ProviderCredentials snapshot) {
        try {
            KiteConnect kiteConnect = clientFactory.create(snapshot.getApiKey(), snapshot.getAccessToken());
            kiteConnect.setSessionExpiryHook(() -> markAuthFailed("session expired (SDK hook)"));
            log.info("Kite client initialized with API key {}", ProviderCredentials.mask(snapshot.getApiKey()));
            return kiteConnect;
        } catch (RuntimeException e) {
            authFailed = true;
            authFailureReason = e.getMessage();
            log.warn("Kite client initialization failed: {}", e.getMessage());
            throw new CredentialsException("Failed to initialize Kite client: " + e.getMessage(), e);
        }
    }
}
