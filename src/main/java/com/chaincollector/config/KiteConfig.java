package com.chaincollector.config;

import com.chaincollector.broker.CredentialManager;
import com.chaincollector.broker.KiteClientFactory;
import com.chaincollector.broker.KiteMarketDataProvider;
import com.chaincollector.broker.MarketDataProvider;
import com.chaincollector.broker.ProviderCredentials;
import com.chaincollector.exception.CredentialsException;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kite Connect credentials and the beans built from them.
 *
 * <p>Binds to {@code kite.*}. Either value may be left blank; the {@link CredentialManager}
 * then looks for them in the environment variables named by {@code api-key-env} and
 * {@code access-token-env} on first use. With {@code collector.credentials.required=true}
 * startup fails unless a client can be built immediately.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    private String apiKey;

    private String accessToken;

    /** Environment variable consulted when {@code api-key} is blank. */
    private String apiKeyEnv = "KITE_API_KEY";

    /** Environment variable consulted when {@code access-token} is blank. */
    private String accessTokenEnv = "KITE_ACCESS_TOKEN";

    @Bean
    public CredentialManager credentialManager(CollectorProperties collectorProperties) {
        ProviderCredentials initial = ProviderCredentials.builder()
                .apiKey(apiKey)
                .accessToken(accessToken)
                .build();
        log.info("Kite credentials configured: {}", initial);
        CredentialManager manager =
                new CredentialManager(initial, System::getenv, apiKeyEnv, accessTokenEnv, KiteClientFactory.DEFAULT);
        if (collectorProperties.getCredentials().isRequired() && manager.ensureClient().isEmpty()) {
            throw new CredentialsException("Kite credentials are required but neither kite.api-key/kite.access-token"
                    + " nor " + apiKeyEnv + "/" + accessTokenEnv + " are set");
        }
        return manager;
    }

    /**
     * Registered as a bean (not a component) so the resilience4j rate-limiter aspect proxies it.
     */
    @Bean
    public MarketDataProvider marketDataProvider(CredentialManager credentialManager) {
        return new KiteMarketDataProvider(credentialManager);
    }
}
