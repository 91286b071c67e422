package com.chaincollector.broker;

import com.zerodhatech.kiteconnect.KiteConnect;

/**
 * Builds an authenticated Kite client. Swapped out in tests.
 */
@FunctionalInterface
public interface KiteClientFactory {

    KiteClientFactory DEFAULT = (apiKey, accessToken) -> {
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        kiteConnect.setAccessToken(accessToken);
        return kiteConnect;
    };

    KiteConnect create(String apiKey, String accessToken);
}
