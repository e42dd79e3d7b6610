package com.sunorcnys;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunorcnys.auth.OAuth2Authenticator;
import com.sunorcnys.auth.OAuthClientCredentials;
import com.sunorcnys.http.HttpTransport;
import com.sunorcnys.http.RetryPolicy;
import com.sunorcnys.http.RetryingExecutor;
import com.sunorcnys.service.AuthorizedApi;
import com.sunorcnys.service.MusicService;
import com.sunorcnys.spotify.SpotifyService;
import com.sunorcnys.store.EncryptingTokenStore;
import com.sunorcnys.store.FileTokenStore;
import com.sunorcnys.store.RedisTokenStore;
import com.sunorcnys.store.TokenEncryption;
import com.sunorcnys.store.TokenStore;
import com.sunorcnys.tidal.TidalService;
import redis.clients.jedis.JedisPool;

import java.util.List;
import java.util.Locale;

/**
 * Wires a {@link MusicService} from configuration: credentials, token store, retrying transport.
 */
public final class MusicServices {

    public static final List<String> NAMES = List.of(SpotifyService.NAME, TidalService.NAME);

    private MusicServices() {}

    public static MusicService create(String name, Config config, HttpTransport transport) {
        return create(name, config, transport, null, new ObjectMapper(), RetryPolicy.defaults());
    }

    /**
     * @param redis pool for a shared token store, or null to keep tokens in files under the cache dir
     */
    public static MusicService create(String name, Config config, HttpTransport transport,
                                      JedisPool redis, ObjectMapper mapper, RetryPolicy policy) {
        String service = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (!NAMES.contains(service)) {
            throw new IllegalArgumentException("Unknown service '" + name + "', expected one of " + NAMES);
        }
        String clientId = config.getClientId(service);
        if (clientId == null) {
            throw new SyncronusException(service, "config",
                    "Missing " + service.toUpperCase(Locale.ROOT) + "_CLIENT_ID");
        }

        boolean spotify = SpotifyService.NAME.equals(service);
        OAuthClientCredentials credentials = new OAuthClientCredentials(
                clientId,
                config.getClientSecret(service),
                config.getRedirectUri(service),
                spotify ? SpotifyService.DEFAULT_SCOPES : TidalService.DEFAULT_SCOPES);

        TokenStore store = tokenStore(service, config, redis, mapper);
        OAuth2Authenticator authenticator = new OAuth2Authenticator(
                spotify ? SpotifyService.PROVIDER : TidalService.PROVIDER, credentials, store, transport);
        AuthorizedApi api = new AuthorizedApi(authenticator, new RetryingExecutor(service, transport, policy), mapper);

        return spotify ? new SpotifyService(authenticator, api) : new TidalService(authenticator, api);
    }

    static TokenStore tokenStore(String service, Config config, JedisPool redis, ObjectMapper mapper) {
        TokenStore store = redis != null
                ? new RedisTokenStore(redis, service, mapper)
                : new FileTokenStore(service, config.getCacheDir().resolve(service + "_token.json"), mapper);
        String masterKey = config.getMasterKey();
        return masterKey != null ? new EncryptingTokenStore(store, new TokenEncryption(masterKey)) : store;
    }
}
