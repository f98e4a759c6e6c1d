package de.bsommerfeld.layerkit.auth.data;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link AuthRemoteDataSource} for TEST mode. No request leaves
 * the machine.
 *
 * <p>
 * Any email logs in as long as the password is {@link #PASSWORD}; anything
 * else answers 401 like the real API would. Issued tokens are remembered
 * until logout, so {@link #currentUser} rejects unknown or revoked tokens.
 */
@Singleton
public class TestAuthRemoteDataSource implements AuthRemoteDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(TestAuthRemoteDataSource.class);

    public static final String PASSWORD = "test";

    private final Map<String, UserModel> sessions = new ConcurrentHashMap<>();

    public TestAuthRemoteDataSource() {
        LOG.warn("######################################################");
        LOG.warn("#  TEST MODE ENABLED: Auth requests are NOT sent out  #");
        LOG.warn("######################################################");
    }

    @Override
    public CompletableFuture<UserModel> login(LoginRequest request) {
        if (!PASSWORD.equals(request.password())) {
            return CompletableFuture.failedFuture(new ServerException(401, "Invalid credentials"));
        }
        String id = UUID.nameUUIDFromBytes(request.email().getBytes(StandardCharsets.UTF_8)).toString();
        UserModel session = new UserModel(id, request.email(), UUID.randomUUID().toString());
        sessions.put(session.accessToken(), session);
        return CompletableFuture.completedFuture(session);
    }

    @Override
    public CompletableFuture<Void> logout(String accessToken, boolean allDevices) {
        UserModel session = sessions.remove(accessToken);
        if (session == null) {
            return CompletableFuture.failedFuture(new ServerException(401, "Invalid token"));
        }
        if (allDevices) {
            sessions.values().removeIf(other -> other.id().equals(session.id()));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<UserModel> currentUser(String accessToken) {
        UserModel session = sessions.get(accessToken);
        if (session == null) {
            return CompletableFuture.failedFuture(new ServerException(401, "Invalid token"));
        }
        return CompletableFuture.completedFuture(session);
    }
}
