package de.bsommerfeld.layerkit.auth.data;

import de.bsommerfeld.layerkit.auth.domain.AuthRepository;
import de.bsommerfeld.layerkit.auth.domain.UserEntity;
import de.bsommerfeld.layerkit.core.failure.Failure;
import de.bsommerfeld.layerkit.core.failure.FailureException;
import de.bsommerfeld.layerkit.core.network.NetworkGuard;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * {@link AuthRepository} backed by a remote API and a locally cached session.
 *
 * <p>
 * Every operation goes through {@link NetworkGuard}: offline means
 * {@code NO_CONNECTIVITY} without touching either data source, any data
 * source error means {@code SERVER_ERROR}. A successful login stores the
 * session (including the access token) locally; logout and the current-user
 * lookup read the token from there.
 */
public class AuthRepositoryImpl implements AuthRepository {

    private static final Logger LOG = LoggerFactory.getLogger(AuthRepositoryImpl.class);

    static final String NO_SESSION = "No active session";

    private final AuthRemoteDataSource remote;
    private final AuthLocalDataSource local;
    private final NetworkGuard guard;

    @Inject
    public AuthRepositoryImpl(AuthRemoteDataSource remote, AuthLocalDataSource local, NetworkGuard guard) {
        this.remote = remote;
        this.local = local;
        this.guard = guard;
    }

    @Override
    public CompletableFuture<UserEntity> login(String email, String password) {
        return guard.call(() -> remote.login(new LoginRequest(email, password)), session -> {
            UserEntity user = session.toEntity();
            local.saveSession(session);
            LOG.info("Logged in as {}", user.email());
            return user;
        });
    }

    @Override
    public CompletableFuture<Void> logout(boolean allDevices) {
        return guard.call(() -> remote.logout(requireSession().accessToken(), allDevices), ignored -> {
            local.clearSession();
            LOG.info("Logged out{}", allDevices ? " on all devices" : "");
            return null;
        });
    }

    @Override
    public CompletableFuture<UserEntity> currentUser() {
        return guard.call(() -> {
            UserModel session = requireSession();
            return remote.currentUser(session.accessToken())
                    .thenApply(fresh -> fresh.withTokenFrom(session));
        }, fresh -> {
            UserEntity user = fresh.toEntity();
            local.saveSession(fresh);
            return user;
        });
    }

    private UserModel requireSession() {
        return local.readSession()
                .filter(session -> session.accessToken() != null && !session.accessToken().isBlank())
                .orElseThrow(() -> new FailureException(Failure.serverError(NO_SESSION)));
    }
}
