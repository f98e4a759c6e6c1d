package de.bsommerfeld.layerkit.auth.data;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Session storage that lives as long as the process. Bound in TEST mode.
 */
public class InMemoryAuthLocalDataSource implements AuthLocalDataSource {

    private final AtomicReference<UserModel> session = new AtomicReference<>();

    @Override
    public Optional<UserModel> readSession() {
        return Optional.ofNullable(session.get());
    }

    @Override
    public void saveSession(UserModel session) {
        this.session.set(session);
    }

    @Override
    public void clearSession() {
        session.set(null);
    }
}
