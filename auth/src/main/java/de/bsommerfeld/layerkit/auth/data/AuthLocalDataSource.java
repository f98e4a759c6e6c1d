package de.bsommerfeld.layerkit.auth.data;

import java.util.Optional;

/**
 * Local persistence of the current session. Calls are synchronous and
 * cheap; the repository invokes them inline.
 */
public interface AuthLocalDataSource {

    Optional<UserModel> readSession();

    void saveSession(UserModel session);

    void clearSession();
}
