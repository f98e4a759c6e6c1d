package de.bsommerfeld.layerkit.auth.data;

import java.util.concurrent.CompletableFuture;

/**
 * Remote side of authentication. Implementations do I/O and nothing else:
 * no connectivity checks, no error mapping. Failures surface as exceptionally
 * completed futures, typically with a {@link ServerException}.
 */
public interface AuthRemoteDataSource {

    CompletableFuture<UserModel> login(LoginRequest request);

    CompletableFuture<Void> logout(String accessToken, boolean allDevices);

    CompletableFuture<UserModel> currentUser(String accessToken);
}
