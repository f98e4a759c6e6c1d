package de.bsommerfeld.layerkit.auth.domain;

import de.bsommerfeld.layerkit.core.failure.Failure;
import de.bsommerfeld.layerkit.core.failure.FailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * The use cases are thin: one repository call per invocation, arguments taken
 * from the params only, the repository's future handed back as is.
 */
@ExtendWith(MockitoExtension.class)
class AuthUseCasesTest {

    @Mock
    private AuthRepository repository;

    @Test
    void login_shouldCallRepositoryOnceWithParams() {
        CompletableFuture<UserEntity> future = CompletableFuture.completedFuture(new UserEntity("1", "a@b.c"));
        when(repository.login("a@b.c", "secret")).thenReturn(future);

        CompletableFuture<UserEntity> result = new LoginUseCase(repository).call(new LoginParams("a@b.c", "secret"));

        assertSame(future, result);
        verify(repository, times(1)).login("a@b.c", "secret");
        verifyNoMoreInteractions(repository);
    }

    @Test
    void login_shouldNotCacheResults() {
        when(repository.login(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(new UserEntity("1", "a@b.c")));
        LoginUseCase useCase = new LoginUseCase(repository);
        LoginParams params = new LoginParams("a@b.c", "secret");

        useCase.call(params).join();
        useCase.call(params).join();

        verify(repository, times(2)).login("a@b.c", "secret");
    }

    @Test
    void login_shouldPassFailureThroughUnchanged() {
        FailureException failure = new FailureException(Failure.noConnectivity());
        when(repository.login(anyString(), anyString())).thenReturn(CompletableFuture.failedFuture(failure));

        CompletableFuture<UserEntity> result = new LoginUseCase(repository).call(new LoginParams("a@b.c", "x"));

        var e = assertThrows(java.util.concurrent.CompletionException.class, result::join);
        assertSame(failure, e.getCause());
    }

    @Test
    void logout_shouldForwardAllDevicesFlag() {
        when(repository.logout(true)).thenReturn(CompletableFuture.completedFuture(null));

        new LogoutUseCase(repository).call(new LogoutParams(true)).join();

        verify(repository).logout(true);
        verifyNoMoreInteractions(repository);
    }

    @Test
    void getCurrentUser_shouldDelegateToRepository() {
        UserEntity user = new UserEntity("1", "a@b.c");
        when(repository.currentUser()).thenReturn(CompletableFuture.completedFuture(user));

        assertEquals(user, new GetCurrentUserUseCase(repository).call().join());
        verify(repository).currentUser();
    }
}
