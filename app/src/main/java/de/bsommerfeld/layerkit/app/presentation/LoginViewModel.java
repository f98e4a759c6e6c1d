package de.bsommerfeld.layerkit.app.presentation;

import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.layerkit.app.presentation.AuthEvents.AuthStateChanged;
import de.bsommerfeld.layerkit.app.presentation.AuthEvents.LoginSubmitted;
import de.bsommerfeld.layerkit.app.presentation.AuthEvents.LogoutRequested;
import de.bsommerfeld.layerkit.app.presentation.AuthEvents.SessionCheckRequested;
import de.bsommerfeld.layerkit.auth.domain.GetCurrentUserUseCase;
import de.bsommerfeld.layerkit.auth.domain.LoginParams;
import de.bsommerfeld.layerkit.auth.domain.LoginUseCase;
import de.bsommerfeld.layerkit.auth.domain.LogoutParams;
import de.bsommerfeld.layerkit.auth.domain.LogoutUseCase;
import de.bsommerfeld.layerkit.core.event.ApplicationEventBus;
import de.bsommerfeld.layerkit.core.failure.Failure;
import de.bsommerfeld.layerkit.core.failure.FailureException;
import de.bsommerfeld.layerkit.core.failure.FailureKind;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Turns authentication requests from the event bus into use-case calls and
 * their outcomes into {@link LoginState}s.
 *
 * <p>
 * Every accepted request publishes {@code LOADING} first and exactly one
 * terminal state afterwards. All states are posted from one dedicated thread
 * in the order they were produced, no matter which thread completes the use
 * case's future. A post from inside a subscriber is only queued behind the
 * running dispatch, so states are never posted inline.
 *
 * <h3>Outcomes</h3>
 * <ul>
 * <li>login: {@code AUTHENTICATED}, or {@code FAILED} with the failure</li>
 * <li>logout: {@code UNAUTHENTICATED}, or {@code FAILED}</li>
 * <li>session check: {@code AUTHENTICATED}; a server error means the
 * session is gone ({@code UNAUTHENTICATED}); no connectivity is
 * {@code FAILED} since nothing could be verified</li>
 * </ul>
 * A blank email never reaches the use case and fails with a validation
 * message instead of a {@link Failure}.
 */
public class LoginViewModel implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LoginViewModel.class);

    private final ApplicationEventBus eventBus;
    private final LoginUseCase loginUseCase;
    private final LogoutUseCase logoutUseCase;
    private final GetCurrentUserUseCase getCurrentUserUseCase;

    private final ExecutorService stateExecutor = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                    .setNameFormat("login-state-%d")
                    .setDaemon(true)
                    .build());

    private volatile LoginState state = LoginState.idle();
    private boolean attached;

    @Inject
    public LoginViewModel(ApplicationEventBus eventBus,
            LoginUseCase loginUseCase,
            LogoutUseCase logoutUseCase,
            GetCurrentUserUseCase getCurrentUserUseCase) {
        this.eventBus = eventBus;
        this.loginUseCase = loginUseCase;
        this.logoutUseCase = logoutUseCase;
        this.getCurrentUserUseCase = getCurrentUserUseCase;
    }

    public synchronized void attach() {
        if (!attached) {
            eventBus.register(this);
            attached = true;
        }
    }

    public synchronized void detach() {
        if (attached) {
            eventBus.unregister(this);
            attached = false;
        }
    }

    /** Detaches from the bus and stops the publishing thread. Pending states are still delivered. */
    @Override
    public void close() {
        detach();
        stateExecutor.shutdown();
    }

    public LoginState getState() {
        return state;
    }

    @Subscribe
    public void onLoginSubmitted(LoginSubmitted event) {
        LoginParams params;
        try {
            params = new LoginParams(event.email(), event.password() != null ? event.password() : "");
        } catch (IllegalArgumentException e) {
            publish(LoginState.invalid("Please enter an email address"));
            return;
        }

        publish(LoginState.loading());
        complete(loginUseCase.call(params), LoginState::authenticated, LoginState::failed);
    }

    @Subscribe
    public void onLogoutRequested(LogoutRequested event) {
        publish(LoginState.loading());
        complete(logoutUseCase.call(new LogoutParams(event.allDevices())),
                ignored -> LoginState.unauthenticated(), LoginState::failed);
    }

    @Subscribe
    public void onSessionCheckRequested(SessionCheckRequested event) {
        publish(LoginState.loading());
        complete(getCurrentUserUseCase.call(), LoginState::authenticated,
                failure -> failure.is(FailureKind.SERVER_ERROR)
                        ? LoginState.unauthenticated(failure)
                        : LoginState.failed(failure));
    }

    private <T> void complete(CompletableFuture<T> pending, Function<T, LoginState> onSuccess,
            Function<Failure, LoginState> onFailure) {
        pending.whenComplete((value, error) -> {
            if (error == null) {
                publish(onSuccess.apply(value));
                return;
            }
            Failure failure = FailureException.extract(error).orElseGet(() -> {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                LOG.error("Unexpected error outside the failure model", cause);
                return Failure.serverError(cause.getMessage() != null
                        ? cause.getMessage()
                        : cause.getClass().getSimpleName());
            });
            publish(onFailure.apply(failure));
        });
    }

    private void publish(LoginState next) {
        try {
            stateExecutor.execute(() -> {
                state = next;
                LOG.debug("Auth state: {}", next.status());
                eventBus.post(new AuthStateChanged(next));
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("View model closed, dropping state {}", next.status());
        }
    }
}
