package de.bsommerfeld.layerkit.app;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.layerkit.app.presentation.AuthEvents.AuthStateChanged;
import de.bsommerfeld.layerkit.app.presentation.AuthEvents.LoginSubmitted;
import de.bsommerfeld.layerkit.app.presentation.LoginState;
import de.bsommerfeld.layerkit.app.presentation.LoginViewModel;
import de.bsommerfeld.layerkit.auth.data.AuthRepositoryImpl;
import de.bsommerfeld.layerkit.auth.domain.AuthRepository;
import de.bsommerfeld.layerkit.auth.domain.GetCurrentUserUseCase;
import de.bsommerfeld.layerkit.auth.domain.LoginUseCase;
import de.bsommerfeld.layerkit.auth.domain.LogoutUseCase;
import de.bsommerfeld.layerkit.core.di.ServiceContainer;
import de.bsommerfeld.layerkit.core.event.ApplicationEventBus;
import de.bsommerfeld.layerkit.core.network.NetworkGuard;
import com.google.inject.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.CompletableFuture;

/**
 * Console front end: logs in with the given credentials and prints every
 * state the view model goes through.
 *
 * <pre>
 * layerkit &lt;email&gt; &lt;password&gt;
 * </pre>
 *
 * Missing arguments are prompted for. Exit code 0 means authenticated.
 */
public final class LayerkitApp {

    private static final Logger LOG = LoggerFactory.getLogger(LayerkitApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private final ServiceContainer container;
    private final BufferedReader in;
    private final PrintStream out;

    LayerkitApp(ServiceContainer container, BufferedReader in, PrintStream out) {
        this.container = container;
        this.in = in;
        this.out = out;
    }

    /**
     * Wires the whole application on top of {@code appModule}, which supplies
     * configuration and the mode-specific adapters.
     */
    public static ServiceContainer createContainer(Module appModule) {
        return ServiceContainer.builder()
                .install(appModule)
                .registerLazySingleton(NetworkGuard.class, NetworkGuard.class)
                .registerLazySingleton(AuthRepository.class, AuthRepositoryImpl.class)
                .registerLazySingleton(LoginUseCase.class,
                        container -> new LoginUseCase(container.resolve(AuthRepository.class)))
                .registerLazySingleton(LogoutUseCase.class, LogoutUseCase.class)
                .registerLazySingleton(GetCurrentUserUseCase.class, GetCurrentUserUseCase.class)
                .registerFactory(LoginViewModel.class, LoginViewModel.class)
                .build();
    }

    int run(String[] args) throws IOException {
        String email = args.length > 0 ? args[0] : prompt("Email: ");
        String password = args.length > 1 ? args[1] : promptPassword();

        ApplicationEventBus eventBus = container.resolve(ApplicationEventBus.class);
        LoginViewModel viewModel = container.resolve(LoginViewModel.class);
        StatePrinter printer = new StatePrinter();

        viewModel.attach();
        eventBus.register(printer);
        try {
            eventBus.post(new LoginSubmitted(email, password));
            LoginState outcome = printer.outcome.join();
            return outcome.status() == LoginState.Status.AUTHENTICATED ? EXIT_OK : EXIT_FAILED;
        } finally {
            eventBus.unregister(printer);
            viewModel.close();
        }
    }

    private String prompt(String label) throws IOException {
        out.print(label);
        out.flush();
        String line = in.readLine();
        return line != null ? line.trim() : "";
    }

    private String promptPassword() throws IOException {
        Console console = System.console();
        if (console != null) {
            char[] password = console.readPassword("Password: ");
            return password != null ? new String(password) : "";
        }
        return prompt("Password: ");
    }

    /** Prints state transitions and remembers the first terminal one. */
    private final class StatePrinter {

        private final CompletableFuture<LoginState> outcome = new CompletableFuture<>();

        @Subscribe
        public void onStateChanged(AuthStateChanged event) {
            LoginState state = event.state();
            switch (state.status()) {
                case AUTHENTICATED:
                    out.println("Logged in as " + state.user().email() + " (id " + state.user().id() + ")");
                    break;
                case FAILED:
                    if (state.failure() != null) {
                        out.println("Login failed [" + state.failure().kind() + "]: " + state.failure().message());
                    } else {
                        out.println("Login failed: " + state.validationError());
                    }
                    break;
                case UNAUTHENTICATED:
                    out.println("Not logged in");
                    break;
                default:
                    out.println(state.status().name().charAt(0) + state.status().name().substring(1).toLowerCase() + "...");
            }
            if (state.status().isTerminal()) {
                LOG.debug("Terminal state reached: {}", state.status());
                outcome.complete(state);
            }
        }
    }
}
