package de.bsommerfeld.layerkit.app;

import de.bsommerfeld.layerkit.app.config.AppModule;
import de.bsommerfeld.layerkit.auth.data.TestAuthRemoteDataSource;
import de.bsommerfeld.layerkit.auth.domain.AuthRepository;
import de.bsommerfeld.layerkit.auth.domain.GetCurrentUserUseCase;
import de.bsommerfeld.layerkit.auth.domain.LoginUseCase;
import de.bsommerfeld.layerkit.core.config.ApplicationMode;
import de.bsommerfeld.layerkit.core.config.GlobalConfig;
import de.bsommerfeld.layerkit.core.di.ServiceContainer;
import de.bsommerfeld.layerkit.app.presentation.LoginViewModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the console flow end to end in TEST mode: real container, real use
 * cases and repository, in-process data sources.
 */
class LayerkitAppTest {

    @TempDir
    Path tempDir;

    private ServiceContainer container;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() {
        container = LayerkitApp.createContainer(
                new AppModule(new GlobalConfig(), ApplicationMode.TEST, tempDir.resolve("session.json")));
    }

    @AfterEach
    void tearDown() {
        container.close();
    }

    @Test
    void run_shouldExitZeroOnSuccessfulLogin() throws Exception {
        int exitCode = app("").run(new String[] { "a@b.c", TestAuthRemoteDataSource.PASSWORD });

        assertEquals(LayerkitApp.EXIT_OK, exitCode);
        String printed = printed();
        assertTrue(printed.contains("Loading..."));
        assertTrue(printed.indexOf("Loading...") < printed.indexOf("Logged in as a@b.c"), printed);
    }

    @Test
    void run_shouldExitOneOnRejectedCredentials() throws Exception {
        int exitCode = app("").run(new String[] { "a@b.c", "wrong" });

        assertEquals(LayerkitApp.EXIT_FAILED, exitCode);
        assertTrue(printed().contains("Login failed [SERVER_ERROR]: Invalid credentials"));
    }

    @Test
    void run_shouldPromptForMissingArguments() throws Exception {
        int exitCode = app("a@b.c\n" + TestAuthRemoteDataSource.PASSWORD + "\n").run(new String[0]);

        assertEquals(LayerkitApp.EXIT_OK, exitCode);
        assertTrue(printed().contains("Email: "));
    }

    @Test
    void run_shouldFailOnBlankEmail() throws Exception {
        assertEquals(LayerkitApp.EXIT_FAILED, app("\n").run(new String[] { " ", "x" }));
        assertTrue(printed().contains("Login failed: Please enter an email address"));
        assertFalse(printed().contains("SERVER_ERROR"));
    }

    @Test
    void run_shouldRememberSessionForCurrentUser() throws Exception {
        app("").run(new String[] { "a@b.c", TestAuthRemoteDataSource.PASSWORD });

        assertEquals("a@b.c", container.resolve(GetCurrentUserUseCase.class).call().join().email());
    }

    @Test
    void createContainer_shouldShareSingletonsAndCreateFreshViewModels() {
        assertSame(container.resolve(AuthRepository.class), container.resolve(AuthRepository.class));
        assertSame(container.resolve(LoginUseCase.class), container.resolve(LoginUseCase.class));
        assertNotSame(container.resolve(LoginViewModel.class), container.resolve(LoginViewModel.class));
    }

    private LayerkitApp app(String input) {
        return new LayerkitApp(container, new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
