package de.bsommerfeld.layerkit.app.presentation;

/**
 * Events between the console (or any other view) and {@link LoginViewModel}.
 * Views post the requests; the view model answers with
 * {@link AuthStateChanged}.
 */
public class AuthEvents {

    public record LoginSubmitted(String email, String password) {
        @Override
        public String toString() {
            return "LoginSubmitted[email=" + email + ", password=***]";
        }
    }

    public record LogoutRequested(boolean allDevices) {
    }

    /** Asks whether the persisted session is still valid. */
    public record SessionCheckRequested() {
    }

    public record AuthStateChanged(LoginState state) {
    }
}
