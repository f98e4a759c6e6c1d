package de.bsommerfeld.layerkit.auth.domain;

/**
 * Input of {@link LogoutUseCase}.
 *
 * @param allDevices also revoke the sessions of every other device
 */
public record LogoutParams(boolean allDevices) {
}
