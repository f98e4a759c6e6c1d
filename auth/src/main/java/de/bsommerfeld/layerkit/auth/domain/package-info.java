/**
 * Domain layer of the authentication feature: the {@link de.bsommerfeld.layerkit.auth.domain.UserEntity},
 * the params of each use case, the {@link de.bsommerfeld.layerkit.auth.domain.AuthRepository}
 * contract and the use cases calling it. Nothing in here knows about HTTP,
 * files or the connectivity check.
 */
package de.bsommerfeld.layerkit.auth.domain;
