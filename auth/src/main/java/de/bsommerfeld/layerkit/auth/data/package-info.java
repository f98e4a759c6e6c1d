/**
 * Data layer of the authentication feature.
 *
 * <p>
 * {@link de.bsommerfeld.layerkit.auth.data.AuthRepositoryImpl} combines a
 * remote data source (HTTP in production, in-process in TEST mode) with a
 * local session store (a JSON file in production, memory in TEST mode).
 * The wire model {@link de.bsommerfeld.layerkit.auth.data.UserModel} never
 * leaves this package as such; callers get a
 * {@link de.bsommerfeld.layerkit.auth.domain.UserEntity}.
 */
package de.bsommerfeld.layerkit.auth.data;
