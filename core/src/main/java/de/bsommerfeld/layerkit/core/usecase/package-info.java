/**
 * Uniform calling conventions for application operations.
 *
 * <pre>
 *   [Presentation]
 *        │  call(params)
 *        ▼
 *   UseCase / VoidUseCase / NoParamsUseCase   ← stateless, one repository call
 *        │
 *        ▼
 *   Repository (domain interface)             ← connectivity gate, error mapping
 *        │
 *        ▼
 *   Data sources (remote / local)             ← actual I/O
 * </pre>
 *
 * The three shapes exist so call sites never branch on "has params" or
 * "has result". All of them are asynchronous and return
 * {@link java.util.concurrent.CompletableFuture}.
 */
package de.bsommerfeld.layerkit.core.usecase;
