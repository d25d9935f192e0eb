/**
 * Remote object store access: session handling, bulk writes, queries and object describe.
 *
 * <p>
 * {@link io.github.yok.forcelink.store.RemoteObjectStore} is the seam used by the core
 * components; {@link io.github.yok.forcelink.store.RestObjectStore} and
 * {@link io.github.yok.forcelink.store.SoapSessionProvider} implement it over HTTP.
 * </p>
 */
package io.github.yok.forcelink.store;
