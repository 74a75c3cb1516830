/**
 * Runtime wiring package.
 *
 * <p>{@link io.tierkeeper.runtime.TierKeeperRuntime} builds the store, tier primitives and
 * lifecycle components from resolved settings and exposes the operations used by the CLI.
 */
package io.tierkeeper.runtime;
