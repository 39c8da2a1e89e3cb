/**
 * Runtime orchestration package.
 *
 * <p>{@link io.proxygate.runtime.ReconciliationEngine} owns the per-user state machine, retries and
 * the recovery sweep. {@link io.proxygate.runtime.MembershipEventDispatcher} feeds it from a bounded
 * worker pool, and {@link io.proxygate.runtime.ProxyGateRuntime} wires both for the CLI.
 */
package io.proxygate.runtime;
