/**
 * ProxyGate source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.proxygate.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.proxygate.cli.ProxyGateCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.proxygate.runtime.ReconciliationEngine} applies membership events to credentials.</li>
 *   <li>{@code io.proxygate.storage.CredentialStore} is the authoritative persistence layer.</li>
 *   <li>{@code io.proxygate.provision.MtProxyProvisioner} is the only code that touches the proxy server.</li>
 * </ul>
 */
package io.proxygate;
