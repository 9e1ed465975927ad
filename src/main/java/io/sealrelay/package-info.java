/**
 * SealRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sealrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.sealrelay.cli.SealRelayCommand} maps commands to the client and relay APIs.</li>
 *   <li>{@code io.sealrelay.protocol.SessionProtocol} turns bundles and plaintext into envelopes and back.</li>
 *   <li>{@code io.sealrelay.material.MaterialStore} keeps identity, prekeys, sessions and inbox encrypted at rest.</li>
 *   <li>{@code io.sealrelay.relay.RelayService} owns registration, the bundle directory and the delivery queue.</li>
 * </ul>
 */
package io.sealrelay;
