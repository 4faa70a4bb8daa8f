/**
 * Polarion REST client source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.polarion.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.polarion.client.PolarionClient} wires transport, retrier and decoder for callers.</li>
 *   <li>{@code io.polarion.http.AuthenticatedTransport} sends requests and turns error responses into {@code ApiException}.</li>
 *   <li>{@code io.polarion.field.CustomFields} reads and writes loosely typed custom-field values.</li>
 * </ul>
 */
package io.polarion;
