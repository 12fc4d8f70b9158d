/**
 * NetWarden source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.netwarden.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.netwarden.cli.NetWardenCommand} maps commands to the daemon and connector clients.</li>
 *   <li>{@code io.netwarden.daemon.DaemonRunner} runs the root daemon that owns the network override.</li>
 *   <li>{@code io.netwarden.connector.ConnectorRunner} runs the downstream daemon that executes remote commands.</li>
 *   <li>{@code io.netwarden.rpc.LocalSocketServer} is the Unix socket transport both daemons serve on.</li>
 * </ul>
 */
package io.netwarden;
