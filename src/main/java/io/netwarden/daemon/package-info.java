/**
 * Root daemon package.
 *
 * <p>{@link io.netwarden.daemon.DaemonService} owns the network override and its pause, resume
 * and status calls, serialized on one lock. {@link io.netwarden.daemon.DaemonRunner} supervises
 * the serving and setup workers, and {@link io.netwarden.daemon.ShutdownCoordinator} stops the
 * server on signal or shutdown before asking a running connector to quit.
 */
package io.netwarden.daemon;
