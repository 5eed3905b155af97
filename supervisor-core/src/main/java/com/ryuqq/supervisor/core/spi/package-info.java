/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that adapters implement to connect the core to the
 * host environment's resource enumeration and launch facilities.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.core.spi.ExternalHandle} - Live reference to an external resource</li>
 *   <li>{@link com.ryuqq.supervisor.core.spi.HandleFinder} - Class key to current handles lookup</li>
 *   <li>{@link com.ryuqq.supervisor.core.spi.HandleLauncher} - Start an executable and return its handle</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (supervisor-adapter-inmemory, supervisor-adapter-process) provide the
 * concrete implementations.</p>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.spi;
