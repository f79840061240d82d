/**
 * Backend registration, construction and activation.
 *
 * @see calendar.registry.BackendRegistry
 * @see calendar.registry.DefaultBackendRegistry
 */
package calendar.registry;
