/**
 * Setting descriptors, the registry, the standard catalog and the live {@code Configuration}.
 * <p><strong>Role:</strong> Bootstrap layer; the registry is populated once at startup and frozen,
 * each process then builds its own configuration from it.</p>
 * <p><strong>Concurrency:</strong> Frozen registries are immutable; configurations are owned by a
 * single thread.</p>
 * <p><strong>Security:</strong> Configuration files are parsed with SnakeYAML's safe constructor.</p>
 */
package ca.gc.cra.rigging.config;
