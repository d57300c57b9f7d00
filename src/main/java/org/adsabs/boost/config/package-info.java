/**
 * <strong>Purpose:</strong> Configuration loading, validation and wiring.
 * <p>YAML documents are flattened by {@link org.adsabs.boost.config.YamlConfigLoader}, merged with
 * CLI overrides and defaults by {@link org.adsabs.boost.config.ConfigMerger}, then turned into the
 * immutable {@link org.adsabs.boost.config.BoostConfig} and
 * {@link org.adsabs.boost.config.PipelineSettings} consumed by the
 * {@link org.adsabs.boost.config.CompositionRoot}.</p>
 *
 * @since 0.1.0
 */
package org.adsabs.boost.config;
