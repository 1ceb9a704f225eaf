/**
 * Configuration loading and validation for the detector ensemble.
 *
 * <p>
 * The ensemble is defined in YAML and loaded by
 * {@link com.ensemblesentinel.core.config.EnsembleConfigLoader} into an
 * {@link com.ensemblesentinel.core.config.EnsembleConfig} instance. Validation
 * is performed automatically after parsing; any problem surfaces as a
 * {@link com.ensemblesentinel.core.config.ConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.ensemblesentinel.core.config;
