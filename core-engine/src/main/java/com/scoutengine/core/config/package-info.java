/**
 * Configuration loading and validation for the detection engine.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.scoutengine.core.config.RulesLoader} into a
 * {@link com.scoutengine.core.config.RulesConfig} instance, validated right
 * after parsing. Engine tuning lives in
 * {@link com.scoutengine.core.config.EngineConfig}, resolved from environment
 * variables.
 * </p>
 *
 * @since 1.0.0
 */
package com.scoutengine.core.config;
