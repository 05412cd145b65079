/**
 * Loads the filesets of every configured module and exposes their
 * materialized prospector configurations and ingest pipelines.
 *
 * <p>
 * {@link com.filesetloader.registry.FilesetLoaderApp} is the command line
 * entry point; {@link com.filesetloader.registry.RegistryConfig} holds its
 * environment-driven settings.
 * </p>
 */
package com.filesetloader.registry;
