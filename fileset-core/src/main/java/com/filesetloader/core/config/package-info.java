/**
 * Reading and merging configuration documents.
 *
 * <p>
 * {@link com.filesetloader.core.config.ManifestLoader} reads a fileset's
 * {@code manifest.yml}; {@link com.filesetloader.core.config.ConfigDocuments}
 * parses YAML (SnakeYAML) and JSON (Jackson) documents;
 * {@link com.filesetloader.core.config.ConfigMerger} deep-merges user
 * overrides into them.
 * </p>
 *
 * @since 1.0.0
 */
package com.filesetloader.core.config;
