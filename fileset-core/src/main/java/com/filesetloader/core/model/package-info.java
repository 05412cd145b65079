/**
 * Domain model of the fileset loader.
 *
 * <ul>
 * <li>{@link com.filesetloader.core.model.Manifest}: contents of a
 * fileset's {@code manifest.yml}</li>
 * <li>{@link com.filesetloader.core.model.ModuleConfig} and
 * {@link com.filesetloader.core.model.FilesetConfig}: user
 * configuration</li>
 * <li>{@link com.filesetloader.core.model.PipelineDefinition}: an ingest
 * pipeline ID and body</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.filesetloader.core.model;
