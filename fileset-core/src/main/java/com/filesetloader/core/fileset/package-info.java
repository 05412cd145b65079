/**
 * The fileset aggregate and the pieces it materializes.
 *
 * <p>
 * A {@link com.filesetloader.core.fileset.Fileset} reads its manifest,
 * resolves variables, and hands them to the
 * {@link com.filesetloader.core.fileset.ConfigMaterializer} (prospector
 * YAML, pipeline JSON) and to
 * {@link com.filesetloader.core.fileset.PipelineIds} (pipeline ID).
 * </p>
 *
 * @since 1.0.0
 */
package com.filesetloader.core.fileset;
