/**
 * Text templating for fileset manifests and configuration files.
 *
 * <p>
 * {@link com.filesetloader.core.template.TemplateEngine} parses a subset of
 * the Go {@code text/template} language into a
 * {@link com.filesetloader.core.template.Template}. Failures surface as
 * {@link com.filesetloader.core.template.TemplateException}, which carries
 * the offending template text.
 * </p>
 *
 * @since 1.0.0
 */
package com.filesetloader.core.template;
