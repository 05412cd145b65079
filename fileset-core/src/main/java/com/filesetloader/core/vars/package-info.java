/**
 * Fileset variables: declarations, host facts and layered resolution.
 *
 * <p>
 * {@link com.filesetloader.core.vars.VariableResolver} turns a manifest's
 * declarations into a {@link com.filesetloader.core.vars.VariableEnvironment}
 * in the order builtin facts, manifest defaults, OS overrides, caller
 * overrides.
 * </p>
 *
 * @since 1.0.0
 */
package com.filesetloader.core.vars;
