package org.kestrel.compiler.module;

import org.kestrel.compiler.config.SemaConfig;
import org.kestrel.compiler.diagnostics.DiagnosticsSink;

/**
 * The collaborators an analysis reaches outside the declaration being analyzed.
 *
 * @param diagnostics  Receives errors and compile-log output.
 * @param declarations Resolves references to other declarations.
 * @param imports      Loads imported files.
 * @param errors       Interns error names.
 * @param config       The analysis settings.
 */
public record SemaContext(DiagnosticsSink diagnostics, DeclarationRegistry declarations, ImportResolver imports,
                          ErrorInterner errors, SemaConfig config) {}
