/**
 * Builds {@link works.bosk.pvl.model.PvlModule}s from
 * {@link works.bosk.pvl.lexer.Token}s.
 */
package works.bosk.pvl.parser;
