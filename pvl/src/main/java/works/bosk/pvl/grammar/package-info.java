/**
 * Table-driven descriptions of the PVL dialect family.
 * A {@link works.bosk.pvl.grammar.Grammar} parameterizes the lexer, decoder, parser and encoder;
 * it has no behaviour beyond lookups.
 */
package works.bosk.pvl.grammar;
