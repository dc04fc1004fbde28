/**
 * Turns text into {@link works.bosk.pvl.lexer.Token}s.
 * The main abstraction is {@link works.bosk.pvl.lexer.Lexer},
 * a lazy token stream with push-back.
 * It knows just enough about PVL syntax to find token boundaries;
 * {@link works.bosk.pvl.lexer.TokenClassifier} answers questions about what each token is.
 */
package works.bosk.pvl.lexer;
