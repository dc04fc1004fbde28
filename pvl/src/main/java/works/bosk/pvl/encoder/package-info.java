/**
 * Writes containers back to text.
 * {@link works.bosk.pvl.encoder.EncoderRules} selects the grammar, layout and
 * {@link works.bosk.pvl.encoder.Conformance} checks;
 * {@link works.bosk.pvl.encoder.Encoder} does the writing.
 */
package works.bosk.pvl.encoder;
