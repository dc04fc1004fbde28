/**
 * Conversion of individual tokens to {@link works.bosk.pvl.model.Value}s.
 */
package works.bosk.pvl.decoder;
