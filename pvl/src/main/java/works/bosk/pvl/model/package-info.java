/**
 * The in-memory form of a decoded document.
 * <p>
 * A {@link works.bosk.pvl.model.PvlModule} is an ordered multi-map of
 * parameter names to {@link works.bosk.pvl.model.Value}s,
 * some of which may themselves be nested
 * {@link works.bosk.pvl.model.PvlGroup}s or {@link works.bosk.pvl.model.PvlObject}s.
 * The same types are the input to the encoder.
 */
package works.bosk.pvl.model;
