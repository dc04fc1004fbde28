/**
 * Reads and writes the Parameter Value Language and its relatives, ODL, PDS3 and ISIS labels.
 * <p>
 * Start with {@link works.bosk.pvl.Pvl}.
 */
package works.bosk.pvl;
