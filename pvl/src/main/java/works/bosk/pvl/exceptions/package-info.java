/**
 * All failures of this library are unchecked subclasses of
 * {@link works.bosk.pvl.exceptions.PvlException}.
 */
package works.bosk.pvl.exceptions;
