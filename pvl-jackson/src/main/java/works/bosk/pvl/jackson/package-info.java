/**
 * JSON output for PVL labels using Jackson.
 */
package works.bosk.pvl.jackson;
