/**
 * The in-memory tree produced by decoding JSON text.
 * <p>
 * {@link works.jsonfsm.value.JsonValue} is a closed hierarchy with one type per JSON value kind.
 * All types are immutable and compare structurally.
 */
package works.jsonfsm.value;
