/**
 * Exceptions thrown while decoding.
 * <p>
 * {@link works.jsonfsm.exceptions.JsonSyntaxException} reports invalid input;
 * {@link works.jsonfsm.exceptions.JsonProcessingException} reports misuse of the API.
 * Both are unchecked.
 */
package works.jsonfsm.exceptions;
