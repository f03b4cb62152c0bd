/**
 * Entry points for decoding JSON text.
 * {@link works.jsonfsm.codec.JsonDecoder} decodes complete texts;
 * {@link works.jsonfsm.codec.IncrementalDecoder} accepts input one code point at a time.
 * Both are configured with {@link works.jsonfsm.codec.DecoderSettings}.
 */
package works.jsonfsm.codec;
