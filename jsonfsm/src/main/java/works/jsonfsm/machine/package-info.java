/**
 * Incremental state machines, one per JSON grammar rule, that decode text one code point at a time.
 * <p>
 * Every machine implements {@link works.jsonfsm.machine.Machine}: it's fed a code point,
 * and returns an {@link works.jsonfsm.machine.Outcome} saying whether it needs more input,
 * has a provisional or final value, or has rejected the input.
 * Machines compose by passing outcomes, never by sharing state:
 * {@link works.jsonfsm.machine.ArrayMachine} and {@link works.jsonfsm.machine.ObjectMachine}
 * each drive nested {@link works.jsonfsm.machine.ValueMachine}s,
 * and {@link works.jsonfsm.machine.ValueMachine} picks among all
 * the {@link works.jsonfsm.machine.Grammar} alternatives based on the first code point.
 * <p>
 * This layer is not really meant to be used directly;
 * {@link works.jsonfsm.codec.JsonDecoder} drives it on behalf of callers.
 */
package works.jsonfsm.machine;
