/**
 * Incremental, non-blocking reading and writing of QUIC variable-length integers and byte ranges. A {@link
 * tech.kwik.wtproto.bytes.async.Task} is resumed by polling until it is ready; partially transferred bytes are kept
 * in the task, so abandoning a pending task loses them.
 */
package tech.kwik.wtproto.bytes.async;
