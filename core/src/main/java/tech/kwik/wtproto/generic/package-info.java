/**
 * Generic QUIC constructs used by the WebTransport protocol layer. The variable-length integer defined by QUIC
 * (see https://www.rfc-editor.org/rfc/rfc9000.html#name-variable-length-integer-enc) is used for all integers in
 * HTTP/3 and WebTransport framing.
 */
package tech.kwik.wtproto.generic;
