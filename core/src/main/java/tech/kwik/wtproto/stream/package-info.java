/**
 * Framing of the header that starts every HTTP/3 unidirectional stream, and dispatching of incoming streams by their
 * stream type.
 */
package tech.kwik.wtproto.stream;
