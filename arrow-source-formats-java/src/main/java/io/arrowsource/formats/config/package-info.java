/** Immutable configuration of deserializers: formats, framing, bad data policy and buffering. */
package io.arrowsource.formats.config;
