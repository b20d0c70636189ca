/** Protobuf payload decoding against compiled descriptor sets. */
package io.arrowsource.formats.proto;
