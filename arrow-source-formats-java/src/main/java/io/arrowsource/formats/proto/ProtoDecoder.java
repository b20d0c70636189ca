package io.arrowsource.formats.proto;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import io.arrowsource.formats.config.Format;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes protobuf payloads into JSON text.
 *
 * <p>Payloads may carry the Confluent schema registry envelope: a zero magic byte, a big-endian
 * 4-byte schema id and the zig-zag varint encoded message index path. The envelope is validated
 * and stripped; the message type is always the configured one. Field names are printed as declared
 * in the {@code .proto} file, and fields holding their default value are printed too, so that
 * schemas built from proto field names see every column.
 */
public final class ProtoDecoder {
  private static final byte MAGIC_BYTE = 0;

  private final Descriptors.Descriptor descriptor;
  private final boolean confluentSchemaRegistry;
  private final boolean lengthDelimited;
  private final JsonFormat.Printer printer;

  public ProtoDecoder(Format.Protobuf format) {
    this(
        ProtoSchemas.findMessage(format.compiledSchema(), format.messageName()),
        format.confluentSchemaRegistry(),
        format.lengthDelimited());
  }

  public ProtoDecoder(
      Descriptors.Descriptor descriptor, boolean confluentSchemaRegistry, boolean lengthDelimited) {
    this.descriptor = descriptor;
    this.confluentSchemaRegistry = confluentSchemaRegistry;
    this.lengthDelimited = lengthDelimited;
    this.printer =
        JsonFormat.printer()
            .preservingProtoFieldNames()
            .includingDefaultValueFields()
            .omittingInsignificantWhitespace();
  }

  public Descriptors.Descriptor descriptor() {
    return descriptor;
  }

  /**
   * Decodes one payload.
   *
   * @return the message as compact JSON
   * @throws InvalidProtocolBufferException if the envelope or the message is malformed
   */
  public String decodeToJson(ByteBuffer payload) throws InvalidProtocolBufferException {
    return printer.print(decode(payload));
  }

  /** Decodes one payload into a dynamic message. */
  public DynamicMessage decode(ByteBuffer payload) throws InvalidProtocolBufferException {
    ByteBuffer body = payload.duplicate();
    if (confluentSchemaRegistry) {
      body = stripEnvelope(body);
    }
    CodedInputStream input = CodedInputStream.newInstance(body);
    try {
      if (lengthDelimited) {
        int length = input.readRawVarint32();
        int limit = input.pushLimit(length);
        DynamicMessage message = DynamicMessage.parseFrom(descriptor, input);
        input.popLimit(limit);
        return message;
      }
      return DynamicMessage.parseFrom(descriptor, input);
    } catch (InvalidProtocolBufferException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidProtocolBufferException(e);
    }
  }

  /**
   * Strips the Confluent envelope and returns the message bytes.
   *
   * @throws InvalidProtocolBufferException if the magic byte is wrong or the payload is truncated
   */
  static ByteBuffer stripEnvelope(ByteBuffer payload) throws InvalidProtocolBufferException {
    if (payload.remaining() < 5) {
      throw new InvalidProtocolBufferException(
          "payload of " + payload.remaining() + " bytes is too short for the registry envelope");
    }
    byte magic = payload.get();
    if (magic != MAGIC_BYTE) {
      throw new InvalidProtocolBufferException("unknown magic byte " + magic);
    }
    payload.getInt();
    ByteBuffer rest = payload.slice();
    CodedInputStream input = CodedInputStream.newInstance(rest.duplicate());
    try {
      messageIndexes(input);
    } catch (InvalidProtocolBufferException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidProtocolBufferException(e);
    }
    rest.position(input.getTotalBytesRead());
    return rest.slice();
  }

  /** Reads the message index path; a single zero stands for the first message of the file. */
  static List<Integer> messageIndexes(CodedInputStream input) throws IOException {
    int count = input.readSInt32();
    if (count == 0) {
      return List.of(0);
    }
    if (count < 0) {
      throw new InvalidProtocolBufferException("negative message index count " + count);
    }
    List<Integer> indexes = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      indexes.add(input.readSInt32());
    }
    return indexes;
  }
}
