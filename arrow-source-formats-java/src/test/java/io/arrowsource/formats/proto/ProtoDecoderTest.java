package io.arrowsource.formats.proto;

import static org.junit.jupiter.api.Assertions.*;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import io.arrowsource.formats.config.Format;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ProtoDecoderTest {

  private static ProtoDecoder decoder(boolean confluent, boolean lengthDelimited) {
    return new ProtoDecoder(
        Format.Protobuf.builder(ProtoFixtures.EVENT)
            .compiledSchema(ProtoFixtures.compiledSchema())
            .confluentSchemaRegistry(confluent)
            .lengthDelimited(lengthDelimited)
            .build());
  }

  private static byte[] concat(byte[] head, byte[] tail) {
    byte[] out = new byte[head.length + tail.length];
    System.arraycopy(head, 0, out, 0, head.length);
    System.arraycopy(tail, 0, out, head.length, tail.length);
    return out;
  }

  @Test
  void testDecodeToJson() throws InvalidProtocolBufferException {
    String json = decoder(false, false).decodeToJson(ByteBuffer.wrap(ProtoFixtures.event(5, "a")));
    assertEquals("{\"id\":\"5\",\"name\":\"a\"}", json);
  }

  @Test
  void testDefaultValuesArePrinted() throws InvalidProtocolBufferException {
    assertEquals(
        "{\"id\":\"0\",\"name\":\"\"}", decoder(false, false).decodeToJson(ByteBuffer.allocate(0)));
  }

  @Test
  void testConfluentEnvelope() throws InvalidProtocolBufferException {
    ProtoDecoder decoder = decoder(true, false);
    byte[] shortPath = concat(new byte[] {0, 0, 0, 0, 1, 0}, ProtoFixtures.event(7, "b"));
    assertEquals(
        "{\"id\":\"7\",\"name\":\"b\"}", decoder.decodeToJson(ByteBuffer.wrap(shortPath)));

    // explicit path [0]: count 1 and index 0, zig-zag encoded
    byte[] explicitPath = concat(new byte[] {0, 0, 0, 0, 1, 2, 0}, ProtoFixtures.event(8, "c"));
    DynamicMessage message = decoder.decode(ByteBuffer.wrap(explicitPath));
    assertEquals(8L, message.getField(decoder.descriptor().findFieldByName("id")));
  }

  @Test
  void testEnvelopeErrors() {
    ProtoDecoder decoder = decoder(true, false);
    byte[] badMagic = concat(new byte[] {1, 0, 0, 0, 1, 0}, ProtoFixtures.event(7, "b"));
    InvalidProtocolBufferException magic =
        assertThrows(
            InvalidProtocolBufferException.class,
            () -> decoder.decodeToJson(ByteBuffer.wrap(badMagic)));
    assertTrue(magic.getMessage().contains("magic byte"));
    assertThrows(
        InvalidProtocolBufferException.class,
        () -> decoder.decodeToJson(ByteBuffer.wrap(new byte[] {0, 0, 1})));
  }

  @Test
  void testMessageIndexes() throws IOException {
    assertEquals(
        List.of(0), ProtoDecoder.messageIndexes(CodedInputStream.newInstance(new byte[] {0})));
    // count 2, then indexes 1 and 3
    assertEquals(
        List.of(1, 3),
        ProtoDecoder.messageIndexes(CodedInputStream.newInstance(new byte[] {4, 2, 6})));
    assertThrows(
        InvalidProtocolBufferException.class,
        () -> ProtoDecoder.messageIndexes(CodedInputStream.newInstance(new byte[] {1})));
  }

  @Test
  void testLengthDelimited() throws IOException {
    byte[] message = ProtoFixtures.event(9, "d");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    CodedOutputStream coded = CodedOutputStream.newInstance(out);
    coded.writeUInt32NoTag(message.length);
    coded.writeRawBytes(message);
    coded.flush();

    assertEquals(
        "{\"id\":\"9\",\"name\":\"d\"}",
        decoder(false, true).decodeToJson(ByteBuffer.wrap(out.toByteArray())));
  }

  @Test
  void testInvalidMessage() {
    byte[] truncatedTag = {(byte) 0xff, (byte) 0xff};
    assertThrows(
        InvalidProtocolBufferException.class,
        () -> decoder(false, false).decodeToJson(ByteBuffer.wrap(truncatedTag)));
  }

  @Test
  void testConstructionRequiresKnownMessage() {
    assertThrows(
        ProtoSchemaException.class,
        () -> new ProtoDecoder(Format.Protobuf.builder("test.Event").build()));
    assertThrows(
        ProtoSchemaException.class,
        () ->
            new ProtoDecoder(
                Format.Protobuf.builder("test.Nope")
                    .compiledSchema(ProtoFixtures.compiledSchema())
                    .build()));
  }
}
