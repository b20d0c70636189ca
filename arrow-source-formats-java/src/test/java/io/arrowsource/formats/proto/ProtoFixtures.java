package io.arrowsource.formats.proto;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DynamicMessage;

/**
 * A compiled schema with {@code test.Event} and {@code test.Audit}. {@code audit.proto} imports
 * {@code google/protobuf/timestamp.proto}, which the set leaves out.
 */
public final class ProtoFixtures {
  public static final String EVENT = "test.Event";

  private ProtoFixtures() {}

  private static FieldDescriptorProto field(
      String name, int number, FieldDescriptorProto.Type type) {
    return FieldDescriptorProto.newBuilder()
        .setName(name)
        .setNumber(number)
        .setType(type)
        .setLabel(FieldDescriptorProto.Label.LABEL_OPTIONAL)
        .build();
  }

  private static FieldDescriptorProto messageField(String name, int number, String typeName) {
    return field(name, number, FieldDescriptorProto.Type.TYPE_MESSAGE).toBuilder()
        .setTypeName(typeName)
        .build();
  }

  static FileDescriptorProto eventFile() {
    DescriptorProto detail =
        DescriptorProto.newBuilder()
            .setName("Detail")
            .addField(field("note", 1, FieldDescriptorProto.Type.TYPE_STRING))
            .build();
    DescriptorProto event =
        DescriptorProto.newBuilder()
            .setName("Event")
            .addField(field("id", 1, FieldDescriptorProto.Type.TYPE_INT64))
            .addField(field("name", 2, FieldDescriptorProto.Type.TYPE_STRING))
            .addNestedType(detail)
            .build();
    return FileDescriptorProto.newBuilder()
        .setName("event.proto")
        .setPackage("test")
        .setSyntax("proto3")
        .addMessageType(event)
        .build();
  }

  static FileDescriptorProto auditFile() {
    DescriptorProto audit =
        DescriptorProto.newBuilder()
            .setName("Audit")
            .addField(messageField("event", 1, ".test.Event"))
            .addField(messageField("at", 2, ".google.protobuf.Timestamp"))
            .build();
    return FileDescriptorProto.newBuilder()
        .setName("audit.proto")
        .setPackage("test")
        .setSyntax("proto3")
        .addDependency("event.proto")
        .addDependency("google/protobuf/timestamp.proto")
        .addMessageType(audit)
        .build();
  }

  /** Returns the serialized set, listing the importing file first. */
  public static byte[] compiledSchema() {
    return FileDescriptorSet.newBuilder()
        .addFile(auditFile())
        .addFile(eventFile())
        .build()
        .toByteArray();
  }

  /** Returns a serialized {@code test.Event}. */
  public static byte[] event(long id, String name) {
    Descriptors.Descriptor descriptor = ProtoSchemas.findMessage(compiledSchema(), EVENT);
    return DynamicMessage.newBuilder(descriptor)
        .setField(descriptor.findFieldByName("id"), id)
        .setField(descriptor.findFieldByName("name"), name)
        .build()
        .toByteArray();
  }
}
