package io.arrowsource.formats.proto;

import com.google.protobuf.AnyProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DurationProto;
import com.google.protobuf.EmptyProto;
import com.google.protobuf.FieldMaskProto;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.StructProto;
import com.google.protobuf.TimestampProto;
import com.google.protobuf.WrappersProto;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Loads message descriptors from a serialized {@code FileDescriptorSet}. */
public final class ProtoSchemas {
  // resolved from the runtime when a set was compiled without --include_imports
  private static final Map<String, Descriptors.FileDescriptor> WELL_KNOWN =
      Map.of(
          "google/protobuf/any.proto", AnyProto.getDescriptor(),
          "google/protobuf/duration.proto", DurationProto.getDescriptor(),
          "google/protobuf/empty.proto", EmptyProto.getDescriptor(),
          "google/protobuf/field_mask.proto", FieldMaskProto.getDescriptor(),
          "google/protobuf/struct.proto", StructProto.getDescriptor(),
          "google/protobuf/timestamp.proto", TimestampProto.getDescriptor(),
          "google/protobuf/wrappers.proto", WrappersProto.getDescriptor());

  private ProtoSchemas() {}

  /**
   * Builds every file of the set and returns the descriptor of the named message.
   *
   * @param compiledSchema a serialized {@code FileDescriptorSet}, as written by {@code protoc
   *     --descriptor_set_out}
   * @param messageName the fully qualified message name, e.g. {@code com.example.Order}
   * @throws ProtoSchemaException if the set cannot be parsed or built, or does not define the
   *     message
   */
  public static Descriptors.Descriptor findMessage(byte[] compiledSchema, String messageName) {
    if (compiledSchema == null) {
      throw new ProtoSchemaException("protobuf format requires a compiled schema");
    }
    FileDescriptorSet set;
    try {
      set = FileDescriptorSet.parseFrom(compiledSchema);
    } catch (InvalidProtocolBufferException e) {
      throw new ProtoSchemaException("invalid file descriptor set: " + e.getMessage(), e);
    }

    Map<String, FileDescriptorProto> protos = new HashMap<>();
    for (FileDescriptorProto file : set.getFileList()) {
      protos.put(file.getName(), file);
    }
    Map<String, Descriptors.FileDescriptor> built = new HashMap<>();
    for (FileDescriptorProto file : set.getFileList()) {
      Descriptors.FileDescriptor descriptor = build(file.getName(), protos, built);
      Descriptors.Descriptor message = find(descriptor.getMessageTypes(), messageName);
      if (message != null) {
        return message;
      }
    }
    throw new ProtoSchemaException(
        "message " + messageName + " is not defined in the compiled schema");
  }

  private static Descriptors.FileDescriptor build(
      String name,
      Map<String, FileDescriptorProto> protos,
      Map<String, Descriptors.FileDescriptor> built) {
    Descriptors.FileDescriptor done = built.get(name);
    if (done != null) {
      return done;
    }
    FileDescriptorProto proto = protos.get(name);
    if (proto == null && WELL_KNOWN.containsKey(name)) {
      return WELL_KNOWN.get(name);
    }
    if (proto == null) {
      throw new ProtoSchemaException("missing dependency " + name + " in the compiled schema");
    }
    Descriptors.FileDescriptor[] dependencies =
        new Descriptors.FileDescriptor[proto.getDependencyCount()];
    for (int i = 0; i < dependencies.length; i++) {
      dependencies[i] = build(proto.getDependency(i), protos, built);
    }
    try {
      Descriptors.FileDescriptor descriptor =
          Descriptors.FileDescriptor.buildFrom(proto, dependencies);
      built.put(name, descriptor);
      return descriptor;
    } catch (Descriptors.DescriptorValidationException e) {
      throw new ProtoSchemaException("invalid file " + name + ": " + e.getMessage(), e);
    }
  }

  private static Descriptors.Descriptor find(
      List<Descriptors.Descriptor> messages, String fullName) {
    for (Descriptors.Descriptor message : messages) {
      if (message.getFullName().equals(fullName)) {
        return message;
      }
      Descriptors.Descriptor nested = find(message.getNestedTypes(), fullName);
      if (nested != null) {
        return nested;
      }
    }
    return null;
  }
}
