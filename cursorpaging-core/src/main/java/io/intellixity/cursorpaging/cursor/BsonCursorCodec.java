package io.intellixity.cursorpaging.cursor;

import io.intellixity.cursorpaging.paging.CursorToken;
import io.intellixity.cursorpaging.paging.InvalidCursorException;
import io.intellixity.cursorpaging.paging.SortKeyTuple;
import io.intellixity.cursorpaging.paging.SortSpec;
import org.bson.BsonBinaryReader;
import org.bson.BsonBinaryWriter;
import org.bson.Document;
import org.bson.codecs.BsonValueCodecProvider;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.bson.codecs.DocumentCodecProvider;
import org.bson.codecs.EncoderContext;
import org.bson.codecs.ValueCodecProvider;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.bson.codecs.configuration.CodecRegistries;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.io.BasicOutputBuffer;

import java.nio.ByteBuffer;
import java.util.*;

/**
 * Cursor wire format: a BSON document {@code {field1: v1, field2: v2, ...}} in sort order,
 * encoded as URL-safe base64 without padding.
 *
 * Decoding is strict: the token must be canonical (re-encoding the decoded key reproduces it byte for byte),
 * field names must equal the sort spec's, and values must be scalars. Encoding refuses
 * sub-documents and arrays as well. Nothing is coerced.
 */
public final class BsonCursorCodec implements CursorCodec {
  private static final CodecRegistry REGISTRY = CodecRegistries.fromProviders(
      new ValueCodecProvider(),
      new BsonValueCodecProvider(),
      new DocumentCodecProvider());
  private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64_DECODER = Base64.getUrlDecoder();
  // int32 length + terminating 0x00
  private static final int MIN_DOCUMENT_SIZE = 5;

  private final DocumentCodec codec = new DocumentCodec(REGISTRY);

  @Override
  public CursorToken encode(SortKeyTuple tuple) {
    Objects.requireNonNull(tuple, "tuple");
    Document doc = new Document();
    for (int i = 0; i < tuple.size(); i++) {
      Object v = tuple.value(i);
      if (!isScalar(v)) {
        throw new IllegalArgumentException("Sort key value for '" + tuple.fields().get(i) + "' is not a scalar: "
            + v.getClass().getName());
      }
      doc.append(tuple.fields().get(i), v);
    }
    return new CursorToken(B64.encodeToString(toBytes(doc)));
  }

  @Override
  public SortKeyTuple decode(CursorToken token, SortSpec sort) {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(sort, "sort");

    byte[] bytes;
    try {
      bytes = B64_DECODER.decode(token.value());
    } catch (IllegalArgumentException e) {
      throw new InvalidCursorException("Cursor is not valid base64url", e);
    }
    checkLengthPrefix(bytes);

    Document doc;
    try (BsonBinaryReader reader = new BsonBinaryReader(ByteBuffer.wrap(bytes))) {
      doc = codec.decode(reader, DecoderContext.builder().build());
    } catch (RuntimeException e) {
      throw new InvalidCursorException("Cursor is not a valid BSON document", e);
    }

    List<String> expected = sort.fieldNames();
    List<String> actual = new ArrayList<>(doc.keySet());
    if (!expected.equals(actual)) {
      throw new InvalidCursorException("Cursor fields " + actual + " do not match sort fields " + expected);
    }
    for (Map.Entry<String, Object> e : doc.entrySet()) {
      if (!isScalar(e.getValue())) {
        throw new InvalidCursorException("Cursor value for '" + e.getKey() + "' is not a scalar");
      }
    }

    SortKeyTuple tuple = new SortKeyTuple(actual, new ArrayList<>(doc.values()));
    String canonical;
    try {
      canonical = encode(tuple).value();
    } catch (IllegalArgumentException e) {
      throw new InvalidCursorException("Cursor holds a value that cannot be re-encoded", e);
    }
    if (!canonical.equals(token.value())) {
      throw new InvalidCursorException("Cursor is not in canonical form");
    }
    return tuple;
  }

  private byte[] toBytes(Document doc) {
    BasicOutputBuffer buffer = new BasicOutputBuffer();
    try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
      codec.encode(writer, doc, EncoderContext.builder().build());
    } catch (CodecConfigurationException e) {
      throw new IllegalArgumentException("Sort key value cannot be encoded as BSON: " + e.getMessage(), e);
    }
    return buffer.toByteArray();
  }

  /** Sub-documents and arrays cannot be compared by a seek predicate. */
  private static boolean isScalar(Object v) {
    return !(v instanceof Map<?, ?> || v instanceof Iterable<?> || (v != null && v.getClass().isArray() && !(v instanceof byte[])));
  }

  private static void checkLengthPrefix(byte[] bytes) {
    if (bytes.length < MIN_DOCUMENT_SIZE) {
      throw new InvalidCursorException("Cursor is too short to be a BSON document");
    }
    int declared = (bytes[0] & 0xff)
        | (bytes[1] & 0xff) << 8
        | (bytes[2] & 0xff) << 16
        | (bytes[3] & 0xff) << 24;
    if (declared != bytes.length) {
      throw new InvalidCursorException("Cursor BSON length " + declared + " does not match payload length " + bytes.length);
    }
  }
}
