package com.github.simbo1905.pingstore;

import static org.junit.Assert.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class PingCodecTest {

  private final PingCodec codec = new PingCodec();

  @Test
  public void testEncodedDocumentHasPathAndPayload() {
    final Ping ping = new Ping(3, "/submit/core", JsonFilePingStoreTest.generatePayload());

    final JsonObject document =
        JsonParser.parseString(new String(codec.encode(ping), StandardCharsets.UTF_8))
            .getAsJsonObject();

    assertEquals("/submit/core", document.get(PingCodec.KEY_URL_PATH).getAsString());
    assertEquals(JsonFilePingStoreTest.generatePayload(), document.getAsJsonObject(PingCodec.KEY_PAYLOAD));
    assertFalse("id lives in the file name only", document.has("id"));
  }

  @Test
  public void testNullsInsidePayloadAreWritten() {
    final String json =
        new String(
            codec.encode(new Ping(1, "u", JsonFilePingStoreTest.generatePayload())),
            StandardCharsets.UTF_8);
    assertTrue(json, json.contains("\"null\":null"));
  }

  @Test
  public void testDecodeUsesIdFromCaller() {
    final byte[] bytes = "{\"path\":\"p\",\"payload\":{\"a\":[1,2]}}".getBytes(StandardCharsets.UTF_8);
    final Ping ping = codec.decode(77, bytes);
    assertEquals(77, ping.getId());
    assertEquals("p", ping.getDestination());
    assertEquals(2, ping.getPayload().getAsJsonArray("a").size());
  }

  @Test
  public void testInvalidUtf8IsRejectedNotReplaced() {
    final byte[] bytes = "{\"path\":\"p\",\"payload\":{\"k\":\"??\"}}".getBytes(StandardCharsets.UTF_8);
    final int at = new String(bytes, StandardCharsets.UTF_8).indexOf("??");
    bytes[at] = (byte) 0xff;
    bytes[at + 1] = (byte) 0xfe;

    try {
      codec.decode(1, bytes);
      fail("Expected JsonParseException for invalid UTF-8");
    } catch (JsonParseException e) {
      assertTrue(e.getCause() instanceof CharacterCodingException);
    }
  }

  @Test
  public void testMultiByteUtf8Decodes() {
    final byte[] bytes =
        "{\"path\":\"p\",\"payload\":{\"k\":\"caf\u00e9 \u00fc\"}}".getBytes(StandardCharsets.UTF_8);
    assertEquals("caf\u00e9 \u00fc", codec.decode(1, bytes).getPayload().get("k").getAsString());
  }

  @Test
  public void testDecodeIgnoresUnknownFields() {
    final byte[] bytes =
        "{\"path\":\"p\",\"payload\":{},\"extra\":true}".getBytes(StandardCharsets.UTF_8);
    assertEquals(new Ping(1, "p", new JsonObject()), codec.decode(1, bytes));
  }

  @Test
  public void testMalformedDocumentsAreRejected() {
    final String[] malformed = {
      "",
      "{not json",
      "[]",
      "\"just a string\"",
      "{\"payload\":{}}",
      "{\"path\":\"p\"}",
      "{\"path\":7,\"payload\":{}}",
      "{\"path\":\"p\",\"payload\":[]}",
      "{\"path\":\"p\",\"payload\":null}",
      "{\"path\":\"\",\"payload\":{}}",
    };
    for (String document : malformed) {
      try {
        codec.decode(1, document.getBytes(StandardCharsets.UTF_8));
        fail("Expected JsonParseException for: " + document);
      } catch (JsonParseException expected) {
        // expected
      }
    }
  }
}
