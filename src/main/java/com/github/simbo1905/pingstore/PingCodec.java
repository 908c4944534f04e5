package com.github.simbo1905.pingstore;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/// Converts a [Ping] to and from the JSON document stored in its file:
///
/// <pre>
/// {"path": "/submit/telemetry/...", "payload": { ... }}
/// </pre>
///
/// The id is not part of the document; it is carried by the file name.
final class PingCodec {

  static final String KEY_URL_PATH = "path";
  static final String KEY_PAYLOAD = "payload";

  // serializeNulls so that explicit JSON nulls inside a payload survive a round trip
  private static final Gson gson = new GsonBuilder().serializeNulls().create();

  byte[] encode(Ping ping) {
    final JsonObject document = new JsonObject();
    document.addProperty(KEY_URL_PATH, ping.getDestination());
    document.add(KEY_PAYLOAD, ping.getPayload());
    return gson.toJson(document).getBytes(StandardCharsets.UTF_8);
  }

  /// Parses a stored document.
  ///
  /// @throws JsonParseException if the bytes are not well-formed UTF-8, or are not a JSON
  /// object with a non-empty string `path` and an object `payload`
  Ping decode(long id, byte[] bytes) {
    final JsonElement root = JsonParser.parseString(decodeUtf8(bytes));
    if (root == null || !root.isJsonObject()) {
      throw new JsonParseException("ping document is not a JSON object");
    }
    final JsonObject document = root.getAsJsonObject();

    final JsonElement path = document.get(KEY_URL_PATH);
    if (path == null || !path.isJsonPrimitive() || !path.getAsJsonPrimitive().isString()) {
      throw new JsonParseException("ping document has no string '" + KEY_URL_PATH + "'");
    }
    final JsonElement payload = document.get(KEY_PAYLOAD);
    if (payload == null || !payload.isJsonObject()) {
      throw new JsonParseException("ping document has no object '" + KEY_PAYLOAD + "'");
    }
    try {
      return new Ping(id, path.getAsString(), payload.getAsJsonObject());
    } catch (IllegalArgumentException e) {
      throw new JsonParseException("invalid ping document: " + e.getMessage(), e);
    }
  }

  // new String(bytes, UTF_8) would quietly substitute U+FFFD for bad sequences
  private static String decodeUtf8(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new JsonParseException("ping document is not valid UTF-8", e);
    }
  }
}
