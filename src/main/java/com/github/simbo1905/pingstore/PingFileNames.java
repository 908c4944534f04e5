package com.github.simbo1905.pingstore;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Encodes ping ids as file names and back. Pure functions with no I/O.
///
/// A ping with id `42` lives in `ping-42.json`. The id is the only run of digits in the
/// name so a generic `[^0-9]*([0-9]+)[^0-9]*` scan of the directory finds it too. Decoding
/// is strict: only the canonical decimal form (no sign, no leading zeros) that fits in a
/// non-negative `long` is accepted, which makes the pair an exact bijection.
public final class PingFileNames {

  static final String PREFIX = "ping-";
  static final String SUFFIX = ".json";

  /// Temporary files used while publishing a ping. Never decodes as a ping name.
  static final String TEMP_PREFIX = ".ping-";
  static final String TEMP_SUFFIX = ".tmp";

  // 19 digits is the width of Long.MAX_VALUE; overflow is caught when parsing
  private static final Pattern PING_FILENAME =
      Pattern.compile(Pattern.quote(PREFIX) + "(0|[1-9][0-9]{0,18})" + Pattern.quote(SUFFIX));

  private PingFileNames() {}

  /// Returns the file name for the given ping id.
  ///
  /// @param id the ping id, must be non-negative
  /// @return the file name, without any directory component
  /// @throws IllegalArgumentException if the id is negative
  public static String filenameFor(long id) {
    if (id < 0) {
      throw new IllegalArgumentException("ping id must be non-negative, got " + id);
    }
    return PREFIX + id + SUFFIX;
  }

  /// Extracts the ping id from a file name produced by [#filenameFor(long)].
  ///
  /// @param filename a bare file name
  /// @return the ping id
  /// @throws IllegalArgumentException if the name is not a ping file name
  public static long idFromFilename(String filename) {
    final OptionalLong id = tryParseId(filename);
    if (id.isEmpty()) {
      throw new IllegalArgumentException("Not a ping file name: " + filename);
    }
    return id.getAsLong();
  }

  /// Non-throwing variant of [#idFromFilename(String)] used when scanning a directory that
  /// may hold temporary or foreign files.
  public static OptionalLong tryParseId(String filename) {
    if (filename == null) {
      return OptionalLong.empty();
    }
    final Matcher matcher = PING_FILENAME.matcher(filename);
    if (!matcher.matches()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(matcher.group(1)));
    } catch (NumberFormatException overflow) {
      return OptionalLong.empty();
    }
  }

  static boolean isTemporaryFilename(String filename) {
    return filename != null && filename.startsWith(TEMP_PREFIX) && filename.endsWith(TEMP_SUFFIX);
  }
}
