package io.github.panghy.indexbuild.broker;

/**
 * Object storage layout of index files:
 * {@code <root>/index_files/<buildID>/<indexVersion>/<partitionID>/<segmentID>/<fileKey>}.
 */
public final class IndexFilePaths {

  public static final String SEGMENT_INDEX_PATH = "index_files";

  private IndexFilePaths() {}

  /** {@code <root>/index_files}, the prefix handed to workers. */
  public static String indexFilePrefix(String rootPath) {
    return join(rootPath, SEGMENT_INDEX_PATH);
  }

  /** Directory holding every file of one build, with a trailing {@code /}. */
  public static String buildPrefix(String rootPath, long buildId) {
    return join(rootPath, SEGMENT_INDEX_PATH, Long.toString(buildId)) + "/";
  }

  /** Directory holding the files of one build attempt version, with a trailing {@code /}. */
  public static String segmentIndexPrefix(
      String rootPath, long buildId, long indexVersion, long partitionId, long segmentId) {
    return join(
            rootPath,
            SEGMENT_INDEX_PATH,
            Long.toString(buildId),
            Long.toString(indexVersion),
            Long.toString(partitionId),
            Long.toString(segmentId))
        + "/";
  }

  /** Full key of one index file. */
  public static String filePath(
      String rootPath, long buildId, long indexVersion, long partitionId, long segmentId, String fileKey) {
    return segmentIndexPrefix(rootPath, buildId, indexVersion, partitionId, segmentId) + fileKey;
  }

  /**
   * Extracts the build id from any key below {@code index_files/}.
   *
   * @throws IllegalArgumentException if the key is not an index file path
   */
  public static long parseBuildId(String key) {
    String[] parts = key.split("/");
    for (int i = 0; i < parts.length - 1; i++) {
      if (SEGMENT_INDEX_PATH.equals(parts[i])) {
        try {
          return Long.parseLong(parts[i + 1]);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("invalid build id in index file path: " + key, e);
        }
      }
    }
    throw new IllegalArgumentException("not an index file path: " + key);
  }

  private static String join(String... parts) {
    StringBuilder sb = new StringBuilder();
    for (String p : parts) {
      if (p == null || p.isEmpty()) continue;
      String trimmed = p;
      while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
      if (sb.length() > 0) sb.append('/');
      sb.append(trimmed);
    }
    return sb.toString();
  }
}
