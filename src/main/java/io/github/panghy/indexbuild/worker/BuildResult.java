package io.github.panghy.indexbuild.worker;

import java.util.List;

/**
 * Output of a successful build.
 *
 * @param fileKeys       names of the produced files, relative to the build's file directory
 * @param serializedSize total size in bytes of the produced files
 */
public record BuildResult(List<String> fileKeys, long serializedSize) {
  public BuildResult {
    fileKeys = List.copyOf(fileKeys);
  }
}
