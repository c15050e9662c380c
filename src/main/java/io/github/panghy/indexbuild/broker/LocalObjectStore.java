package io.github.panghy.indexbuild.broker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * {@link ObjectStore} over a local directory. Object keys map to files below {@code baseDir};
 * blocking file I/O runs on the supplied executor.
 */
public final class LocalObjectStore implements ObjectStore {
  private final Path baseDir;
  private final String rootPath;
  private final Executor executor;

  public LocalObjectStore(Path baseDir, String rootPath) {
    this(baseDir, rootPath, ForkJoinPool.commonPool());
  }

  public LocalObjectStore(Path baseDir, String rootPath, Executor executor) {
    this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
    this.rootPath = Objects.requireNonNull(rootPath, "rootPath");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public String rootPath() {
    return rootPath;
  }

  @Override
  public CompletableFuture<Void> write(String key, byte[] data) {
    return io(() -> {
      Path p = resolve(key);
      Files.createDirectories(p.getParent());
      Files.write(p, data);
      return null;
    });
  }

  @Override
  public CompletableFuture<byte[]> read(String key) {
    return io(() -> Files.readAllBytes(resolve(key)));
  }

  @Override
  public CompletableFuture<List<String>> listWithPrefix(String prefix, boolean recursive) {
    return io(() -> {
      int slash = prefix.lastIndexOf('/');
      String dirKey = slash < 0 ? "" : prefix.substring(0, slash);
      String namePrefix = prefix.substring(slash + 1);
      Path dir = dirKey.isEmpty() ? baseDir : resolve(dirKey);
      if (!Files.isDirectory(dir)) return List.of();
      List<String> out = new ArrayList<>();
      try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
        for (Path child : children) {
          String name = child.getFileName().toString();
          if (!name.startsWith(namePrefix)) continue;
          String childKey = dirKey.isEmpty() ? name : dirKey + "/" + name;
          if (!Files.isDirectory(child)) {
            out.add(childKey);
          } else if (!recursive) {
            out.add(childKey + "/");
          } else {
            try (Stream<Path> walk = Files.walk(child)) {
              walk.filter(Files::isRegularFile).forEach(f -> out.add(toKey(f)));
            }
          }
        }
      }
      Collections.sort(out);
      return out;
    });
  }

  @Override
  public CompletableFuture<Void> remove(String key) {
    return io(() -> {
      Files.deleteIfExists(resolve(key));
      return null;
    });
  }

  @Override
  public CompletableFuture<Void> removeWithPrefix(String prefix) {
    return listWithPrefix(prefix, true).thenCompose(keys -> io(() -> {
      for (String key : keys) Files.deleteIfExists(resolve(key));
      // drop the emptied directory of a directory-style prefix
      if (prefix.endsWith("/")) deleteTree(resolve(prefix.substring(0, prefix.length() - 1)));
      return null;
    }));
  }

  private void deleteTree(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) return;
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(dir)) {
      paths = walk.sorted(Comparator.reverseOrder()).toList();
    }
    for (Path p : paths) Files.deleteIfExists(p);
  }

  private Path resolve(String key) {
    Path p = baseDir.resolve(key).normalize();
    if (!p.startsWith(baseDir)) throw new IllegalArgumentException("key escapes store: " + key);
    return p;
  }

  private String toKey(Path file) {
    return baseDir.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
  }

  private <T> CompletableFuture<T> io(IoCall<T> call) {
    Supplier<T> s = () -> {
      try {
        return call.run();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    };
    return CompletableFuture.supplyAsync(s, executor);
  }

  @FunctionalInterface
  private interface IoCall<T> {
    T run() throws IOException;
  }
}
