package io.github.panghy.indexbuild.worker;

/**
 * The index building algorithm. Implementations read the segment data named by the request, write
 * their files through {@link BuildContext#writeFile} and should return early once
 * {@link BuildContext#isCancelled()} turns true.
 */
@FunctionalInterface
public interface IndexBuilder {

  BuildResult build(BuildContext context) throws Exception;
}
