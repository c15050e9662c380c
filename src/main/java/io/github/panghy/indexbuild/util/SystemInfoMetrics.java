package io.github.panghy.indexbuild.util;

import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.proto.GetMetricsRequest;
import io.github.panghy.indexbuild.proto.HardwareMetrics;
import io.github.panghy.indexbuild.proto.KeyValuePair;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Building blocks of the {@code system_info} metrics report shared by the coordinator and the
 * workers.
 */
public final class SystemInfoMetrics {
  private static final Logger LOG = LoggerFactory.getLogger(SystemInfoMetrics.class);

  public static final String SYSTEM_INFO = "system_info";
  public static final String UNIMPLEMENTED_METRIC = "sorry, but this metric type is not implemented";
  public static final String INDEX_COORD_ROLE = "indexcoord";
  public static final String INDEX_NODE_ROLE = "indexnode";

  private SystemInfoMetrics() {}

  /** {@code <role>-<id>}, e.g. {@code indexnode-7}. */
  public static String componentName(String role, long id) {
    return role + "-" + id;
  }

  /**
   * Rejects every metric type except {@link #SYSTEM_INFO}.
   *
   * @throws IndexBuildException with {@code UNEXPECTED_ERROR} for other or missing types
   */
  public static void checkMetricType(GetMetricsRequest request) {
    String type = request.getMetricType().trim();
    if (type.isEmpty()) throw IndexBuildException.unexpected("metric type is empty");
    if (!SYSTEM_INFO.equalsIgnoreCase(type)) throw IndexBuildException.unexpected(UNIMPLEMENTED_METRIC);
  }

  /** Processor, load and JVM heap figures of the current process. */
  public static HardwareMetrics hardware() {
    OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    Runtime rt = Runtime.getRuntime();
    return HardwareMetrics.newBuilder()
        .setIp(localAddress())
        .setCpuCoreCount(os.getAvailableProcessors())
        .setSystemLoadAverage(Math.max(0, os.getSystemLoadAverage()))
        .setMemory(rt.maxMemory())
        .setMemoryUsage(rt.totalMemory() - rt.freeMemory())
        .build();
  }

  /** Configuration entries sorted by key. */
  public static List<KeyValuePair> configurations(Map<String, String> values) {
    List<KeyValuePair> out = new ArrayList<>(values.size());
    for (Map.Entry<String, String> e : new TreeMap<>(values).entrySet()) {
      out.add(KeyValuePair.newBuilder().setKey(e.getKey()).setValue(e.getValue()).build());
    }
    return out;
  }

  private static String localAddress() {
    try {
      return InetAddress.getLocalHost().getHostAddress();
    } catch (UnknownHostException e) {
      LOG.debug("local host address unavailable, reporting loopback", e);
      return InetAddress.getLoopbackAddress().getHostAddress();
    }
  }
}
