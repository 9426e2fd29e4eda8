package ca.gc.cra.photonic.domain.job;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for {@link JobType#SCAN}.
 *
 * @param clusterGap maximum gap between modification times inside one timestamp cluster
 * @param minGroupSize smallest sequence or cluster reported as a group
 * @since 0.1.0
 */
public record ScanOptions(Duration clusterGap, int minGroupSize) implements JobOptions {
  public static final Duration DEFAULT_CLUSTER_GAP = Duration.ofSeconds(60);
  public static final int DEFAULT_MIN_GROUP_SIZE = 3;

  public ScanOptions {
    if (clusterGap == null || clusterGap.isNegative() || clusterGap.isZero()) {
      clusterGap = DEFAULT_CLUSTER_GAP;
    }
    if (minGroupSize <= 0) {
      minGroupSize = DEFAULT_MIN_GROUP_SIZE;
    }
  }

  public static ScanOptions defaults() {
    return new ScanOptions(DEFAULT_CLUSTER_GAP, DEFAULT_MIN_GROUP_SIZE);
  }

  @Override
  public JobType jobType() {
    return JobType.SCAN;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("clusterGapSeconds", clusterGap.toSeconds());
    map.put("minGroupSize", minGroupSize);
    return map;
  }
}
