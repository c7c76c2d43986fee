package org.costwatch.alert.engine.anomaly.detector;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.util.Locale;
import lombok.Getter;

@Getter
public class AnomalyDetectorConfig {
  static final String LOOKBACK_DAYS_CONFIG = "lookback.days";
  static final String MIN_DATA_POINTS_CONFIG = "min.data.points";
  static final String SENSITIVITY_CONFIG = "sensitivity";
  static final String SCORE_SCALE_CONFIG = "score.scale";
  static final String EXPECTED_FLOOR_CONFIG = "expected.floor";
  static final String MIN_STDDEV_PERCENTAGE_CONFIG = "min.stddev.percentage";
  static final String RECORD_MIN_SCORE_CONFIG = "record.min.score";

  static final int MIN_LOOKBACK_DAYS = 7;
  static final int MAX_LOOKBACK_DAYS = 30;
  static final int DEFAULT_LOOKBACK_DAYS = 14;
  static final int DEFAULT_MIN_DATA_POINTS = 7;
  static final double DEFAULT_EXPECTED_FLOOR = 0.01;
  static final double DEFAULT_MIN_STDDEV_PERCENTAGE = 1.0;

  /** How many standard deviations saturate the score. */
  public enum Sensitivity {
    LOW(4.0),
    MEDIUM(3.0),
    HIGH(2.0);

    private final double scoreScale;

    Sensitivity(double scoreScale) {
      this.scoreScale = scoreScale;
    }

    public double getScoreScale() {
      return scoreScale;
    }
  }

  private final int lookbackDays;
  private final int minDataPoints;
  private final double scoreScale;
  private final double expectedFloor;
  private final double minStddevPercentage;
  private final double recordMinScore;

  private AnomalyDetectorConfig(
      int lookbackDays,
      int minDataPoints,
      double scoreScale,
      double expectedFloor,
      double minStddevPercentage,
      double recordMinScore) {
    Preconditions.checkArgument(minDataPoints >= 2, "min.data.points must be at least 2");
    Preconditions.checkArgument(scoreScale > 0, "score scale must be positive");
    Preconditions.checkArgument(expectedFloor > 0, "expected floor must be positive");
    this.lookbackDays = Math.max(MIN_LOOKBACK_DAYS, Math.min(MAX_LOOKBACK_DAYS, lookbackDays));
    this.minDataPoints = Math.min(minDataPoints, this.lookbackDays);
    this.scoreScale = scoreScale;
    this.expectedFloor = expectedFloor;
    this.minStddevPercentage = minStddevPercentage;
    this.recordMinScore = recordMinScore;
  }

  public static AnomalyDetectorConfig from(Config config) {
    Sensitivity sensitivity =
        config.hasPath(SENSITIVITY_CONFIG)
            ? Sensitivity.valueOf(config.getString(SENSITIVITY_CONFIG).toUpperCase(Locale.ROOT))
            : Sensitivity.MEDIUM;
    return new AnomalyDetectorConfig(
        config.hasPath(LOOKBACK_DAYS_CONFIG)
            ? config.getInt(LOOKBACK_DAYS_CONFIG)
            : DEFAULT_LOOKBACK_DAYS,
        config.hasPath(MIN_DATA_POINTS_CONFIG)
            ? config.getInt(MIN_DATA_POINTS_CONFIG)
            : DEFAULT_MIN_DATA_POINTS,
        config.hasPath(SCORE_SCALE_CONFIG)
            ? config.getDouble(SCORE_SCALE_CONFIG)
            : sensitivity.getScoreScale(),
        config.hasPath(EXPECTED_FLOOR_CONFIG)
            ? config.getDouble(EXPECTED_FLOOR_CONFIG)
            : DEFAULT_EXPECTED_FLOOR,
        config.hasPath(MIN_STDDEV_PERCENTAGE_CONFIG)
            ? config.getDouble(MIN_STDDEV_PERCENTAGE_CONFIG)
            : DEFAULT_MIN_STDDEV_PERCENTAGE,
        config.hasPath(RECORD_MIN_SCORE_CONFIG) ? config.getDouble(RECORD_MIN_SCORE_CONFIG) : 0.0);
  }
}
