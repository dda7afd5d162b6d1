// com/position/fix/dto/Sample.java
package com.position.fix.dto;

import java.time.Instant;
import java.util.Objects;

/**
 * A single position reading emitted by the location provider.
 *
 * <p>A horizontal accuracy of zero or less means the provider has no fix yet. Such a sample is
 * still a valid reading for continuous-tracking consumers but never satisfies a one-shot request.
 *
 * @param coordinate the reported position
 * @param horizontalAccuracy radius of uncertainty in meters, smaller is better
 * @param timestamp when the provider produced the reading
 */
public record Sample(Coordinate coordinate, double horizontalAccuracy, Instant timestamp) {
  public Sample {
    Objects.requireNonNull(coordinate, "coordinate must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    if (!Double.isFinite(horizontalAccuracy)) {
      throw new IllegalArgumentException("Invalid horizontal accuracy value");
    }
  }

  public static Sample of(double latitude, double longitude, double horizontalAccuracy, Instant timestamp) {
    return new Sample(Coordinate.of(latitude, longitude), horizontalAccuracy, timestamp);
  }

  /**
   * Returns true if the provider reported an actual fix for this reading.
   */
  public boolean hasFix() {
    return horizontalAccuracy > 0;
  }

  /**
   * Returns true if this reading is strictly more accurate than the requested accuracy. A reading
   * exactly at the threshold does not qualify, and neither does a reading without a fix.
   *
   * @param desiredAccuracy requested accuracy in meters
   * @return whether the reading qualifies
   */
  public boolean satisfies(double desiredAccuracy) {
    return hasFix() && horizontalAccuracy < desiredAccuracy;
  }
}
