package com.position.fix.dto;

/**
 * A WGS84 latitude/longitude pair in decimal degrees.
 */
public record Coordinate(double latitude, double longitude) {
  public Coordinate {
    if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
      throw new IllegalArgumentException("Invalid latitude value");
    }
    if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
      throw new IllegalArgumentException("Invalid longitude value");
    }
  }

  public static Coordinate of(double latitude, double longitude) {
    return new Coordinate(latitude, longitude);
  }
}
