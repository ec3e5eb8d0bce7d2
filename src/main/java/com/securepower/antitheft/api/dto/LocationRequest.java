package com.securepower.antitheft.api.dto;

import com.securepower.antitheft.domain.tracking.LocationPoint;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

@Schema(description = "A location fix reported by the device")
public class LocationRequest {
  @NotNull @DecimalMin("-90.0") @DecimalMax("90.0") public Double lat;
  @NotNull @DecimalMin("-180.0") @DecimalMax("180.0") public Double lng;
  @PositiveOrZero public double accuracy;
  @Schema(description = "When the fix was taken; defaults to the time of receipt")
  public Instant timestamp;
  public Double speed;
  public Double bearing;
  public Double altitude;
  @Min(0) @Max(100) public Integer batteryLevel;
  @Size(max = 20) public String connectionType;

  // Stored timestamps have microsecond precision; later lookups by timestamp must match them exactly
  public LocationPoint toPoint(Instant receivedAt) {
    Instant takenAt = (timestamp != null ? timestamp : receivedAt).truncatedTo(ChronoUnit.MICROS);
    return new LocationPoint(lat, lng, accuracy, takenAt,
            speed, bearing, altitude, batteryLevel, connectionType, null);
  }

  public static Map<String, Object> toBody(LocationPoint p) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("lat", p.lat());
    body.put("lng", p.lng());
    body.put("accuracy", p.accuracy());
    body.put("timestamp", p.timestamp().toString());
    if (p.speed() != null) body.put("speed", p.speed());
    if (p.bearing() != null) body.put("bearing", p.bearing());
    if (p.altitude() != null) body.put("altitude", p.altitude());
    if (p.batteryLevel() != null) body.put("batteryLevel", p.batteryLevel());
    if (p.connectionType() != null) body.put("connectionType", p.connectionType());
    if (p.address() != null) body.put("address", p.address());
    return body;
  }
}
