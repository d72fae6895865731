package com.gnovoa.livematch.positions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads and validates the pitch zone table.
 *
 * <p>The table location is configured via {@code positions.zones-resource} (any Spring resource
 * location) and is expected to be a JSON array of {@link PositionZone}.
 *
 * <p>Zones are kept in memory. The catalog is constructed once at application startup and fails
 * fast if the table is missing or invalid.
 */
public final class PositionZoneCatalog {

  private static final Logger log = LoggerFactory.getLogger(PositionZoneCatalog.class);

  private final List<PositionZone> zones;

  /**
   * Loads the configured zone table.
   *
   * @param mapper Jackson mapper used to deserialize the table
   * @param props position properties (includes the table location)
   * @throws IllegalStateException if the table cannot be read, parsed or validated
   */
  public PositionZoneCatalog(ObjectMapper mapper, PositionProperties props) {
    Resource resource = new DefaultResourceLoader().getResource(props.zonesResource());
    try (var in = resource.getInputStream()) {
      List<PositionZone> loaded = mapper.readValue(in, new TypeReference<List<PositionZone>>() {});
      validate(loaded, props.zonesResource());
      this.zones = List.copyOf(loaded);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load position zones from " + props.zonesResource(), e);
    }
    log.info("Loaded {} position zones from {}", zones.size(), props.zonesResource());
  }

  /** Builds a catalog from an already loaded table. */
  public PositionZoneCatalog(List<PositionZone> zones) {
    validate(zones, "inline table");
    this.zones = List.copyOf(zones);
  }

  /** @return zones in table order (never empty) */
  public List<PositionZone> zones() {
    return zones;
  }

  /**
   * Validates a zone table:
   *
   * <ul>
   *   <li>At least one zone
   *   <li>Unique, non-blank codes
   *   <li>Bounds within [0,100] with min not above max
   * </ul>
   */
  private static void validate(List<PositionZone> zones, String source) {
    if (zones == null || zones.isEmpty()) {
      throw new IllegalArgumentException("No position zones defined in " + source);
    }
    Set<String> codes = new HashSet<>();
    for (PositionZone z : zones) {
      if (z.code() == null || z.code().isBlank()) {
        throw new IllegalArgumentException("Zone without code in " + source);
      }
      if (!codes.add(z.code())) {
        throw new IllegalArgumentException("Duplicate zone " + z.code() + " in " + source);
      }
      if (z.minX() < 0 || z.maxX() > 100 || z.minY() < 0 || z.maxY() > 100
          || z.minX() > z.maxX() || z.minY() > z.maxY()) {
        throw new IllegalArgumentException("Zone " + z.code() + " has invalid bounds in " + source);
      }
    }
  }
}
