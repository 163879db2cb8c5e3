package com.onthegomap.geoscene.reader;

import java.util.Locale;
import java.util.Objects;

/**
 * Error encountered while loading a geojson document.
 * <p>
 * Every error carries a {@link Kind} so callers can react to a specific failure without parsing the message.
 */
public class GeoJsonException extends RuntimeException {

  private final Kind kind;

  public GeoJsonException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public GeoJsonException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }

  /** Returns a short code for this error to use in logs, for example {@code "unknown_crs_name"}. */
  public String stat() {
    return kind.name().toLowerCase(Locale.ROOT);
  }

  /** The categories of failures that can occur while loading a document. */
  public enum Kind {
    /** A required input was {@code null}. */
    MISSING_ARGUMENT,
    /** The document's top-level {@code type} is not a geojson object type. */
    UNSUPPORTED_DOCUMENT_TYPE,
    /** A geometry's {@code type} is not a geojson geometry type. */
    UNKNOWN_GEOMETRY_TYPE,
    /** A {@code Feature} has no {@code geometry} member. */
    MISSING_GEOMETRY,
    /** A collection has no {@code features} or {@code geometries} array. */
    MISSING_MEMBER,
    /** A geometry's {@code coordinates} are absent or not nested the way its type requires. */
    INVALID_COORDINATES,
    /** The {@code crs} member is {@code null} or has no {@code properties}. */
    INVALID_CRS,
    /** A named crs is not registered. */
    UNKNOWN_CRS_NAME,
    /** No resolver is registered for a linked crs, or the resolver failed. */
    UNRESOLVABLE_CRS_LINK,
    /** The crs {@code type} is neither {@code name} nor {@code link}. */
    UNKNOWN_CRS_TYPE,
    /** The document could not be fetched from its URL. */
    FETCH_FAILURE,
    /** The document is not valid json. */
    INVALID_JSON
  }
}
