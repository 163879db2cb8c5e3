package com.onthegomap.geoscene.crs;

import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.geo.CoordinateTransform;
import com.onthegomap.geoscene.reader.GeoJsonException;
import com.onthegomap.geoscene.util.Exceptions;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the {@code crs} member of a geojson document to the {@link CoordinateTransform} that converts its coordinates
 * into Earth-fixed positions.
 * <p>
 * Three tables can be extended at runtime:
 * <ul>
 * <li>crs names (the {@code name} crs type) map directly to a transform</li>
 * <li>link {@code href} values map to a {@link CrsLinkResolver}</li>
 * <li>link {@code type} values map to a {@link CrsLinkResolver}, consulted only when no {@code href} matches</li>
 * </ul>
 * Register entries before issuing concurrent loads; lookups and registrations are not ordered against each other.
 *
 * @see <a href="https://geojson.org/geojson-spec.html#coordinate-reference-system-objects">2008 GeoJSON crs
 *      objects</a>
 */
@ThreadSafe
public class CrsRegistry {

  /** OGC name for WGS84 longitude/latitude degrees, the default when a document has no {@code crs} member. */
  public static final String CRS84 = "urn:ogc:def:crs:OGC:1.3:CRS84";
  public static final String EPSG_4326 = "EPSG:4326";

  private static final Logger LOGGER = LoggerFactory.getLogger(CrsRegistry.class);
  private static final CrsRegistry GLOBAL = withDefaults();

  private final CoordinateTransform defaultTransform;
  private final Map<String, CoordinateTransform> names = new ConcurrentHashMap<>();
  private final Map<String, CrsLinkResolver> linkHrefs = new ConcurrentHashMap<>();
  private final Map<String, CrsLinkResolver> linkTypes = new ConcurrentHashMap<>();

  private CrsRegistry(CoordinateTransform defaultTransform) {
    this.defaultTransform = Objects.requireNonNull(defaultTransform, "defaultTransform");
  }

  /** Returns a new registry that only knows the WGS84 names {@value #CRS84} and {@value #EPSG_4326}. */
  public static CrsRegistry withDefaults() {
    return new CrsRegistry(CoordinateTransform.WGS84)
      .registerName(CRS84, CoordinateTransform.WGS84)
      .registerName(EPSG_4326, CoordinateTransform.WGS84);
  }

  /** Returns the process-wide registry shared by data sources that are not given their own. */
  public static CrsRegistry global() {
    return GLOBAL;
  }

  public CoordinateTransform defaultTransform() {
    return defaultTransform;
  }

  /** Binds a crs {@code name} to {@code transform}, replacing any existing binding. */
  public CrsRegistry registerName(String name, CoordinateTransform transform) {
    names.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(transform, "transform"));
    return this;
  }

  /** Binds a crs link {@code href} to {@code resolver}, replacing any existing binding. */
  public CrsRegistry registerLinkHref(String href, CrsLinkResolver resolver) {
    linkHrefs.put(Objects.requireNonNull(href, "href"), Objects.requireNonNull(resolver, "resolver"));
    return this;
  }

  /** Binds a crs link {@code type} (for example {@code "proj4"}) to {@code resolver}. */
  public CrsRegistry registerLinkType(String type, CrsLinkResolver resolver) {
    linkTypes.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(resolver, "resolver"));
    return this;
  }

  public CoordinateTransform getName(String name) {
    return name == null ? null : names.get(name);
  }

  public CrsLinkResolver getLinkHref(String href) {
    return href == null ? null : linkHrefs.get(href);
  }

  public CrsLinkResolver getLinkType(String type) {
    return type == null ? null : linkTypes.get(type);
  }

  /**
   * Returns the transform to use for a document with the {@code crs} member {@code crs}.
   * <p>
   * A missing {@code crs} or a registered {@code name} resolve immediately, so the returned future is already complete.
   * Links resolve through their {@link CrsLinkResolver} which may complete later.
   *
   * @param crs the document's {@code crs} member, or {@code null} if it has none
   * @return a future completing with the transform, or failing with {@link GeoJsonException} of kind
   *         {@code UNRESOLVABLE_CRS_LINK} if a link resolver fails
   * @throws GeoJsonException if the crs member is malformed or refers to an unknown name or link
   */
  public CompletableFuture<CoordinateTransform> resolve(JsonNode crs) {
    if (crs == null || crs.isMissingNode()) {
      return CompletableFuture.completedFuture(defaultTransform);
    }
    if (crs.isNull()) {
      throw new GeoJsonException(INVALID_CRS, "crs is null.");
    }
    JsonNode properties = crs.get("properties");
    if (properties == null) {
      throw new GeoJsonException(INVALID_CRS, "crs.properties is undefined.");
    }
    if (!properties.isObject()) {
      throw new GeoJsonException(INVALID_CRS, "crs.properties must be an object, got: " + properties);
    }
    String type = text(crs.get("type"));
    if ("name".equals(type)) {
      String name = text(properties.get("name"));
      CoordinateTransform transform = getName(name);
      if (transform == null) {
        throw new GeoJsonException(UNKNOWN_CRS_NAME, "Unknown crs name: " + name);
      }
      LOGGER.debug("Using crs name {}", name);
      return CompletableFuture.completedFuture(transform);
    } else if ("link".equals(type)) {
      String href = text(properties.get("href"));
      CrsLinkResolver resolver = getLinkHref(href);
      if (resolver == null) {
        resolver = getLinkType(text(properties.get("type")));
      }
      if (resolver == null) {
        throw new GeoJsonException(UNRESOLVABLE_CRS_LINK, "Unable to resolve crs link: " + properties);
      }
      LOGGER.debug("Resolving crs link {}", properties);
      return resolveLink(resolver, properties);
    } else {
      throw new GeoJsonException(UNKNOWN_CRS_TYPE, "Unknown crs type: " + type);
    }
  }

  private static CompletableFuture<CoordinateTransform> resolveLink(CrsLinkResolver resolver, JsonNode properties) {
    CompletableFuture<CoordinateTransform> pending;
    try {
      pending = resolver.resolve(properties.deepCopy());
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(linkFailure(properties, e));
    }
    if (pending == null) {
      return CompletableFuture.failedFuture(
        new GeoJsonException(UNRESOLVABLE_CRS_LINK, "Resolver returned no result for crs link: " + properties));
    }
    return pending.handle((transform, error) -> {
      if (error != null) {
        throw linkFailure(properties, Exceptions.unwrap(error));
      } else if (transform == null) {
        throw new GeoJsonException(UNRESOLVABLE_CRS_LINK, "Resolver produced no transform for crs link: " + properties);
      }
      return transform;
    });
  }

  private static GeoJsonException linkFailure(JsonNode properties, Throwable cause) {
    return cause instanceof GeoJsonException geoJsonException ? geoJsonException :
      new GeoJsonException(UNRESOLVABLE_CRS_LINK, "Failed to resolve crs link: " + properties, cause);
  }

  private static String text(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }
}
