package com.onthegomap.geoscene;

import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.FETCH_FAILURE;
import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.INVALID_JSON;
import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.MISSING_ARGUMENT;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.geoscene.config.GeoSceneConfig;
import com.onthegomap.geoscene.crs.CrsRegistry;
import com.onthegomap.geoscene.entity.DefaultStyles;
import com.onthegomap.geoscene.entity.Entity;
import com.onthegomap.geoscene.entity.EntityCollection;
import com.onthegomap.geoscene.entity.EntityStore;
import com.onthegomap.geoscene.geo.CoordinateTransform;
import com.onthegomap.geoscene.reader.GeoJsonException;
import com.onthegomap.geoscene.reader.geojson.GeoJsonDispatcher;
import com.onthegomap.geoscene.reader.geojson.GeoJsonType;
import com.onthegomap.geoscene.util.Event;
import com.onthegomap.geoscene.util.Exceptions;
import com.onthegomap.geoscene.util.HttpJsonFetcher;
import com.onthegomap.geoscene.util.JsonFetcher;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads geojson documents into an {@link EntityStore}, replacing whatever the previous load produced.
 * <p>
 * Geojson has no styling of its own, so every entity receives a copy of the default point, line, or polygon template
 * for its geometry. Change the templates through {@link #getDefaultPoint()} and friends before loading.
 * <p>
 * For example:
 * <pre>{@code
 * var dataSource = new GeoJsonDataSource();
 * dataSource.getDefaultPoint().getPoint().setPixelSize(5d);
 * dataSource.getChangedEvent().addListener(source -> render(source.getEntities()));
 * dataSource.loadUrl("https://example.com/sample.geojson");
 * }</pre>
 * <p>
 * Loads are not ordered against each other: if a second load starts while a first is still resolving its crs, whichever
 * finishes last determines the contents of the store.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7946">GeoJSON specification (RFC 7946)</a>
 */
@NotThreadSafe
public class GeoJsonDataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonDataSource.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final EntityStore entities;
  private final CrsRegistry crsRegistry;
  private final JsonFetcher fetcher;
  private final DefaultStyles styles = new DefaultStyles();
  private final Event<GeoJsonDataSource> changed = new Event<>();
  private final Event<GeoJsonException> error = new Event<>();
  private volatile LoadState state = LoadState.IDLE;

  /** Creates a data source that uses the process-wide {@link CrsRegistry#global()} and default config. */
  public GeoJsonDataSource() {
    this(GeoSceneConfig.defaults());
  }

  public GeoJsonDataSource(GeoSceneConfig config) {
    this(new EntityCollection(), CrsRegistry.global(), new HttpJsonFetcher(config));
  }

  public GeoJsonDataSource(EntityStore entities, CrsRegistry crsRegistry, JsonFetcher fetcher) {
    this.entities = Objects.requireNonNull(entities, "entities");
    this.crsRegistry = Objects.requireNonNull(crsRegistry, "crsRegistry");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  /** Returns the entities produced by the most recent load. */
  public EntityStore getEntities() {
    return entities;
  }

  public CrsRegistry getCrsRegistry() {
    return crsRegistry;
  }

  /** Raised with this data source each time a load finishes populating the entity store. */
  public Event<GeoJsonDataSource> getChangedEvent() {
    return changed;
  }

  /** Raised when {@link #loadUrl(String)} fails to fetch its document. */
  public Event<GeoJsonException> getErrorEvent() {
    return error;
  }

  /** Geojson is a static format, so the entities never vary with time. */
  public boolean isTimeVarying() {
    return false;
  }

  public LoadState getState() {
    return state;
  }

  /** Template applied to {@code Point} and {@code MultiPoint} geometries. */
  public Entity getDefaultPoint() {
    return styles.getPoint();
  }

  public void setDefaultPoint(Entity defaultPoint) {
    styles.setPoint(defaultPoint);
  }

  /** Template applied to {@code LineString} and {@code MultiLineString} geometries. */
  public Entity getDefaultLine() {
    return styles.getLine();
  }

  public void setDefaultLine(Entity defaultLine) {
    styles.setLine(defaultLine);
  }

  /** Template applied to {@code Polygon} and {@code MultiPolygon} geometries. */
  public Entity getDefaultPolygon() {
    return styles.getPolygon();
  }

  public void setDefaultPolygon(Entity defaultPolygon) {
    styles.setPolygon(defaultPolygon);
  }

  /**
   * Fetches the geojson at {@code url} then loads it, replacing any existing entities.
   * <p>
   * If the document cannot be fetched, the {@link #getErrorEvent() error event} is raised, the entity store is left
   * alone, and the returned future completes normally. Errors loading a fetched document fail the returned future.
   *
   * @param url http(s) or file URL, or a path on disk
   * @return a future that completes when the document has been loaded
   * @throws GeoJsonException of kind {@code MISSING_ARGUMENT} if {@code url} is null
   */
  public CompletableFuture<Void> loadUrl(String url) {
    if (url == null) {
      throw new GeoJsonException(MISSING_ARGUMENT, "url is required.");
    }
    CompletableFuture<JsonNode> fetched;
    try {
      fetched = fetcher.fetchJson(url);
    } catch (RuntimeException e) {
      fetched = CompletableFuture.failedFuture(e);
    }
    CompletableFuture<Void> result = new CompletableFuture<>();
    fetched.whenComplete((json, fetchError) -> {
      if (fetchError != null) {
        Throwable cause = Exceptions.unwrap(fetchError);
        LOGGER.warn("Unable to fetch geojson from {}: {}", url, cause.toString());
        error.raise(new GeoJsonException(FETCH_FAILURE, "Unable to fetch " + url, cause));
        result.complete(null);
      } else {
        try {
          load(json, url).whenComplete((done, loadError) -> {
            if (loadError != null) {
              result.completeExceptionally(Exceptions.unwrap(loadError));
            } else {
              result.complete(null);
            }
          });
        } catch (RuntimeException e) {
          result.completeExceptionally(e);
        }
      }
    });
    return result;
  }

  /**
   * Parses {@code json} text and loads it.
   *
   * @throws GeoJsonException of kind {@code INVALID_JSON} if {@code json} cannot be parsed
   * @see #load(JsonNode, String)
   */
  public CompletableFuture<Void> load(String json, String source) {
    if (json == null) {
      throw new GeoJsonException(MISSING_ARGUMENT, "geoJson is required.");
    }
    JsonNode parsed;
    try {
      parsed = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new GeoJsonException(INVALID_JSON, "Invalid json from " + source, e);
    }
    return load(parsed, source);
  }

  public CompletableFuture<Void> load(JsonNode geoJson) {
    return load(geoJson, null);
  }

  /**
   * Loads a geojson document, replacing any existing entities.
   * <p>
   * The document's crs is resolved first and the entity store is only cleared once a transform is available, so a load
   * that fails on its crs leaves the previous entities in place. When the crs resolves immediately (no {@code crs}
   * member, or a registered name) the store is populated before this method returns and any error is thrown from it.
   * When a crs link resolves later, the store is populated then and errors fail the returned future.
   *
   * @param geoJson the document: a {@code Feature}, {@code FeatureCollection} or any geometry
   * @param source  where the document came from, used in logs, or {@code null}
   * @return a future that completes once the entity store has been populated
   * @throws GeoJsonException if the document is null, has an unsupported type, or an invalid crs
   */
  public CompletableFuture<Void> load(JsonNode geoJson, String source) {
    if (geoJson == null || geoJson.isNull() || geoJson.isMissingNode()) {
      throw new GeoJsonException(MISSING_ARGUMENT, "geoJson is required.");
    }
    GeoJsonType type = GeoJsonType.parseDocument(geoJson);

    state = LoadState.RESOLVING_CRS;
    CompletableFuture<CoordinateTransform> crs;
    try {
      crs = crsRegistry.resolve(geoJson.get("crs"));
    } catch (RuntimeException e) {
      state = LoadState.FAILED;
      throw e;
    }

    if (crs.isDone() && !crs.isCompletedExceptionally()) {
      populate(geoJson, type, crs.join(), source);
      return CompletableFuture.completedFuture(null);
    }
    LOGGER.debug("Waiting for crs of {} to resolve", source);
    return crs
      .thenAccept(transform -> populate(geoJson, type, transform, source))
      .whenComplete((done, failure) -> {
        if (failure != null) {
          state = LoadState.FAILED;
        }
      });
  }

  private void populate(JsonNode geoJson, GeoJsonType type, CoordinateTransform crs, String source) {
    state = LoadState.DISPATCHING;
    long start = System.nanoTime();
    entities.clear();
    try {
      new GeoJsonDispatcher(entities, styles, crs).dispatch(geoJson, type);
    } catch (RuntimeException e) {
      state = LoadState.FAILED;
      LOGGER.debug("Failed loading {} after {} entities", source, entities.size());
      throw e;
    }
    state = LoadState.DONE;
    LOGGER.info("Loaded {} entities from {} {} in {}ms", entities.size(), type.typeName(),
      source == null ? "document" : source, (System.nanoTime() - start) / 1_000_000);
    changed.raise(this);
  }
}
