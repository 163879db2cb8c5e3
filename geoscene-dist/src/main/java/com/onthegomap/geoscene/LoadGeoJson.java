package com.onthegomap.geoscene;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.collect.ImmutableSortedMultiset;
import com.google.common.collect.Multiset;
import com.onthegomap.geoscene.config.Arguments;
import com.onthegomap.geoscene.config.GeoSceneConfig;
import com.onthegomap.geoscene.crs.CrsRegistry;
import com.onthegomap.geoscene.entity.EntityCollection;
import com.onthegomap.geoscene.reader.GeoJsonException;
import com.onthegomap.geoscene.util.Exceptions;
import com.onthegomap.geoscene.util.HttpJsonFetcher;
import com.onthegomap.geoscene.util.LogUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a geojson document from a URL or file, logs a summary of the entities it produced, and optionally writes them
 * to a json file.
 * <p>
 * To run:
 *
 * <pre>{@code
 * java -jar geoscene.jar load --input=data/sample.geojson
 * java -jar geoscene.jar export --input=data/sample.geojson --output=entities.json
 * }</pre>
 * {@code load} only logs the summary unless {@code output} is given, {@code export} requires it.
 */
public class LoadGeoJson {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoadGeoJson.class);
  private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
  private static final String OUTPUT_DESCRIPTION = "json file to write the loaded entities to";

  private LoadGeoJson() {}

  public static void main(String[] args) throws Exception {
    exit(run(Arguments.fromArgsOrConfigFile(args)));
  }

  /** Like {@link #main(String[])} but fails unless {@code output} is set. */
  public static void export(String[] args) throws Exception {
    exit(export(Arguments.fromArgsOrConfigFile(args)));
  }

  private static void exit(int status) {
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the load described by {@code arguments} and returns the process exit code. */
  static int run(Arguments arguments) throws IOException {
    return run(arguments, arguments.file("output", OUTPUT_DESCRIPTION, null));
  }

  /**
   * Runs the load described by {@code arguments} and writes the entities to {@code output}.
   *
   * @throws IllegalArgumentException if {@code output} is not set
   */
  static int export(Arguments arguments) throws IOException {
    return run(arguments, Path.of(arguments.getString("output", OUTPUT_DESCRIPTION)));
  }

  private static int run(Arguments arguments, Path output) throws IOException {
    GeoSceneConfig config = GeoSceneConfig.from(arguments);
    String input = arguments.getString("input", "URL or path of the geojson document to load");
    List<String> aliases = arguments.getList("crs_alias",
      "extra crs names to treat as WGS84 longitude/latitude", List.of());

    CrsRegistry crsRegistry = CrsRegistry.withDefaults();
    for (String alias : aliases) {
      crsRegistry.registerName(alias, crsRegistry.defaultTransform());
    }
    var dataSource = new GeoJsonDataSource(new EntityCollection(), crsRegistry, new HttpJsonFetcher(config));
    AtomicReference<GeoJsonException> fetchError = new AtomicReference<>();
    dataSource.getErrorEvent().addListener(fetchError::set);

    try {
      LogUtil.setStage("load");
      try {
        dataSource.loadUrl(input).join();
      } catch (RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        String code = cause instanceof GeoJsonException geoJsonException ? geoJsonException.stat() : "error";
        LOGGER.error("Failed to load {} [{}]: {}", input, code, cause.getMessage());
        return 1;
      }
      if (fetchError.get() != null) {
        LOGGER.error("Failed to fetch {} [{}]: {}", input, fetchError.get().stat(), fetchError.get().getCause());
        return 1;
      }

      Multiset<String> families = dataSource.getEntities().values().stream()
        .map(EntityExport::family)
        .collect(ImmutableSortedMultiset.toImmutableSortedMultiset(String::compareTo));
      LOGGER.info("Loaded {} entities from {}", dataSource.getEntities().size(), input);
      for (var family : families.entrySet()) {
        LOGGER.info("  {}: {}", family.getElement(), family.getCount());
      }

      if (output != null) {
        LogUtil.setStage("write");
        List<EntityExport> exported = dataSource.getEntities().values().stream()
          .map(EntityExport::from)
          .toList();
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        WRITER.writeValue(output.toFile(), exported);
        LOGGER.info("Wrote {} entities to {}", exported.size(), output);
      }
      return 0;
    } finally {
      LogUtil.clearStage();
    }
  }
}
