package uk.ac.ebi.orthoviewer.ortholog_service.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import uk.ac.ebi.orthoviewer.ortholog_service.exceptions.DataNotFoundException;

/**
 * Component responsible for locating and opening the source files required by the application.
 *
 * <p>Locations are resolved through Spring's {@link ResourceLoader}, so configuration may point at
 * the file system ({@code file:}) or at the classpath ({@code classpath:}).
 */
@Component
public class DataFileReader {

  private final ResourceLoader resourceLoader;

  public DataFileReader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
  }

  /**
   * Returns whether a resource exists at the given location.
   *
   * @param location Spring resource location
   * @return true if the resource can be opened
   */
  public boolean exists(String location) {
    return location != null && resourceLoader.getResource(location).exists();
  }

  /**
   * Opens the resource and returns a UTF-8 buffered reader over its content.
   *
   * <p>The caller is responsible for closing the returned {@link BufferedReader}.
   *
   * @param location Spring resource location
   * @return a reader over the resource content
   * @throws DataNotFoundException if the resource does not exist or cannot be opened
   */
  public BufferedReader open(String location) {
    if (!exists(location)) {
      throw new DataNotFoundException("Data file not found: " + location);
    }
    Resource resource = resourceLoader.getResource(location);
    try {
      return new BufferedReader(
          new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new DataNotFoundException("Data file cannot be read: " + location, e);
    }
  }

  /**
   * Reads the whole resource as a UTF-8 string.
   *
   * @param location Spring resource location
   * @return file content
   * @throws DataNotFoundException if the resource does not exist or cannot be read
   */
  public String readAll(String location) {
    if (!exists(location)) {
      throw new DataNotFoundException("Data file not found: " + location);
    }
    try {
      return new String(
          resourceLoader.getResource(location).getInputStream().readAllBytes(),
          StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DataNotFoundException("Data file cannot be read: " + location, e);
    }
  }
}
