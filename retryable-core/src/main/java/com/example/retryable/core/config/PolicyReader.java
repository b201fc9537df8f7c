package com.example.retryable.core.config;

import com.example.retryable.core.Retry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reads wrap-time {@link Retry.Policy} definitions from JSON using Jackson.
 *
 * <p>Document format:
 *
 * <pre>{@code
 * {
 *   "maxAttempts": 4,
 *   "noRetry": ["java.io.FileNotFoundException", "java.lang.IllegalArgumentException"]
 * }
 * }</pre>
 *
 * <p>Both fields are optional. Predicates cannot be expressed in JSON; add them with {@link
 * Retry.Policy#withPredicate}.
 */
public final class PolicyReader {

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private PolicyReader() {}

  /**
   * JSON shape of a policy.
   *
   * @param maxAttempts total attempts including the first, or null
   * @param noRetry fully qualified names of excluded failure types, or null
   */
  public record PolicyDocument(Integer maxAttempts, List<String> noRetry) {}

  /**
   * Sets the supplier of the {@link ObjectMapper} to use for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Parses a policy from a JSON string.
   *
   * @param json policy document
   * @return the parsed policy
   * @throws RuntimeException if the document cannot be parsed
   * @throws IllegalArgumentException if the document is {@code null} or a listed type is unknown or
   *     not a {@link Throwable}
   */
  public static Retry.Policy fromJson(final String json) {
    final PolicyDocument document;
    try {
      document = mapperSupplier.get().readValue(json, PolicyDocument.class);
    } catch (final IOException exception) {
      throw new RuntimeException("Failed to parse retry policy", exception);
    }
    return toPolicy(document);
  }

  /**
   * Parses a policy from a classpath resource.
   *
   * @param resource resource name, resolved against the class loader of this class
   * @return the parsed policy
   * @throws RuntimeException if the resource is missing or cannot be parsed
   * @throws IllegalArgumentException if a listed type is unknown or not a {@link Throwable}
   */
  public static Retry.Policy fromResource(final String resource) {
    final PolicyDocument document;
    try (InputStream in = PolicyReader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) throw new RuntimeException("Retry policy resource not found: " + resource);
      document = mapperSupplier.get().readValue(in, PolicyDocument.class);
    } catch (final IOException exception) {
      throw new RuntimeException("Failed to read retry policy " + resource, exception);
    }
    return toPolicy(document);
  }

  static Retry.Policy toPolicy(final PolicyDocument document) {
    if (document == null) throw new IllegalArgumentException("Retry policy document is empty");
    final var types = new HashSet<Class<? extends Throwable>>();
    if (document.noRetry() != null) {
      for (final var name : document.noRetry()) types.add(resolveType(name));
    }
    return new Retry.Policy(document.maxAttempts(), types, null);
  }

  static Class<? extends Throwable> resolveType(final String name) {
    if (name == null || name.isBlank())
      throw new IllegalArgumentException("noRetry entries must not be blank");

    final Class<?> type;
    try {
      type = Class.forName(name.trim(), false, PolicyReader.class.getClassLoader());
    } catch (final ClassNotFoundException e) {
      throw new IllegalArgumentException("Unknown failure type: " + name, e);
    }
    if (!Throwable.class.isAssignableFrom(type))
      throw new IllegalArgumentException(name + " is not a Throwable");
    return type.asSubclass(Throwable.class);
  }
}
