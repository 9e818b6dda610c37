package io.intellixity.lingua.persistence.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Discovers lingua extensions from {@code META-INF/lingua.factories} resources.
 * <p>
 * A factories resource is a properties file mapping an SPI interface to implementation classes:
 *
 * <pre>
 * io.intellixity.lingua.persistence.backend.TranslationTypeProvider=com.acme.JsonTranslations,com.acme.Other
 * </pre>
 *
 * Resources are read in class path order; an implementation listed more than once is created once.
 */
public final class LinguaFactoriesLoader {
  public static final String RESOURCE = "META-INF/lingua.factories";

  private static final Logger log = LoggerFactory.getLogger(LinguaFactoriesLoader.class);

  private LinguaFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  /** One instance per listed implementation of {@code spiType}, in discovery order. */
  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = cl != null ? cl : LinguaFactoriesLoader.class.getClassLoader();

    Set<String> names = implementationNames(spiType, loader);
    List<T> out = new ArrayList<>(names.size());
    for (String name : names) out.add(instantiate(spiType, name, loader));

    if (log.isDebugEnabled()) {
      log.debug("lingua.factories spi={} implementations={}", spiType.getSimpleName(), names);
    }
    return out;
  }

  /** Implementation class names listed for {@code spiType} across every factories resource. */
  public static Set<String> implementationNames(Class<?> spiType, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String listed = read(url).getProperty(spiType.getName());
      if (listed == null) continue;
      Arrays.stream(listed.split(","))
          .map(String::trim)
          .filter(n -> !n.isEmpty())
          .forEach(names::add);
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE + " resources", e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(Class<T> spiType, String name, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(RESOURCE + " lists unknown class " + name + " for " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(type)) {
      throw new IllegalStateException(RESOURCE + " lists " + name + ", which is not a " + spiType.getName());
    }
    try {
      return spiType.cast(type.getDeclaredConstructor().newInstance());
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException(name + " needs a public no-arg constructor to be listed in " + RESOURCE, e);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create " + name + " for " + spiType.getName(), e);
    }
  }
}
