package io.intellixity.lingua.persistence.util;

import io.intellixity.lingua.persistence.backend.DefaultTranslationTypeProvider;
import io.intellixity.lingua.persistence.backend.TestTranslationTypeProvider;
import io.intellixity.lingua.persistence.backend.TranslationTypeProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LinguaFactoriesLoaderTest {
  @Test
  void loadsEveryListedImplementation() {
    List<TranslationTypeProvider> providers = LinguaFactoriesLoader.load(TranslationTypeProvider.class);
    assertEquals(2, providers.size());
    assertTrue(providers.stream().anyMatch(p -> p instanceof DefaultTranslationTypeProvider));
    assertTrue(providers.stream().anyMatch(p -> p instanceof TestTranslationTypeProvider));
  }

  @Test
  void unlistedSpiYieldsNothing() {
    assertTrue(LinguaFactoriesLoader.load(Runnable.class).isEmpty());
  }

  @Test
  void duplicateListingsAreCreatedOnce(@TempDir Path dir) throws Exception {
    String provider = DefaultTranslationTypeProvider.class.getName();
    try (URLClassLoader cl = factories(dir, provider + ", " + provider + ",")) {
      assertTrue(LinguaFactoriesLoader.implementationNames(TranslationTypeProvider.class, cl).contains(provider));
      long defaults = LinguaFactoriesLoader.load(TranslationTypeProvider.class, cl).stream()
          .filter(p -> p instanceof DefaultTranslationTypeProvider)
          .count();
      assertEquals(1, defaults);
    }
  }

  @Test
  void unknownOrIncompatibleClassesFail(@TempDir Path dir) throws Exception {
    try (URLClassLoader cl = factories(dir.resolve("missing"), "com.acme.Missing")) {
      IllegalStateException ex = assertThrows(IllegalStateException.class,
          () -> LinguaFactoriesLoader.load(TranslationTypeProvider.class, cl));
      assertTrue(ex.getMessage().contains("com.acme.Missing"));
    }
    try (URLClassLoader cl = factories(dir.resolve("wrong"), String.class.getName())) {
      assertThrows(IllegalStateException.class, () -> LinguaFactoriesLoader.load(TranslationTypeProvider.class, cl));
    }
  }

  private static URLClassLoader factories(Path root, String implementations) throws Exception {
    Path file = root.resolve(LinguaFactoriesLoader.RESOURCE);
    Files.createDirectories(file.getParent());
    Files.writeString(file, TranslationTypeProvider.class.getName() + "=" + implementations + "\n");
    return new URLClassLoader(new URL[]{root.toUri().toURL()}, LinguaFactoriesLoaderTest.class.getClassLoader());
  }
}
