package ca.gc.cra.rigging.spi;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rigging.workers.SyncWorker;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ClassNameTypeResolverTest {

  @Test
  void resolvesDottedAndColonNames() {
    TypeResolver resolver = ClassNameTypeResolver.withoutAliases();

    assertSame(StringBuilder.class, resolver.resolve("java.lang.StringBuilder"));
    assertSame(StringBuilder.class, resolver.resolve("java.lang:StringBuilder"));
    assertSame(StringBuilder.class, resolver.resolve("  java.lang.StringBuilder "));
  }

  @Test
  void resolvesAliases() {
    TypeResolver resolver = new ClassNameTypeResolver(
        Map.of("sync", "java.lang.Object"), getClass().getClassLoader());

    assertSame(Object.class, resolver.resolve("sync"));
  }

  @Test
  void standardResolverKnowsSyncAlias() {
    assertSame(SyncWorker.class, ClassNameTypeResolver.standard().resolve("sync"));
    assertSame(StringBuilder.class,
        ClassNameTypeResolver.standard().resolve("java.lang.StringBuilder"));
  }

  @Test
  void unknownTypeFailsWithCause() {
    TypeResolver resolver = ClassNameTypeResolver.withoutAliases();

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> resolver.resolve("no.such.Worker"));
    assertTrue(ex.getCause() instanceof ClassNotFoundException);
  }

  @Test
  void blankNameFails() {
    TypeResolver resolver = ClassNameTypeResolver.withoutAliases();

    assertThrows(IllegalArgumentException.class, () -> resolver.resolve(" "));
    assertThrows(IllegalArgumentException.class, () -> resolver.resolve(null));
  }
}
