package ca.gc.cra.photonic.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"in=/a", "--DRY-RUN", "-v", "out=/b", "--no-cache"});

    assertArrayEquals(new String[] {"in=/a", "out=/b"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--No-Cache"));
    assertFalse(input.help());
    assertFalse(input.quiet());
  }

  @Test
  void recognisesHelpAndQuietSpellings() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-q"}).quiet());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void dashedValueWithEqualsIsKeptAsArgument() {
    CliInput input = CliInput.parse(new String[] {"-x=1"});

    assertArrayEquals(new String[] {"-x=1"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }

  @Test
  void emptyInputHasNoFlags() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.hasFlag(""));
    assertFalse(input.hasFlag(null));
  }
}
