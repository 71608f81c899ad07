package ca.gc.cra.prism.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"port=8888", "--USE-ENVIRONMENT", " ", "conf=/etc/prism.yaml"});

    assertArrayEquals(new String[] {"port=8888", "conf=/etc/prism.yaml"}, input.keyValueArgs());
    assertTrue(input.useEnvironment());
    assertTrue(input.hasFlag("--use-environment"));
    assertFalse(input.help());
    assertFalse(input.verbose());
  }

  @Test
  void helpAliasesAreNormalized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).hasFlag("--help"));
  }

  @Test
  void debugImpliesVerbose() {
    CliInput input = CliInput.parse(new String[] {"--debug"});

    assertTrue(input.debug());
    assertTrue(input.verbose());
    assertTrue(CliInput.parse(new String[] {"-v"}).verbose());
    assertFalse(CliInput.parse(new String[] {"-v"}).debug());
  }

  @Test
  void nullArgumentsProduceEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
    assertFalse(input.hasFlag(null));
  }
}
