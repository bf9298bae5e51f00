package org.fwqpbo;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class AlgoParamsDeriverTest {

  @Test
  public void testDefaults() throws ConfigException {
    AlgoParams aPar = AlgoParamsDeriver.derive(new AlgoConfig());
    assertEquals(1, aPar.nR2);
    assertEquals(1.0, aPar.r2Step, 0);
    assertArrayEquals(new int[] {0}, aPar.iR2cand);
    assertEquals(1, aPar.nR2cand);
    assertEquals(AlgoParamsDeriver.NO_GRAPHCUT_LEVEL, aPar.graphcutLevel);
    assertEquals(10, aPar.maxICMupdate);
    assertFalse(aPar.fibSearch);
    assertFalse(aPar.use3D);
  }

  @Test
  public void testR2Discretization() throws ConfigException {
    AlgoConfig config = new AlgoConfig();
    config.nR2 = 11;
    config.r2Max = 100;
    config.r2Cand = Arrays.asList(25.0, 0.0, 29.0, 500.0, 20.0);
    AlgoParams aPar = AlgoParamsDeriver.derive(config);
    assertEquals(10.0, aPar.r2Step, 0);
    // 25 and 29 both map to 2, 500 is capped at nR2-1.
    assertArrayEquals(new int[] {0, 2, 10}, aPar.iR2cand);
    assertEquals(3, aPar.nR2cand);
  }

  @Test
  public void testGraphcutLevel() throws ConfigException {
    AlgoConfig config = new AlgoConfig();
    config.graphcut = true;
    assertEquals(0, AlgoParamsDeriver.derive(config).graphcutLevel);
  }

  @Test
  public void testMaxIcmUpdateRoundsHalfToEven() throws ConfigException {
    AlgoConfig config = new AlgoConfig();
    config.nB0 = 25;
    assertEquals(2, AlgoParamsDeriver.derive(config).maxICMupdate);
    config.nB0 = 35;
    assertEquals(4, AlgoParamsDeriver.derive(config).maxICMupdate);
    config.nB0 = 3;
    assertEquals(0, AlgoParamsDeriver.derive(config).maxICMupdate);
  }

  @Test
  public void testFlagsFromConfigFile() throws ConfigException {
    ConfigSection section = new ConfigSection(AlgoConfig.SECTION, null);
    section.put("use3D", "True");
    section.put("graphcut", "true");
    section.put("multiScale", "TRUE");
    section.put("fibSearch", "True");
    AlgoParams aPar = AlgoParamsDeriver.derive(AlgoConfig.parse(section));
    assertTrue(aPar.use3D);
    assertTrue(aPar.fibSearch);
    assertFalse(aPar.multiScale);
    assertEquals(AlgoParamsDeriver.NO_GRAPHCUT_LEVEL, aPar.graphcutLevel);
  }
}
