/**
 * extdict: External Dictionary Functions.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of extdict.
 *
 * extdict is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.extdict.config;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import org.extdict.context.AutoInstatiate;
import org.extdict.context.Profiles;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests that {@link ConfigurationPostProcessor} fills {@link Config} fields.
 *
 * @author Bastian Gloeckle
 */
public class ConfigurationPostProcessorTest {
  @Test
  public void valuesFromTestConfiguration() {
    // GIVEN
    try (AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext()) {
      ctx.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
      ctx.scan("org.extdict.config");

      // WHEN
      ctx.refresh();

      // THEN
      ConfiguredBean bean = ctx.getBean(ConfiguredBean.class);
      Assert.assertEquals(bean.getThreshold(), 5, "Expected value of test configuration");
      Assert.assertTrue(bean.isSkip(), "Expected value of test configuration");
    }
  }

  @Test
  public void defaultsWithoutConfiguration() {
    // GIVEN
    try (AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext()) {
      // no profile active: no ConfigurationManager.
      ctx.scan("org.extdict.config");

      // WHEN
      ctx.refresh();

      // THEN
      ConfiguredBean bean = ctx.getBean(ConfiguredBean.class);
      Assert.assertEquals(bean.getThreshold(), 17, "Expected value the bean was initialized with");
      Assert.assertFalse(bean.isSkip(), "Expected value the bean was initialized with");
    }
  }

  @Test
  public void configurationManagerReadsTestConfiguration() {
    // GIVEN
    ConfigurationManager manager = new ConfigurationManager();

    // WHEN
    manager.initialize();

    // THEN
    Assert.assertEquals(manager.getValue(ConfigKey.HIERARCHY_DEPTH_WARN_THRESHOLD), "5",
        "Expected value of test configuration");
    Assert.assertNull(manager.getValue("doesNotExist"), "Expected no value for unknown key");
  }

  @Test
  public void customFileOverridesClasspathConfiguration() throws IOException {
    // GIVEN
    File custom = File.createTempFile("extdict-custom", ".properties");
    custom.deleteOnExit();
    Files.write(custom.toPath(), Arrays.asList(ConfigKey.HIERARCHY_DEPTH_WARN_THRESHOLD + "=42"),
        StandardCharsets.UTF_8);
    ConfigurationManager manager = new ConfigurationManager();

    // WHEN
    System.setProperty(ConfigurationManager.CUSTOM_PROPERTIES_SYSTEM_PROPERTY, custom.getAbsolutePath());
    try {
      manager.initialize();
    } finally {
      System.clearProperty(ConfigurationManager.CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    }

    // THEN
    Assert.assertEquals(manager.getValue(ConfigKey.HIERARCHY_DEPTH_WARN_THRESHOLD), "42",
        "Expected value of custom file");
    Assert.assertEquals(manager.getValue(ConfigKey.EMPTY_BLOCK_SKIPS_DICTIONARY), "true",
        "Expected classpath value for key not in custom file");
  }

  @AutoInstatiate
  public static class ConfiguredBean {
    @Config(ConfigKey.HIERARCHY_DEPTH_WARN_THRESHOLD)
    private int threshold = 17;

    @Config(ConfigKey.EMPTY_BLOCK_SKIPS_DICTIONARY)
    private boolean skip = false;

    public int getThreshold() {
      return threshold;
    }

    public boolean isSkip() {
      return skip;
    }
  }
}
