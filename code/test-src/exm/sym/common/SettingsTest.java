/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sym.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sym.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    System.clearProperty(Settings.MAX_DEPTH);
    Settings.reset();
  }

  @Test
  public void testDefaults() throws Exception {
    assertEquals(2000, Settings.getLong(Settings.MAX_DEPTH));
    assertEquals(8, Settings.getLong(Settings.LOWER_POWER_EXPAND_LIMIT));
    assertTrue(Settings.getBoolean(Settings.PRINT_FACTORIZE));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("f", Settings.get(Settings.CODEGEN_PROC_NAME));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testSetAndReset() throws Exception {
    Settings.set(Settings.PRINT_FACTORIZE, "false");
    assertFalse(Settings.getBoolean(Settings.PRINT_FACTORIZE));
    Settings.reset();
    assertTrue(Settings.getBoolean(Settings.PRINT_FACTORIZE));
  }

  @Test
  public void testSystemPropertyOverride() throws Exception {
    System.setProperty(Settings.MAX_DEPTH, "17");
    Settings.initProperties();
    assertEquals(17, Settings.getLong(Settings.MAX_DEPTH));
  }

  @Test
  public void testInvalidBoolean() throws Exception {
    Settings.set(Settings.LOG_TRACE, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test
  public void testInvalidDepthRejected() throws Exception {
    System.setProperty(Settings.MAX_DEPTH, "0");
    exception.expect(InvalidOptionException.class);
    Settings.initProperties();
  }
}
