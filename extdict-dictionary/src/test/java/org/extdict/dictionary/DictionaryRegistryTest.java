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
package org.extdict.dictionary;

import java.util.Arrays;

import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link DictionaryRegistry}.
 *
 * @author Bastian Gloeckle
 */
public class DictionaryRegistryTest {
  private DictionaryRegistry registry;

  @BeforeMethod
  public void before() {
    registry = new DictionaryRegistry();
  }

  private Dictionary dictionary(DictionaryKind kind) {
    Dictionary res = Mockito.mock(Dictionary.class);
    Mockito.when(res.getKind()).thenReturn(kind);
    Mockito.when(res.getTypeName()).thenReturn(kind.getTypeName());
    Mockito.when(res.getStructure()).thenReturn(new DictionaryStructure(Arrays.asList()));
    return res;
  }

  @Test
  public void addAndGet() {
    // GIVEN
    Dictionary dict = dictionary(DictionaryKind.FLAT);

    // WHEN
    registry.addDictionary("a", dict);

    // THEN
    Assert.assertSame(registry.getDictionary("a"), dict, "Expected registered dictionary");
    Assert.assertEquals(registry.getAllDictionaryNames(), Arrays.asList("a"), "Expected correct names");
  }

  @Test(expectedExceptions = DictionaryUnavailableException.class)
  public void missingDictionary() {
    registry.getDictionary("a");
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void addTwice() {
    registry.addDictionary("a", dictionary(DictionaryKind.FLAT));
    registry.addDictionary("a", dictionary(DictionaryKind.HASHED));
  }

  @Test
  public void replace() {
    // GIVEN
    Dictionary first = dictionary(DictionaryKind.FLAT);
    Dictionary second = dictionary(DictionaryKind.HASHED);
    registry.addDictionary("a", first);

    // WHEN
    registry.replaceDictionary("a", second);

    // THEN
    Assert.assertSame(registry.getDictionary("a"), second, "Expected new version of dictionary");
  }

  @Test(expectedExceptions = DictionaryUnavailableException.class)
  public void remove() {
    // GIVEN
    registry.addDictionary("a", dictionary(DictionaryKind.FLAT));

    // WHEN
    registry.removeDictionary("a");

    // THEN
    registry.getDictionary("a");
  }
}
