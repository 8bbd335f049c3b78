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
package org.extdict.function.dict;

import org.extdict.data.column.ArrayColumn;
import org.extdict.data.column.ColumnType;
import org.extdict.dictionary.DictionaryKind;
import org.extdict.testutil.dictionary.TestSimpleKeyDictionary;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link HierarchyWalker}.
 *
 * @author Bastian Gloeckle
 */
public class HierarchyWalkerTest {
  private TestSimpleKeyDictionary geo() {
    return new TestSimpleKeyDictionary("regions", DictionaryKind.HASHED) //
        .hierarchicalAttribute("parent") //
        .attribute("name", ColumnType.STRING) //
        .row(100, 10, "Berlin") //
        .row(10, 1, "Germany") //
        .row(1, 0, "Europe") //
        .row(5, 7, "loopA") //
        .row(7, 5, "loopB") //
        .row(3, 3, "self");
  }

  @Test
  public void chainsUpToRoot() {
    // GIVEN
    HierarchyWalker walker = new HierarchyWalker(1000);

    // WHEN
    ArrayColumn res = walker.getHierarchies(geo(), new long[] { 100, 10, 1 });

    // THEN
    Assert.assertEquals(res.size(), 3, "Expected one array per id");
    Assert.assertEquals(res.getElementType(), ColumnType.UINT64, "Expected UInt64 elements");
    Assert.assertEquals(res.getLongs(0), new long[] { 100, 10, 1 }, "Expected correct chain");
    Assert.assertEquals(res.getLongs(1), new long[] { 10, 1 }, "Expected correct chain");
    Assert.assertEquals(res.getLongs(2), new long[] { 1 }, "Expected correct chain");
  }

  @Test
  public void cycleEnds() {
    // GIVEN
    HierarchyWalker walker = new HierarchyWalker(1000);

    // WHEN
    ArrayColumn res = walker.getHierarchies(geo(), new long[] { 5, 7, 3 });

    // THEN
    Assert.assertEquals(res.getLongs(0), new long[] { 5, 7 }, "Expected chain to end before repeated id");
    Assert.assertEquals(res.getLongs(1), new long[] { 7, 5 }, "Expected chain to end before repeated id");
    Assert.assertEquals(res.getLongs(2), new long[] { 3 }, "Expected self loop to end after the id itself");
  }

  @Test
  public void zeroAndUnknownIds() {
    // GIVEN
    HierarchyWalker walker = new HierarchyWalker(1000);

    // WHEN
    ArrayColumn res = walker.getHierarchies(geo(), new long[] { 0, 42, 10 });

    // THEN
    Assert.assertEquals(res.getArraySize(0), 0, "Expected empty chain for id 0");
    Assert.assertEquals(res.getLongs(1), new long[] { 42 }, "Expected chain of unknown id to contain the id only");
    Assert.assertEquals(res.getLongs(2), new long[] { 10, 1 }, "Expected correct chain");
    Assert.assertEquals(res.getOffsets(), new long[] { 0, 1, 3 }, "Expected correct offsets");
  }

  @Test
  public void inputNotChanged() {
    // GIVEN
    HierarchyWalker walker = new HierarchyWalker(1000);
    long[] ids = new long[] { 100, 5 };

    // WHEN
    walker.getHierarchies(geo(), ids);

    // THEN
    Assert.assertEquals(ids, new long[] { 100, 5 }, "Expected input ids to be unchanged");
  }

  @Test
  public void deeperThanWarnThreshold() {
    // GIVEN
    TestSimpleKeyDictionary deep =
        new TestSimpleKeyDictionary("deep", DictionaryKind.FLAT).hierarchicalAttribute("parent");
    for (long id = 1; id <= 20; id++)
      deep.row(id, id - 1);
    HierarchyWalker walker = new HierarchyWalker(5);

    // WHEN
    ArrayColumn res = walker.getHierarchies(deep, new long[] { 20, 2 });

    // THEN
    Assert.assertEquals(res.getArraySize(0), 20, "Expected full chain although it is deeper than the threshold");
    Assert.assertEquals(res.getLongs(0)[19], 1L, "Expected chain to end at root");
    Assert.assertEquals(res.getLongs(1), new long[] { 2, 1 }, "Expected correct chain");
  }

  @Test
  public void noIds() {
    // GIVEN
    HierarchyWalker walker = new HierarchyWalker(1000);

    // WHEN
    ArrayColumn res = walker.getHierarchies(geo(), new long[0]);

    // THEN
    Assert.assertEquals(res.size(), 0, "Expected empty result");
  }
}
