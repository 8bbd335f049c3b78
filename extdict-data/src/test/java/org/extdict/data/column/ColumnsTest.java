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
package org.extdict.data.column;

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Columns} and the expansion of constant columns.
 *
 * @author Bastian Gloeckle
 */
public class ColumnsTest {
  @Test
  public void emptyColumns() {
    for (ColumnType type : ColumnType.values()) {
      if (type == ColumnType.TUPLE)
        continue;

      // WHEN
      Column col = Columns.createEmpty(type);

      // THEN
      Assert.assertEquals(col.size(), 0, "Expected empty column for " + type);
      Assert.assertEquals(col.getType(), type, "Expected correct type");
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void emptyTuple() {
    Columns.createEmpty(ColumnType.TUPLE);
  }

  @Test
  public void flags() {
    // WHEN
    LongColumn col = Columns.fromFlags(new boolean[] { true, false, true });

    // THEN
    Assert.assertEquals(col.getType(), ColumnType.UINT8, "Expected UInt8 column");
    Assert.assertEquals(col.getData(), new long[] { 1, 0, 1 }, "Expected correct values");
  }

  @Test
  public void constantToFull() {
    // GIVEN
    ConstantColumn constant = Columns.constantString("x", 3);

    // WHEN
    Column full = constant.convertToFullColumnIfConstant();

    // THEN
    Assert.assertFalse(full.isConstant(), "Expected vector column");
    Assert.assertEquals(((StringColumn) full).getData(), new String[] { "x", "x", "x" }, "Expected correct values");
  }

  @Test
  public void constantTupleToFull() {
    // GIVEN
    TupleColumn tuple =
        new TupleColumn(Arrays.asList(new StringColumn(new String[] { "a" }), Columns.uint64(5)));

    // WHEN
    Column full = Columns.constant(tuple, 2).convertToFullColumnIfConstant();

    // THEN
    Assert.assertTrue(full instanceof TupleColumn, "Expected tuple column");
    Assert.assertEquals(full.size(), 2, "Expected correct number of rows");
    Assert.assertEquals(full.getValue(1), Arrays.asList("a", 5L), "Expected correct values");
    Assert.assertEquals(((TupleColumn) full).getElementTypes(), Arrays.asList(ColumnType.STRING, ColumnType.UINT64),
        "Expected correct element types");
  }

  @Test
  public void replicateArrayRow() {
    // GIVEN
    ArrayColumn array = new ArrayColumn(Columns.uint64(1, 2, 3), new long[] { 1, 3 });

    // WHEN
    ArrayColumn replicated = (ArrayColumn) array.replicateRow(1, 3);

    // THEN
    Assert.assertEquals(replicated.size(), 3, "Expected correct number of rows");
    for (int i = 0; i < 3; i++)
      Assert.assertEquals(replicated.getLongs(i), new long[] { 2, 3 }, "Expected correct array in row " + i);
  }

  @Test
  public void replicateEmptyArrayRow() {
    // GIVEN
    ArrayColumn array = new ArrayColumn(Columns.uint64(1), new long[] { 0, 1 });

    // WHEN
    ArrayColumn replicated = (ArrayColumn) array.replicateRow(0, 2);

    // THEN
    Assert.assertEquals(replicated.size(), 2, "Expected correct number of rows");
    Assert.assertEquals(replicated.getArraySize(0), 0, "Expected empty array");
    Assert.assertEquals(replicated.getArraySize(1), 0, "Expected empty array");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void constantOfConstant() {
    Columns.constant(Columns.constantLong(ColumnType.UINT64, 1, 1), 3);
  }
}
