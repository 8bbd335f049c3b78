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
package org.extdict.function.util;

import org.extdict.data.column.ColumnType;
import org.extdict.data.column.Columns;
import org.extdict.data.column.LongColumn;
import org.extdict.data.column.StringColumn;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link ColumnDataAdapter}.
 *
 * @author Bastian Gloeckle
 */
public class ColumnDataAdapterTest {
  @Test
  public void matchingTypeIsBorrowed() {
    // GIVEN
    LongColumn col = Columns.uint64(1, 2, 3);

    // WHEN
    long[] res = ColumnDataAdapter.getLongs(col, ColumnType.UINT64);

    // THEN
    Assert.assertSame(res, col.getData(), "Expected internal array to be returned");
  }

  @Test
  public void otherTypeIsConverted() {
    // GIVEN
    LongColumn col = new LongColumn(ColumnType.DATE, new long[] { 17000, 17001 });

    // WHEN
    long[] res = ColumnDataAdapter.getLongs(col, ColumnType.INT64);

    // THEN
    Assert.assertNotSame(res, col.getData(), "Expected a new array");
    Assert.assertEquals(res, new long[] { 17000, 17001 }, "Expected correct values");
  }

  @Test
  public void constantIsExpanded() {
    // WHEN
    long[] res = ColumnDataAdapter.getLongs(Columns.constantLong(ColumnType.UINT64, 7, 3), ColumnType.UINT64);

    // THEN
    Assert.assertEquals(res, new long[] { 7, 7, 7 }, "Expected one value per row");
  }

  @Test
  public void emptyConstant() {
    // WHEN
    long[] res = ColumnDataAdapter.getLongs(Columns.constantLong(ColumnType.UINT8, 7, 0), ColumnType.UINT64);

    // THEN
    Assert.assertEquals(res.length, 0, "Expected no values");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void stringsCannotBeConverted() {
    // WHEN
    ColumnDataAdapter.getLongs(new StringColumn(new String[] { "1" }), ColumnType.UINT64);

    // THEN: exception
  }
}
