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

import java.util.Arrays;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.LongColumn;

/**
 * Provides the values of key columns as plain arrays of the type a dictionary expects.
 * 
 * <p>
 * If the column already stores its values as the requested type, its internal array is returned and must not be
 * changed by the caller. Otherwise a new array is filled by converting each value; constant columns are expanded to
 * their full row count.
 *
 * @author Bastian Gloeckle
 */
public class ColumnDataAdapter {
  private ColumnDataAdapter() {

  }

  /**
   * @param column
   *          A column whose values are represented by integers, see {@link ColumnType#isValueRepresentedByInteger()}.
   * @param targetType
   *          The integer type the values are needed as.
   * @return The values, one per row.
   * @throws IllegalArgumentException
   *           If the values of the column are not integers.
   */
  public static long[] getLongs(Column column, ColumnType targetType) throws IllegalArgumentException {
    if (!column.getType().isValueRepresentedByInteger())
      throw new IllegalArgumentException("Cannot convert " + column.getName() + " to " + targetType.getName());

    if (column instanceof LongColumn && column.getType() == targetType)
      return ((LongColumn) column).getData();

    long[] res = new long[column.size()];
    if (column.isConstant()) {
      if (res.length > 0)
        Arrays.fill(res, column.getLong(0));
      return res;
    }

    for (int i = 0; i < res.length; i++)
      res[i] = column.getLong(i);
    return res;
  }
}
