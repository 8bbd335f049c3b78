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

import java.util.UUID;

/**
 * Utility methods for creating {@link Column}s.
 *
 * @author Bastian Gloeckle
 */
public class Columns {
  private Columns() {

  }

  /**
   * @return A vector column of zero rows of the given type. For {@link ColumnType#ARRAY} the result is an array of
   *         {@link ColumnType#UINT64}.
   * @throws IllegalArgumentException
   *           For {@link ColumnType#TUPLE}, as the element types are unknown.
   */
  public static Column createEmpty(ColumnType type) throws IllegalArgumentException {
    switch (type) {
    case FLOAT32:
    case FLOAT64:
      return new DoubleColumn(type, new double[0]);
    case STRING:
      return new StringColumn(new String[0]);
    case UUID:
      return new UuidColumn(new UUID[0]);
    case ARRAY:
      return new ArrayColumn(new LongColumn(ColumnType.UINT64, new long[0]), new long[0]);
    case TUPLE:
      throw new IllegalArgumentException("Cannot create empty tuple column without knowing its elements.");
    default:
      return new LongColumn(type, new long[0]);
    }
  }

  /**
   * @return A constant column of the given number of rows with the single value of the given one-row column.
   */
  public static ConstantColumn constant(Column singleRow, int rows) {
    return new ConstantColumn(singleRow, rows);
  }

  /**
   * @return A constant {@link ColumnType#STRING} column.
   */
  public static ConstantColumn constantString(String value, int rows) {
    return new ConstantColumn(new StringColumn(new String[] { value }), rows);
  }

  /**
   * @return A constant column of a type that is represented by an integer.
   */
  public static ConstantColumn constantLong(ColumnType type, long value, int rows) {
    return new ConstantColumn(new LongColumn(type, new long[] { value }), rows);
  }

  public static LongColumn uint64(long... values) {
    return new LongColumn(ColumnType.UINT64, values);
  }

  /**
   * @return {@link ColumnType#UINT8} column with 1 for each <code>true</code> and 0 for each <code>false</code> flag.
   */
  public static LongColumn fromFlags(boolean[] flags) {
    long[] res = new long[flags.length];
    for (int i = 0; i < flags.length; i++)
      res[i] = flags[i] ? 1L : 0L;
    return new LongColumn(ColumnType.UINT8, res);
  }

  /**
   * @return A new vector column containing the rows <code>[start, start + length)</code> of the given column
   *         <code>times</code> times one after the other.
   */
  public static Column repeatRange(Column data, int start, int length, int times) {
    int size = length * times;
    if (data instanceof LongColumn) {
      long[] src = ((LongColumn) data).getData();
      long[] res = new long[size];
      for (int i = 0; i < times; i++)
        System.arraycopy(src, start, res, i * length, length);
      return new LongColumn(data.getType(), res);
    }
    if (data instanceof DoubleColumn) {
      double[] src = ((DoubleColumn) data).getData();
      double[] res = new double[size];
      for (int i = 0; i < times; i++)
        System.arraycopy(src, start, res, i * length, length);
      return new DoubleColumn(data.getType(), res);
    }
    if (data instanceof StringColumn) {
      String[] src = ((StringColumn) data).getData();
      String[] res = new String[size];
      for (int i = 0; i < times; i++)
        System.arraycopy(src, start, res, i * length, length);
      return new StringColumn(res);
    }
    if (data instanceof UuidColumn) {
      UUID[] src = ((UuidColumn) data).getData();
      UUID[] res = new UUID[size];
      for (int i = 0; i < times; i++)
        System.arraycopy(src, start, res, i * length, length);
      return new UuidColumn(res);
    }
    throw new UnsupportedOperationException("Cannot repeat rows of " + data.getName());
  }
}
