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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A column holding an array of values in each row.
 * 
 * <p>
 * The values of all rows are stored one after the other in a single flat data column. The offsets array contains for
 * each row the index in the data column where the array of that row <b>ends</b> (exclusive), the array of row i
 * therefore spans the data indices <code>[offsets[i - 1], offsets[i])</code> (with <code>offsets[-1] = 0</code>).
 *
 * @author Bastian Gloeckle
 */
public class ArrayColumn implements Column {
  private Column data;
  private long[] offsets;

  public ArrayColumn(Column data, long[] offsets) {
    Preconditions.checkArgument(!data.isConstant(), "Data of array column must not be constant.");
    Preconditions.checkArgument(offsets.length == 0 || offsets[offsets.length - 1] == data.size(),
        "Last offset needs to match the size of the data column.");
    this.data = data;
    this.offsets = offsets;
  }

  public Column getData() {
    return data;
  }

  /**
   * @return The internal offsets array, not copied.
   */
  public long[] getOffsets() {
    return offsets;
  }

  public ColumnType getElementType() {
    return data.getType();
  }

  private int start(int row) {
    return (row == 0) ? 0 : (int) offsets[row - 1];
  }

  /**
   * @return Number of elements in the array of the given row.
   */
  public int getArraySize(int row) {
    return (int) offsets[row] - start(row);
  }

  /**
   * @return The array of the given row as longs, only available if the element type is represented by integers.
   */
  public long[] getLongs(int row) throws UnsupportedOperationException {
    int start = start(row);
    long[] res = new long[getArraySize(row)];
    for (int i = 0; i < res.length; i++)
      res[i] = data.getLong(start + i);
    return res;
  }

  @Override
  public ColumnType getType() {
    return ColumnType.ARRAY;
  }

  @Override
  public int size() {
    return offsets.length;
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  /**
   * @return {@link List} of the values in the array of the given row.
   */
  @Override
  public Object getValue(int row) {
    int start = start(row);
    int end = (int) offsets[row];
    List<Object> res = new ArrayList<>(end - start);
    for (int i = start; i < end; i++)
      res.add(data.getValue(i));
    return res;
  }

  @Override
  public long getLong(int row) throws UnsupportedOperationException {
    throw new UnsupportedOperationException("Cannot get integer value of " + getName());
  }

  @Override
  public Column replicateRow(int row, int times) {
    int start = start(row);
    int len = getArraySize(row);

    Column newData;
    if (len == 0 || times == 0)
      newData = Columns.createEmpty(data.getType());
    else
      newData = Columns.repeatRange(data, start, len, times);
    long[] newOffsets = new long[times];
    for (int i = 0; i < times; i++)
      newOffsets[i] = (long) (i + 1) * len;
    return new ArrayColumn(newData, newOffsets);
  }

  @Override
  public Column convertToFullColumnIfConstant() {
    return this;
  }

  @Override
  public String getName() {
    return "ColumnArray(" + data.getName() + ")";
  }

  @Override
  public String toString() {
    return getName() + Arrays.toString(offsets);
  }
}
