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

import com.google.common.base.Preconditions;

/**
 * Vector column of any type whose values are represented by an integer (see
 * {@link ColumnType#isValueRepresentedByInteger()}).
 *
 * @author Bastian Gloeckle
 */
public class LongColumn implements Column {
  private ColumnType type;
  private long[] data;

  public LongColumn(ColumnType type, long[] data) {
    Preconditions.checkArgument(type.isValueRepresentedByInteger(), "Type %s is not represented by an integer", type);
    this.type = type;
    this.data = data;
  }

  /**
   * @return The internal array, not copied.
   */
  public long[] getData() {
    return data;
  }

  @Override
  public ColumnType getType() {
    return type;
  }

  @Override
  public int size() {
    return data.length;
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  @Override
  public Object getValue(int row) {
    return data[row];
  }

  @Override
  public long getLong(int row) {
    return data[row];
  }

  @Override
  public Column replicateRow(int row, int times) {
    long[] res = new long[times];
    Arrays.fill(res, data[row]);
    return new LongColumn(type, res);
  }

  @Override
  public Column convertToFullColumnIfConstant() {
    return this;
  }

  @Override
  public String getName() {
    return "Column" + type.getName();
  }

  @Override
  public String toString() {
    return getName() + Arrays.toString(data);
  }
}
