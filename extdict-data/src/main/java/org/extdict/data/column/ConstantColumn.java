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

import com.google.common.base.Preconditions;

/**
 * A {@link ConstantColumn} is a {@link Column} that has a single value for all rows.
 * 
 * <p>
 * The value is held in a vector column of exactly one row (the "data column"), the constant column then simply
 * reports a different number of rows.
 * 
 * <p>
 * For example if a function is executed with constant parameters only, it produces its result once and returns a
 * constant column with the number of rows of the input. Operators further down the line can then work on that single
 * value instead of on every row.
 *
 * @author Bastian Gloeckle
 */
public class ConstantColumn implements Column {
  private Column data;
  private int size;

  /**
   * @param data
   *          Column with exactly one row, must not be constant itself.
   * @param size
   *          Number of rows this constant column reports.
   */
  public ConstantColumn(Column data, int size) {
    Preconditions.checkArgument(data.size() == 1, "Data of constant column needs to have exactly one row.");
    Preconditions.checkArgument(!data.isConstant(), "Data of constant column must not be constant itself.");
    this.data = data;
    this.size = size;
  }

  /**
   * @return The column of one row holding the value.
   */
  public Column getDataColumn() {
    return data;
  }

  /**
   * @return The actual constant value that is valid for all rows.
   */
  public Object getValue() {
    return data.getValue(0);
  }

  @Override
  public ColumnType getType() {
    return data.getType();
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public Object getValue(int row) {
    return data.getValue(0);
  }

  @Override
  public long getLong(int row) throws UnsupportedOperationException {
    return data.getLong(0);
  }

  @Override
  public Column replicateRow(int row, int times) {
    return data.replicateRow(0, times);
  }

  @Override
  public Column convertToFullColumnIfConstant() {
    return data.replicateRow(0, size);
  }

  @Override
  public String getName() {
    return "ColumnConst(" + data.getName() + ")";
  }

  @Override
  public String toString() {
    return "Const[" + size + " x " + data.getValue(0) + "]";
  }
}
