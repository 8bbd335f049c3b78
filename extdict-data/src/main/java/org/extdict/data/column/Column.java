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

/**
 * The values of a column for a block of rows.
 * 
 * <p>
 * A column is either a vector column holding one value per row, or a {@link ConstantColumn} which holds a single value
 * that is valid for all rows. Operators further down the line rely on constant columns staying constant, so functions
 * should return a constant column whenever their result is the same for all rows.
 * 
 * <p>
 * Columns are not changed after they have been created. Vector columns hand out their internal arrays without copying
 * them though, which means that callers must not change those arrays.
 *
 * @author Bastian Gloeckle
 */
public interface Column {
  /**
   * @return Data type of the values in this column.
   */
  public ColumnType getType();

  /**
   * @return Number of rows.
   */
  public int size();

  /**
   * @return <code>true</code> if this is a {@link ConstantColumn}.
   */
  public boolean isConstant();

  /**
   * @return The value of the given row as boxed java object.
   */
  public Object getValue(int row);

  /**
   * Generic numeric extraction of a value.
   * 
   * @throws UnsupportedOperationException
   *           if the values of this column cannot be represented as long.
   */
  public long getLong(int row) throws UnsupportedOperationException;

  /**
   * @return A new vector column holding the value of the given row <code>times</code> times.
   */
  public Column replicateRow(int row, int times);

  /**
   * @return A vector column with the same values as this column. If this column is a vector column already, this is
   *         returned.
   */
  public Column convertToFullColumnIfConstant();

  /**
   * @return A short human readable description of this column, used in error messages.
   */
  public String getName();
}
