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
package org.extdict.data.value;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.ConstantColumn;

/**
 * Describes how values of a single {@link ColumnType} are held in memory and how columns of that type are built.
 * 
 * <p>
 * Code that needs to work on typed value arrays of arbitrary types (e.g. dictionary lookups returning values of the
 * type of an attribute) is written once against this class instead of once per type.
 * 
 * <p>
 * Available instances are in {@link ValueTypes}.
 *
 * @param <A>
 *          The array type holding multiple values of this type, e.g. <code>long[]</code>.
 * 
 * @author Bastian Gloeckle
 */
public abstract class ValueType<A> {
  private ColumnType columnType;

  protected ValueType(ColumnType columnType) {
    this.columnType = columnType;
  }

  public ColumnType getColumnType() {
    return columnType;
  }

  /**
   * @return Name of the type, e.g. "UInt64".
   */
  public String getName() {
    return columnType.getName();
  }

  public abstract A newArray(int length);

  public abstract int length(A array);

  /**
   * @return Boxed value at the given index.
   */
  public abstract Object get(A array, int idx);

  /**
   * Set a value in the given array.
   * 
   * @throws ClassCastException
   *           If the value has the wrong java type.
   */
  public abstract void set(A array, int idx, Object value) throws ClassCastException;

  /**
   * @return A vector column with the given values. The array is not copied.
   */
  public abstract Column createColumn(A data);

  /**
   * @return The internal array of the given column if it is a vector column of this type, <code>null</code> otherwise.
   */
  public abstract A getVectorData(Column column);

  /**
   * @return The value that is used if there is no "real" value, for example 0 for numbers.
   */
  public abstract Object getZeroValue();

  /**
   * @return A constant column holding the given value.
   */
  public ConstantColumn createConstantColumn(Object value, int rows) {
    A data = newArray(1);
    set(data, 0, value);
    return new ConstantColumn(createColumn(data), rows);
  }

  /**
   * @return <code>true</code> if the given column is a vector column with values of this type.
   */
  public boolean isVectorColumn(Column column) {
    return getVectorData(column) != null;
  }

  /**
   * @return <code>true</code> if the given column is a constant column with a value of this type.
   */
  public boolean isConstantColumn(Column column) {
    return column instanceof ConstantColumn && isVectorColumn(((ConstantColumn) column).getDataColumn());
  }

  @Override
  public String toString() {
    return getName();
  }
}
