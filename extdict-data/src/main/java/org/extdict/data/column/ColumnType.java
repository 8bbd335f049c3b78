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
 * Data types of the values held in a {@link Column}.
 * 
 * <p>
 * Unsigned integer types are held in a <code>long</code> like the signed ones, the bits of a {@link #UINT64} value
 * above {@link Long#MAX_VALUE} are therefore seen as a negative long in Java.
 *
 * @author Bastian Gloeckle
 */
public enum ColumnType {
  UINT8("UInt8", true, 1), //
  UINT16("UInt16", true, 2), //
  UINT32("UInt32", true, 4), //
  UINT64("UInt64", true, 8), //
  INT8("Int8", true, 1), //
  INT16("Int16", true, 2), //
  INT32("Int32", true, 4), //
  INT64("Int64", true, 8), //
  FLOAT32("Float32", false, 4), //
  FLOAT64("Float64", false, 8), //
  /** Days since epoch. */
  DATE("Date", true, 2), //
  /** Seconds since epoch. */
  DATETIME("DateTime", true, 4), //
  UUID("UUID", false, 16), //
  STRING("String", false, 0), //
  /** Composite value of multiple other columns, see {@link TupleColumn}. */
  TUPLE("Tuple", false, 0), //
  /** Array of values per row, see {@link ArrayColumn}. */
  ARRAY("Array", false, 0);

  private String name;
  private boolean valueRepresentedByInteger;
  private int sizeOfValueInMemory;

  private ColumnType(String name, boolean valueRepresentedByInteger, int sizeOfValueInMemory) {
    this.name = name;
    this.valueRepresentedByInteger = valueRepresentedByInteger;
    this.sizeOfValueInMemory = sizeOfValueInMemory;
  }

  /**
   * @return Name of the type as it is used in function names and error messages, e.g. "UInt64".
   */
  public String getName() {
    return name;
  }

  /**
   * @return <code>true</code> if the values are integers and can therefore be read using {@link Column#getLong(int)}.
   */
  public boolean isValueRepresentedByInteger() {
    return valueRepresentedByInteger;
  }

  /**
   * @return Number of bytes a value of this type takes up, 0 for types with variable size.
   */
  public int getSizeOfValueInMemory() {
    return sizeOfValueInMemory;
  }

  public boolean isFloatingPoint() {
    return this == FLOAT32 || this == FLOAT64;
  }

  @Override
  public String toString() {
    return name;
  }
}
